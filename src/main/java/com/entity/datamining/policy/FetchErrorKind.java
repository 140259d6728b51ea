package com.entity.datamining.policy;

/**
 * Classification of failed responses.
 */
public enum FetchErrorKind {
    /** Required context such as a social handle could not be resolved. */
    MISSING_CONTEXT,
    /** No source is registered for the entity type and field. */
    NO_FETCH_FUNCTION,
    /** The source reported a failure or threw. */
    EXTERNAL_FETCH_FAILED,
    /** The refresh tool failed before a forced voting record fetch. */
    REFRESH_TOOL_FAILED,
    /** The entity store could not be read. */
    STORAGE_ERROR
}
