package com.entity.datamining.source;

import java.util.Map;

/**
 * Fetches one field of one entity from an external system.
 * Argument shaping (e.g. resolving a social handle) happens before the call; implementations
 * read what they need from {@code context}.
 */
@FunctionalInterface
public interface SourceFunction {

    /**
     * @param entityId the entity being fetched
     * @param context  free-form arguments, never null
     * @return the fetch outcome; implementations report failures here rather than throwing
     */
    FetchResult fetch(String entityId, Map<String, Object> context);
}
