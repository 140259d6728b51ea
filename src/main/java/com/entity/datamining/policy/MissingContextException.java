package com.entity.datamining.policy;

/**
 * Thrown when a source needs context that is neither in the request nor in the store.
 */
public class MissingContextException extends RuntimeException {

    private final String entityId;
    private final String contextKey;

    public MissingContextException(String entityId, String contextKey) {
        super("missing " + contextKey + " for " + entityId);
        this.entityId = entityId;
        this.contextKey = contextKey;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getContextKey() {
        return contextKey;
    }
}
