package com.entity.datamining.core.model;

/**
 * Undirected link between two entities (mentions, endorses, opposes, ...).
 * Strength is in [0, 1] and orders relationship queries.
 */
public record EntityConnection(
        long id,
        String entity1Id,
        String entity2Id,
        String connectionType,
        double strength,
        String source
) {

    public EntityConnection {
        if (strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("strength must be between 0.0 and 1.0");
        }
    }
}
