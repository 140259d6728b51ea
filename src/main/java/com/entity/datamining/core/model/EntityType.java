package com.entity.datamining.core.model;

import java.util.Optional;

/**
 * Kinds of tracked political actors.
 * Each type maps to the value used in the {@code entities.entity_type} column and on the wire.
 */
public enum EntityType {
    POLITICIAN("politician"),
    INFLUENCER("influencer"),
    ORGANIZATION("organization");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Parses a wire name (case-insensitive).
     */
    public static Optional<EntityType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (EntityType type : values()) {
            if (type.wireName.equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
