package com.entity.datamining.core.model;

/**
 * Physical backing of an {@link EntityField}.
 */
public enum FieldLocation {
    /** Column of the shared {@code entities} table. */
    BASE,
    /** Column of the {@code politicians} extension table. */
    POLITICIAN,
    /** Column of the {@code influencers} extension table. */
    INFLUENCER,
    /** Computed from category joins; read-only. */
    SYNTHETIC,
    /** JSON value fetched from an external source, kept in {@code entity_field_values}. */
    SOURCED
}
