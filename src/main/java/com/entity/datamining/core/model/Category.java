package com.entity.datamining.core.model;

/**
 * A value within a {@link CategoryType}, e.g. {@code REPUBLICAN} for {@code party}.
 */
public record Category(long id, String categoryType, String code, String name) {
}
