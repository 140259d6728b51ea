package com.entity.datamining.core.model;

/**
 * A classification dimension such as {@code party} or {@code ideology}.
 *
 * @param id       database ID
 * @param name     unique type name
 * @param multiple whether an entity may hold more than one category of this type
 */
public record CategoryType(long id, String name, boolean multiple) {
}
