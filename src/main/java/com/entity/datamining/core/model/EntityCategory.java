package com.entity.datamining.core.model;

/**
 * Junction row assigning a {@link Category} to an entity.
 */
public record EntityCategory(String entityId, long categoryId, double confidenceScore, String source) {
}
