package com.entity.datamining.core.model;

/**
 * Row of the {@code politicians} extension table, 1:1 with a politician {@link Entity}.
 */
public record PoliticianDetails(
        String entityId,
        String office,
        String state,
        String district,
        Integer electionYear,
        String bioguideId
) {
}
