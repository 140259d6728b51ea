package com.entity.datamining.core.model;

/**
 * Row of the {@code influencers} extension table, 1:1 with an influencer {@link Entity}.
 */
public record InfluencerDetails(
        String entityId,
        String platform,
        Long audienceSize,
        String contentFocus,
        double influenceScore
) {
}
