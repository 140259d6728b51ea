package com.entity.datamining.enrichment;

/**
 * Per-task tally of what happened to each related entity.
 */
public record EnrichmentOutcome(int attempted, int updated, int failed, int skipped) {

    public static EnrichmentOutcome none() {
        return new EnrichmentOutcome(0, 0, 0, 0);
    }
}
