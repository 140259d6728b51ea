package com.entity.datamining.metrics;

import java.time.Duration;

/**
 * Interface for recording orchestrator metrics.
 * The default {@link NoOpMetricsService} does nothing, so the orchestrator runs
 * without a meter registry.
 */
public interface MetricsService {

    /**
     * Counts a served field response by its source ({@code local}, {@code external}, ...).
     */
    void incrementFetch(String source);

    /**
     * Counts a failed field response by error kind.
     */
    void incrementFetchError(String kind);

    void incrementEnrichmentTask();

    /**
     * Counts one per-entity outcome inside an enrichment task
     * ({@code updated}, {@code failed}, {@code skipped}, {@code error}).
     */
    void incrementEnrichmentEntity(String outcome);

    void recordRequestDuration(String requestType, Duration duration);
}
