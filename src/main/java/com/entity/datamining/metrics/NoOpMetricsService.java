package com.entity.datamining.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void incrementFetch(String source) {
    }

    @Override
    public void incrementFetchError(String kind) {
    }

    @Override
    public void incrementEnrichmentTask() {
    }

    @Override
    public void incrementEnrichmentEntity(String outcome) {
    }

    @Override
    public void recordRequestDuration(String requestType, Duration duration) {
    }
}
