package com.entity.datamining.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code orchestrator.fetch} (tag: source)</li>
 *   <li>{@code orchestrator.fetch.error} (tag: kind)</li>
 *   <li>{@code orchestrator.enrichment.task}</li>
 *   <li>{@code orchestrator.enrichment.entity} (tag: outcome)</li>
 *   <li>{@code orchestrator.request.duration} (tag: type)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter enrichmentTaskCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.enrichmentTaskCounter = Counter.builder("orchestrator.enrichment.task")
                .description("Number of enrichment tasks processed")
                .register(registry);
    }

    @Override
    public void incrementFetch(String source) {
        counter("orchestrator.fetch", "source", source, "Number of field responses served").increment();
    }

    @Override
    public void incrementFetchError(String kind) {
        counter("orchestrator.fetch.error", "kind", kind, "Number of failed field responses").increment();
    }

    @Override
    public void incrementEnrichmentTask() {
        enrichmentTaskCounter.increment();
    }

    @Override
    public void incrementEnrichmentEntity(String outcome) {
        counter("orchestrator.enrichment.entity", "outcome", outcome,
                "Per-entity outcomes of enrichment tasks").increment();
    }

    @Override
    public void recordRequestDuration(String requestType, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(requestType, k ->
                Timer.builder("orchestrator.request.duration")
                        .description("Duration of routed requests")
                        .tag("type", requestType)
                        .register(registry));
        timer.record(duration);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
