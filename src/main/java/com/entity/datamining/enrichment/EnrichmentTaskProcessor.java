package com.entity.datamining.enrichment;

import com.entity.datamining.metrics.MetricsService;
import com.entity.datamining.metrics.NoOpMetricsService;
import com.entity.datamining.policy.FetchContextAssembler;
import com.entity.datamining.policy.MissingContextException;
import com.entity.datamining.source.FetchResult;
import com.entity.datamining.source.SourceFunction;
import com.entity.datamining.source.SourceRegistry;
import com.entity.datamining.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one enrichment task: fetches the task's field for every entity related to the
 * reference and stores each successful result.
 *
 * <p>A failure for one entity is logged and the remaining entities are still attempted.
 * Nothing is retried.</p>
 */
public class EnrichmentTaskProcessor {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentTaskProcessor.class);

    public static final int DEFAULT_RELEVANT_LIMIT = 10;
    public static final Duration DEFAULT_THROTTLE = Duration.ofMillis(200);

    private final EntityStore store;
    private final SourceRegistry registry;
    private final FetchContextAssembler contextAssembler;
    private final int relevantLimit;
    private final Duration throttle;
    private final MetricsService metrics;

    public EnrichmentTaskProcessor(EntityStore store, SourceRegistry registry) {
        this(store, registry, DEFAULT_RELEVANT_LIMIT, DEFAULT_THROTTLE, NoOpMetricsService.INSTANCE);
    }

    public EnrichmentTaskProcessor(EntityStore store, SourceRegistry registry, int relevantLimit,
                                   Duration throttle, MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        if (relevantLimit <= 0) {
            throw new IllegalArgumentException("relevantLimit must be positive");
        }
        if (throttle == null || throttle.isNegative()) {
            throw new IllegalArgumentException("throttle must not be negative");
        }
        this.contextAssembler = new FetchContextAssembler(store);
        this.relevantLimit = relevantLimit;
        this.throttle = throttle;
        this.metrics = metrics != null ? metrics : NoOpMetricsService.INSTANCE;
    }

    public EnrichmentOutcome process(FetchTask task) {
        metrics.incrementEnrichmentTask();
        if (!FetchTask.ENRICH.equals(task.type())) {
            log.warn("enrich.unsupportedTask type={}", task.type());
            return EnrichmentOutcome.none();
        }

        List<String> relevantIds = store.findRelevantEntities(task.entityType(), task.referenceId(), relevantLimit);
        Optional<SourceFunction> source = registry.lookup(task.entityType(), task.field());
        if (source.isEmpty() || relevantIds.isEmpty()) {
            log.warn("enrich.nothingToDo entityType={} field={} referenceId={} hasSource={} relevant={}",
                    task.entityType().getWireName(), task.field(), task.referenceId(),
                    source.isPresent(), relevantIds.size());
            return EnrichmentOutcome.none();
        }

        log.info("enrich.start field={} entities={}", task.field(), relevantIds.size());
        int updated = 0;
        int failed = 0;
        int skipped = 0;
        for (int i = 0; i < relevantIds.size(); i++) {
            if (i > 0 && !pause()) {
                log.warn("enrich.interrupted field={} remaining={}", task.field(), relevantIds.size() - i);
                break;
            }
            String outcome = enrichOne(task, relevantIds.get(i), source.get());
            metrics.incrementEnrichmentEntity(outcome);
            switch (outcome) {
                case "updated" -> updated++;
                case "skipped" -> skipped++;
                default -> failed++;
            }
        }
        log.info("enrich.done field={} updated={} failed={} skipped={}", task.field(), updated, failed, skipped);
        return new EnrichmentOutcome(relevantIds.size(), updated, failed, skipped);
    }

    private String enrichOne(FetchTask task, String entityId, SourceFunction source) {
        try {
            Map<String, Object> context;
            try {
                context = contextAssembler.assemble(task.entityType(), entityId, task.field(), Map.of());
            } catch (MissingContextException e) {
                log.warn("enrich.skip entityId={} field={} reason={}", entityId, task.field(), e.getMessage());
                return "skipped";
            }

            FetchResult result = source.fetch(entityId, context);
            if (result == null || !result.success()) {
                log.warn("enrich.fetchFailed entityId={} field={} error={}", entityId, task.field(),
                        result == null ? "no result" : result.error());
                return "failed";
            }
            if (!store.setField(task.entityType(), entityId, task.field(), result.data())) {
                log.warn("enrich.persistSkipped entityId={} field={}", entityId, task.field());
                return "failed";
            }
            log.debug("enrich.updated entityId={} field={}", entityId, task.field());
            return "updated";
        } catch (RuntimeException e) {
            log.error("enrich.error entityId={} field={} error={}", entityId, task.field(), e.getMessage(), e);
            return "error";
        }
    }

    private boolean pause() {
        if (throttle.isZero()) {
            return true;
        }
        try {
            Thread.sleep(throttle.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
