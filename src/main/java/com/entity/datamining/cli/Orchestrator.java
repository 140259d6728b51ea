package com.entity.datamining.cli;

import com.entity.datamining.config.OrchestratorOptions;
import com.entity.datamining.enrichment.BackgroundEnrichmentQueue;
import com.entity.datamining.enrichment.EnrichmentTaskProcessor;
import com.entity.datamining.metrics.MetricsService;
import com.entity.datamining.metrics.NoOpMetricsService;
import com.entity.datamining.policy.FetchPolicyEngine;
import com.entity.datamining.policy.StalenessPolicy;
import com.entity.datamining.router.RequestRouter;
import com.entity.datamining.source.NoOpPostEvaluator;
import com.entity.datamining.source.OllamaPostEvaluator;
import com.entity.datamining.source.PostEvaluator;
import com.entity.datamining.source.RefreshTool;
import com.entity.datamining.source.SourceRegistry;
import com.entity.datamining.store.EntityStore;
import com.entity.datamining.store.SqliteEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the store, fetch policy, enrichment queue and router from {@link OrchestratorOptions}.
 * Owns the store and the queue worker; {@link #close()} stops the worker and closes the store.
 */
public class Orchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final OrchestratorOptions options;
    private final EntityStore store;
    private final BackgroundEnrichmentQueue queue;
    private final RequestRouter router;

    private Orchestrator(OrchestratorOptions options, EntityStore store, BackgroundEnrichmentQueue queue,
                         RequestRouter router) {
        this.options = options;
        this.store = store;
        this.queue = queue;
        this.router = router;
    }

    public EntityStore getStore() {
        return store;
    }

    public BackgroundEnrichmentQueue getQueue() {
        return queue;
    }

    public RequestRouter getRouter() {
        return router;
    }

    /**
     * Starts the enrichment worker.
     */
    public void start() {
        queue.start();
    }

    @Override
    public void close() {
        if (!queue.stop(options.getStopTimeout())) {
            log.warn("orchestrator.close workerStillRunning pending={}", queue.size());
        }
        store.close();
    }

    public static Builder builder(OrchestratorOptions options) {
        return new Builder(options);
    }

    public static class Builder {
        private final OrchestratorOptions options;
        private EntityStore store;
        private SourceRegistry registry = SourceRegistry.empty();
        private RefreshTool refreshTool;
        private PostEvaluator evaluator;
        private MetricsService metrics = NoOpMetricsService.INSTANCE;
        private Clock clock = Clock.systemUTC();

        private Builder(OrchestratorOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
        }

        /**
         * Uses an existing store instead of opening the configured database.
         */
        public Builder store(EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder registry(SourceRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry is required");
            return this;
        }

        public Builder refreshTool(RefreshTool refreshTool) {
            this.refreshTool = refreshTool;
            return this;
        }

        public Builder evaluator(PostEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public Orchestrator build() {
            EntityStore entityStore = store != null
                    ? store
                    : SqliteEntityStore.open(options.getDatabasePath(), options.getCategoryCacheTtl(), clock);

            EnrichmentTaskProcessor processor = new EnrichmentTaskProcessor(entityStore, registry,
                    options.getRelevantLimit(), options.getThrottle(), metrics);
            BackgroundEnrichmentQueue queue = new BackgroundEnrichmentQueue(processor, options.getPollInterval());

            FetchPolicyEngine engine = FetchPolicyEngine.builder()
                    .store(entityStore)
                    .registry(registry)
                    .taskQueue(queue)
                    .refreshTool(refreshTool != null ? refreshTool : unavailableRefreshTool())
                    .stalenessPolicy(new StalenessPolicy(options.getStalenessTtls(), clock))
                    .backgroundFields(options.getBackgroundFields())
                    .metrics(metrics)
                    .clock(clock)
                    .build();

            RequestRouter router = new RequestRouter(engine, entityStore, registry, resolveEvaluator(),
                    options.getSearchDefaultLimit(), metrics, clock);
            log.info("orchestrator.wired db={} backgroundFields={} ttls={}",
                    options.getDatabasePath(), options.getBackgroundFields(), options.getStalenessTtls().keySet());
            return new Orchestrator(options, entityStore, queue, router);
        }

        private PostEvaluator resolveEvaluator() {
            if (evaluator != null) {
                return evaluator;
            }
            if (options.isOllamaEnabled()) {
                return OllamaPostEvaluator.builder()
                        .baseUrl(options.getOllamaBaseUrl())
                        .model(options.getOllamaModel())
                        .timeout(options.getOllamaTimeout())
                        .build();
            }
            return new NoOpPostEvaluator();
        }

        private static RefreshTool unavailableRefreshTool() {
            return force -> {
                log.warn("orchestrator.refreshTool notConfigured force={}", force);
                return false;
            };
        }
    }
}
