package com.entity.datamining.config;

import com.entity.datamining.enrichment.BackgroundEnrichmentQueue;
import com.entity.datamining.enrichment.EnrichmentTaskProcessor;
import com.entity.datamining.policy.FetchPolicyEngine;
import com.entity.datamining.router.RequestRouter;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Options for the orchestrator process.
 * Configures storage, the background-only field set, staleness TTLs, the enrichment queue
 * and the post evaluator.
 */
public class OrchestratorOptions {

    public static final String PREFIX = "orchestrator.";
    static final String TTL_PREFIX = PREFIX + "staleness.ttl.";

    private static final Path DEFAULT_DATABASE_PATH = Path.of("data", "political_data.db");
    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_CATEGORY_CACHE_TTL = Duration.ofMinutes(10);
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_OLLAMA_MODEL = "llama3.2";
    private static final Duration DEFAULT_OLLAMA_TIMEOUT = Duration.ofSeconds(60);

    private final Path databasePath;
    private final Set<String> backgroundFields;
    private final Map<String, Duration> stalenessTtls;
    private final Duration pollInterval;
    private final Duration throttle;
    private final Duration stopTimeout;
    private final int relevantLimit;
    private final int searchDefaultLimit;
    private final Duration categoryCacheTtl;
    private final boolean ollamaEnabled;
    private final String ollamaBaseUrl;
    private final String ollamaModel;
    private final Duration ollamaTimeout;

    private OrchestratorOptions(Builder builder) {
        this.databasePath = builder.databasePath;
        this.backgroundFields = Set.copyOf(builder.backgroundFields);
        this.stalenessTtls = Map.copyOf(builder.stalenessTtls);
        this.pollInterval = builder.pollInterval;
        this.throttle = builder.throttle;
        this.stopTimeout = builder.stopTimeout;
        this.relevantLimit = builder.relevantLimit;
        this.searchDefaultLimit = builder.searchDefaultLimit;
        this.categoryCacheTtl = builder.categoryCacheTtl;
        this.ollamaEnabled = builder.ollamaEnabled;
        this.ollamaBaseUrl = builder.ollamaBaseUrl;
        this.ollamaModel = builder.ollamaModel;
        this.ollamaTimeout = builder.ollamaTimeout;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public Set<String> getBackgroundFields() {
        return backgroundFields;
    }

    public Map<String, Duration> getStalenessTtls() {
        return stalenessTtls;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getThrottle() {
        return throttle;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public int getRelevantLimit() {
        return relevantLimit;
    }

    public int getSearchDefaultLimit() {
        return searchDefaultLimit;
    }

    public Duration getCategoryCacheTtl() {
        return categoryCacheTtl;
    }

    public boolean isOllamaEnabled() {
        return ollamaEnabled;
    }

    public String getOllamaBaseUrl() {
        return ollamaBaseUrl;
    }

    public String getOllamaModel() {
        return ollamaModel;
    }

    public Duration getOllamaTimeout() {
        return ollamaTimeout;
    }

    /**
     * Creates default options.
     */
    public static OrchestratorOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from MicroProfile Config. Keys live under {@code orchestrator.}; missing
     * keys keep their defaults. Staleness TTLs are given in seconds per field, e.g.
     * {@code orchestrator.staleness.ttl.metrics=3600}.
     */
    public static OrchestratorOptions fromConfig(Config config) {
        Builder builder = builder();
        config.getOptionalValue(PREFIX + "database.path", String.class)
                .ifPresent(p -> builder.databasePath(Path.of(p)));
        config.getOptionalValues(PREFIX + "background-fields", String.class)
                .ifPresent(fields -> builder.backgroundFields(new LinkedHashSet<>(fields)));
        config.getOptionalValue(PREFIX + "queue.poll-interval-ms", Long.class)
                .ifPresent(ms -> builder.pollInterval(Duration.ofMillis(ms)));
        config.getOptionalValue(PREFIX + "queue.throttle-ms", Long.class)
                .ifPresent(ms -> builder.throttle(Duration.ofMillis(ms)));
        config.getOptionalValue(PREFIX + "queue.stop-timeout-ms", Long.class)
                .ifPresent(ms -> builder.stopTimeout(Duration.ofMillis(ms)));
        config.getOptionalValue(PREFIX + "queue.relevant-limit", Integer.class)
                .ifPresent(builder::relevantLimit);
        config.getOptionalValue(PREFIX + "search.default-limit", Integer.class)
                .ifPresent(builder::searchDefaultLimit);
        config.getOptionalValue(PREFIX + "category-cache.ttl-seconds", Long.class)
                .ifPresent(s -> builder.categoryCacheTtl(Duration.ofSeconds(s)));
        config.getOptionalValue(PREFIX + "evaluator.ollama.enabled", Boolean.class)
                .ifPresent(builder::ollamaEnabled);
        config.getOptionalValue(PREFIX + "evaluator.ollama.base-url", String.class)
                .ifPresent(builder::ollamaBaseUrl);
        config.getOptionalValue(PREFIX + "evaluator.ollama.model", String.class)
                .ifPresent(builder::ollamaModel);
        config.getOptionalValue(PREFIX + "evaluator.ollama.timeout-seconds", Long.class)
                .ifPresent(s -> builder.ollamaTimeout(Duration.ofSeconds(s)));

        for (String name : config.getPropertyNames()) {
            if (name.startsWith(TTL_PREFIX) && name.length() > TTL_PREFIX.length()) {
                long seconds = config.getValue(name, Long.class);
                builder.stalenessTtl(name.substring(TTL_PREFIX.length()), Duration.ofSeconds(seconds));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path databasePath = DEFAULT_DATABASE_PATH;
        private Set<String> backgroundFields = FetchPolicyEngine.DEFAULT_BACKGROUND_FIELDS;
        private final Map<String, Duration> stalenessTtls = new HashMap<>();
        private Duration pollInterval = BackgroundEnrichmentQueue.DEFAULT_POLL_INTERVAL;
        private Duration throttle = EnrichmentTaskProcessor.DEFAULT_THROTTLE;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private int relevantLimit = EnrichmentTaskProcessor.DEFAULT_RELEVANT_LIMIT;
        private int searchDefaultLimit = RequestRouter.DEFAULT_SEARCH_LIMIT;
        private Duration categoryCacheTtl = DEFAULT_CATEGORY_CACHE_TTL;
        private boolean ollamaEnabled = false;
        private String ollamaBaseUrl = DEFAULT_OLLAMA_BASE_URL;
        private String ollamaModel = DEFAULT_OLLAMA_MODEL;
        private Duration ollamaTimeout = DEFAULT_OLLAMA_TIMEOUT;

        public Builder databasePath(Path databasePath) {
            this.databasePath = Objects.requireNonNull(databasePath, "databasePath is required");
            return this;
        }

        public Builder backgroundFields(Set<String> backgroundFields) {
            this.backgroundFields = Objects.requireNonNull(backgroundFields, "backgroundFields is required");
            return this;
        }

        public Builder stalenessTtl(String field, Duration ttl) {
            requirePositive(ttl, "staleness TTL for " + field);
            this.stalenessTtls.put(field, ttl);
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = requirePositive(pollInterval, "pollInterval");
            return this;
        }

        public Builder throttle(Duration throttle) {
            if (throttle == null || throttle.isNegative()) {
                throw new IllegalArgumentException("throttle must not be negative");
            }
            this.throttle = throttle;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = requirePositive(stopTimeout, "stopTimeout");
            return this;
        }

        public Builder relevantLimit(int relevantLimit) {
            if (relevantLimit <= 0) {
                throw new IllegalArgumentException("relevantLimit must be positive");
            }
            this.relevantLimit = relevantLimit;
            return this;
        }

        public Builder searchDefaultLimit(int searchDefaultLimit) {
            if (searchDefaultLimit <= 0) {
                throw new IllegalArgumentException("searchDefaultLimit must be positive");
            }
            this.searchDefaultLimit = searchDefaultLimit;
            return this;
        }

        public Builder categoryCacheTtl(Duration categoryCacheTtl) {
            this.categoryCacheTtl = requirePositive(categoryCacheTtl, "categoryCacheTtl");
            return this;
        }

        public Builder ollamaEnabled(boolean ollamaEnabled) {
            this.ollamaEnabled = ollamaEnabled;
            return this;
        }

        public Builder ollamaBaseUrl(String ollamaBaseUrl) {
            this.ollamaBaseUrl = Objects.requireNonNull(ollamaBaseUrl, "ollamaBaseUrl is required");
            return this;
        }

        public Builder ollamaModel(String ollamaModel) {
            this.ollamaModel = Objects.requireNonNull(ollamaModel, "ollamaModel is required");
            return this;
        }

        public Builder ollamaTimeout(Duration ollamaTimeout) {
            this.ollamaTimeout = requirePositive(ollamaTimeout, "ollamaTimeout");
            return this;
        }

        public OrchestratorOptions build() {
            return new OrchestratorOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
