package com.entity.datamining.router;

import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.logging.LogContext;
import com.entity.datamining.metrics.MetricsService;
import com.entity.datamining.metrics.NoOpMetricsService;
import com.entity.datamining.policy.FetchContextAssembler;
import com.entity.datamining.policy.FetchPolicyEngine;
import com.entity.datamining.policy.FieldResponse;
import com.entity.datamining.policy.ResponseSource;
import com.entity.datamining.source.FetchResult;
import com.entity.datamining.source.PostEvaluator;
import com.entity.datamining.source.SourceFunction;
import com.entity.datamining.source.SourceRegistry;
import com.entity.datamining.store.EntityStore;
import com.entity.datamining.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point mapping a request envelope to its handler.
 *
 * <p>Every path ends in an {@link OrchestratorResponse}; exceptions never reach the caller.</p>
 */
public class RequestRouter {
    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    public static final int DEFAULT_SEARCH_LIMIT = 50;

    private final FetchPolicyEngine engine;
    private final EntityStore store;
    private final SourceRegistry registry;
    private final PostEvaluator evaluator;
    private final FetchContextAssembler contextAssembler;
    private final int defaultSearchLimit;
    private final MetricsService metrics;
    private final Clock clock;

    public RequestRouter(FetchPolicyEngine engine, EntityStore store, SourceRegistry registry, PostEvaluator evaluator) {
        this(engine, store, registry, evaluator, DEFAULT_SEARCH_LIMIT, NoOpMetricsService.INSTANCE, Clock.systemUTC());
    }

    public RequestRouter(FetchPolicyEngine engine, EntityStore store, SourceRegistry registry, PostEvaluator evaluator,
                         int defaultSearchLimit, MetricsService metrics, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator is required");
        if (defaultSearchLimit <= 0) {
            throw new IllegalArgumentException("defaultSearchLimit must be positive");
        }
        this.contextAssembler = new FetchContextAssembler(store);
        this.defaultSearchLimit = defaultSearchLimit;
        this.metrics = metrics != null ? metrics : NoOpMetricsService.INSTANCE;
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public OrchestratorResponse route(OrchestratorRequest request) {
        if (request == null) {
            return failure("request is required");
        }
        String typeTag = RequestType.fromWire(request.type()).map(RequestType::getWireName).orElse("unknown");
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRequest(LogContext.generateCorrelationId(), typeTag)) {
            Optional<RequestType> type = RequestType.fromWire(request.type());
            if (type.isEmpty()) {
                log.warn("route.unknownType type={}", request.type());
                return failure("unknown request type: " + request.type());
            }
            log.debug("route.dispatch type={}", typeTag);
            return switch (type.get()) {
                case FETCH -> handleFetch(request, false);
                case FORCE_FETCH -> handleFetch(request, true);
                case EVALUATE_LATEST_POST -> handleEvaluate(request);
                case SEARCH -> handleSearch(request);
            };
        } catch (RuntimeException e) {
            log.error("route.failed type={} error={}", request.type(), e.getMessage(), e);
            return failure("request failed: " + e.getMessage());
        } finally {
            metrics.recordRequestDuration(typeTag, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private OrchestratorResponse handleFetch(OrchestratorRequest request, boolean forced) {
        Optional<String> invalid = requireFields(request, true);
        if (invalid.isPresent()) {
            return failure(invalid.get());
        }
        EntityType entityType = EntityType.fromWire(request.entityType()).orElseThrow();
        FieldResponse response = forced
                ? engine.forceFetch(entityType, request.entityId(), request.field(), request.context())
                : engine.fetch(entityType, request.entityId(), request.field(), request.context());
        return OrchestratorResponse.from(response, clock.instant());
    }

    /**
     * Fetches a politician's latest tweet and runs it through the post evaluator.
     * Never enqueues enrichment.
     */
    private OrchestratorResponse handleEvaluate(OrchestratorRequest request) {
        Optional<String> invalid = requireFields(request, false);
        if (invalid.isPresent()) {
            return failure(invalid.get());
        }
        EntityType entityType = EntityType.fromWire(request.entityType()).orElseThrow();
        if (entityType != EntityType.POLITICIAN) {
            return failure("evaluation only supported for entity_type 'politician'");
        }
        String entityId = request.entityId();

        Optional<String> handle;
        try {
            handle = contextAssembler.resolveTwitterHandle(entityType, entityId, request.context());
        } catch (StorageException e) {
            log.error("evaluate.storageError entityId={} error={}", entityId, e.getMessage(), e);
            return failure(e.getMessage());
        }
        if (handle.isEmpty()) {
            return failure("missing twitter_handle for " + entityId + " to fetch tweet");
        }

        Optional<SourceFunction> tweetSource = registry.lookup(EntityType.POLITICIAN, EntityField.LATEST_TWEET);
        if (tweetSource.isEmpty()) {
            return failure("no fetch function for politician/" + EntityField.LATEST_TWEET.getWireName());
        }

        Map<String, Object> context = new HashMap<>(request.context());
        context.put(FetchContextAssembler.TWITTER_HANDLE, handle.get());
        log.info("evaluate.fetchTweet entityId={} handle={}", entityId, handle.get());
        FetchResult tweetResult;
        try {
            tweetResult = tweetSource.get().fetch(entityId, context);
        } catch (RuntimeException e) {
            log.error("evaluate.fetchError entityId={} error={}", entityId, e.getMessage(), e);
            return failure("external fetch failed: " + e.getMessage());
        }
        if (tweetResult == null || !tweetResult.success()) {
            return failure(tweetResult == null ? "source returned no result" : tweetResult.error());
        }

        Object tweet = tweetResult.data();
        String text = tweet instanceof Map<?, ?> m && m.get("text") instanceof String s && !s.isBlank() ? s : null;
        if (text == null) {
            return failure("fetched tweet data did not contain text");
        }

        log.info("evaluate.analyze evaluator={}", evaluator.getEvaluatorName());
        FetchResult evaluation;
        try {
            evaluation = evaluator.evaluate(text);
        } catch (RuntimeException e) {
            log.error("evaluate.evaluatorError error={}", e.getMessage(), e);
            evaluation = FetchResult.failure("AI evaluation failed: " + e.getMessage());
        }
        if (evaluation == null || !evaluation.success()) {
            String error = evaluation == null ? "AI evaluation failed" : evaluation.error();
            return OrchestratorResponse.failure(error, Map.of("fetched_tweet", tweet), clock.instant());
        }

        Map<String, Object> combined = new LinkedHashMap<>();
        combined.put("tweet", tweet);
        combined.put("ai_evaluation", evaluation.data());
        return OrchestratorResponse.success(combined, null, clock.instant());
    }

    private OrchestratorResponse handleSearch(OrchestratorRequest request) {
        String query = request.query();
        if (query == null || query.isBlank()) {
            return failure("search query cannot be empty");
        }

        EntityType entityType = null;
        if (request.entityType() != null && !request.entityType().isBlank()) {
            Optional<EntityType> parsed = EntityType.fromWire(request.entityType());
            if (parsed.isEmpty()) {
                return failure("unknown entity_type: " + request.entityType());
            }
            entityType = parsed.get();
        }

        Object categoryValue = request.context().get("category");
        String category = categoryValue == null ? null : categoryValue.toString();

        int limit = defaultSearchLimit;
        Object limitValue = request.context().get("limit");
        if (limitValue instanceof Number n) {
            limit = n.intValue();
        } else if (limitValue instanceof String s && !s.isBlank()) {
            try {
                limit = Integer.parseInt(s.strip());
            } catch (NumberFormatException e) {
                return failure("invalid search limit: " + s);
            }
        }
        if (limit <= 0) {
            return failure("search limit must be positive");
        }

        try {
            List<Map<String, Object>> results = store.search(query.strip(), entityType, category, limit);
            log.info("search.done query={} results={}", query, results.size());
            return OrchestratorResponse.success(results, ResponseSource.DATABASE_SEARCH.getWireName(), clock.instant());
        } catch (StorageException e) {
            log.error("search.failed query={} error={}", query, e.getMessage(), e);
            return failure("search failed: " + e.getMessage());
        }
    }

    private Optional<String> requireFields(OrchestratorRequest request, boolean needsField) {
        if (request.entityType() == null || request.entityType().isBlank()) {
            return Optional.of("entity_type is required");
        }
        if (EntityType.fromWire(request.entityType()).isEmpty()) {
            return Optional.of("unknown entity_type: " + request.entityType());
        }
        if (request.entityId() == null || request.entityId().isBlank()) {
            return Optional.of("entity_id is required");
        }
        if (needsField && (request.field() == null || request.field().isBlank())) {
            return Optional.of("field is required");
        }
        return Optional.empty();
    }

    private OrchestratorResponse failure(String error) {
        return OrchestratorResponse.failure(error, clock.instant());
    }
}
