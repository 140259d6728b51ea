package com.entity.datamining.policy;

import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.enrichment.FetchTask;
import com.entity.datamining.enrichment.TaskQueue;
import com.entity.datamining.metrics.MetricsService;
import com.entity.datamining.metrics.NoOpMetricsService;
import com.entity.datamining.source.FetchResult;
import com.entity.datamining.source.RefreshTool;
import com.entity.datamining.source.SourceFunction;
import com.entity.datamining.source.SourceRegistry;
import com.entity.datamining.store.EntityStore;
import com.entity.datamining.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides, per field request, whether to serve the stored value, return empty for a
 * background-only field, fetch live, or force a refresh.
 *
 * <p>A successful live fetch is persisted, then an enrichment task is enqueued, then the
 * response is returned. Persistence and enqueue failures after a successful fetch are
 * logged and do not change the response.</p>
 *
 * <p>Concurrent requests for the same field are not coordinated; each may fetch and write,
 * and the last write wins.</p>
 */
public class FetchPolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(FetchPolicyEngine.class);

    public static final Set<String> DEFAULT_BACKGROUND_FIELDS = Set.of(
            EntityField.VOTING_RECORD.getWireName(),
            EntityField.COMMITTEES.getWireName()
    );

    private final EntityStore store;
    private final SourceRegistry registry;
    private final TaskQueue taskQueue;
    private final RefreshTool refreshTool;
    private final StalenessPolicy stalenessPolicy;
    private final Set<String> backgroundFields;
    private final FetchContextAssembler contextAssembler;
    private final MetricsService metrics;
    private final Clock clock;

    private FetchPolicyEngine(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.taskQueue = Objects.requireNonNull(builder.taskQueue, "taskQueue is required");
        this.refreshTool = Objects.requireNonNull(builder.refreshTool, "refreshTool is required");
        this.stalenessPolicy = builder.stalenessPolicy != null ? builder.stalenessPolicy : StalenessPolicy.presenceOnly();
        this.backgroundFields = Set.copyOf(builder.backgroundFields);
        this.contextAssembler = new FetchContextAssembler(store);
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /**
     * Serves a field: the stored value if present and fresh, an empty list for background-only
     * fields, otherwise a live fetch through the registered source.
     *
     * @param context free-form request context, may be null
     */
    public FieldResponse fetch(EntityType entityType, String entityId, String field, Map<String, Object> context) {
        log.info("fetch.start entityType={} entityId={} field={}", entityType.getWireName(), entityId, field);

        try {
            Optional<Object> local = store.getField(entityType, entityId, field);
            if (local.isPresent() && !isStale(entityType, entityId, field)) {
                log.debug("fetch.local entityType={} entityId={} field={}", entityType.getWireName(), entityId, field);
                return served(local.get(), ResponseSource.LOCAL);
            }
        } catch (StorageException e) {
            log.error("fetch.storageError entityId={} field={} error={}", entityId, field, e.getMessage(), e);
            return failed(FetchErrorKind.STORAGE_ERROR, e.getMessage());
        }

        if (backgroundFields.contains(field)) {
            log.info("fetch.localEmpty entityType={} entityId={} field={} reason=background-only",
                    entityType.getWireName(), entityId, field);
            return served(List.of(), ResponseSource.LOCAL_EMPTY);
        }

        Optional<SourceFunction> source = registry.lookup(entityType, field);
        if (source.isEmpty()) {
            return failed(FetchErrorKind.NO_FETCH_FUNCTION, noFetchFunction(entityType, field));
        }

        FieldResponse fetched = callSource(source.get(), entityType, entityId, field, context);
        if (!fetched.success()) {
            return fetched;
        }

        persist(entityType, entityId, field, fetched.data());
        enqueueEnrichment(entityType, entityId, field);
        return served(fetched.data(), ResponseSource.EXTERNAL);
    }

    /**
     * Bypasses the stored value and fetches live. A forced {@code voting_record} fetch runs the
     * refresh tool first and aborts if it fails. Forced fetches do not enqueue enrichment.
     */
    public FieldResponse forceFetch(EntityType entityType, String entityId, String field, Map<String, Object> context) {
        log.info("forceFetch.start entityType={} entityId={} field={}", entityType.getWireName(), entityId, field);

        Optional<SourceFunction> source = registry.lookup(entityType, field);
        if (source.isEmpty()) {
            return failed(FetchErrorKind.NO_FETCH_FUNCTION, noFetchFunction(entityType, field));
        }

        if (EntityField.VOTING_RECORD.getWireName().equals(field) && !runRefreshTool()) {
            return failed(FetchErrorKind.REFRESH_TOOL_FAILED, "refresh tool failed to force update voting records");
        }

        FieldResponse fetched = callSource(source.get(), entityType, entityId, field, context);
        if (!fetched.success()) {
            return fetched;
        }

        persist(entityType, entityId, field, fetched.data());
        return served(fetched.data(), ResponseSource.EXTERNAL_FORCED);
    }

    public Set<String> getBackgroundFields() {
        return backgroundFields;
    }

    private boolean isStale(EntityType entityType, String entityId, String field) {
        if (!stalenessPolicy.hasTtl(field)) {
            return false;
        }
        boolean stale = stalenessPolicy.isStale(field, store.getFieldUpdatedAt(entityType, entityId, field));
        if (stale) {
            log.info("fetch.stale entityType={} entityId={} field={}", entityType.getWireName(), entityId, field);
        }
        return stale;
    }

    private FieldResponse callSource(SourceFunction source, EntityType entityType, String entityId,
                                     String field, Map<String, Object> context) {
        Map<String, Object> sourceContext;
        try {
            sourceContext = contextAssembler.assemble(entityType, entityId, field, context);
        } catch (MissingContextException e) {
            log.warn("fetch.missingContext entityId={} field={} key={}", entityId, field, e.getContextKey());
            return failed(FetchErrorKind.MISSING_CONTEXT, e.getMessage());
        } catch (StorageException e) {
            log.error("fetch.storageError entityId={} field={} error={}", entityId, field, e.getMessage(), e);
            return failed(FetchErrorKind.STORAGE_ERROR, e.getMessage());
        }

        FetchResult result;
        try {
            result = source.fetch(entityId, sourceContext);
        } catch (RuntimeException e) {
            log.error("fetch.sourceError entityId={} field={} error={}", entityId, field, e.getMessage(), e);
            return failed(FetchErrorKind.EXTERNAL_FETCH_FAILED, "external fetch failed: " + e.getMessage());
        }
        if (result == null || !result.success()) {
            String error = result == null ? "source returned no result" : result.error();
            log.warn("fetch.sourceFailed entityId={} field={} error={}", entityId, field, error);
            return failed(FetchErrorKind.EXTERNAL_FETCH_FAILED, error);
        }
        return FieldResponse.of(result.data(), ResponseSource.EXTERNAL);
    }

    private boolean runRefreshTool() {
        try {
            boolean ok = refreshTool.run(true);
            if (!ok) {
                log.warn("forceFetch.refreshFailed field={}", EntityField.VOTING_RECORD.getWireName());
            }
            return ok;
        } catch (RuntimeException e) {
            log.error("forceFetch.refreshError error={}", e.getMessage(), e);
            return false;
        }
    }

    private void persist(EntityType entityType, String entityId, String field, Object data) {
        try {
            if (!store.setField(entityType, entityId, field, data)) {
                log.warn("fetch.persistSkipped entityType={} entityId={} field={}",
                        entityType.getWireName(), entityId, field);
            }
        } catch (StorageException e) {
            log.warn("fetch.persistFailed entityType={} entityId={} field={} error={}",
                    entityType.getWireName(), entityId, field, e.getMessage());
        }
    }

    private void enqueueEnrichment(EntityType entityType, String entityId, String field) {
        try {
            taskQueue.enqueue(FetchTask.enrich(entityType, field, entityId, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("fetch.enqueueFailed entityType={} entityId={} field={} error={}",
                    entityType.getWireName(), entityId, field, e.getMessage());
        }
    }

    private FieldResponse served(Object data, ResponseSource source) {
        metrics.incrementFetch(source.getWireName());
        return FieldResponse.of(data, source);
    }

    private FieldResponse failed(FetchErrorKind kind, String error) {
        metrics.incrementFetchError(kind.name());
        return FieldResponse.failure(kind, error);
    }

    private static String noFetchFunction(EntityType entityType, String field) {
        return "no fetch function for " + entityType.getWireName() + "/" + field;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityStore store;
        private SourceRegistry registry;
        private TaskQueue taskQueue;
        private RefreshTool refreshTool;
        private StalenessPolicy stalenessPolicy;
        private Set<String> backgroundFields = DEFAULT_BACKGROUND_FIELDS;
        private MetricsService metrics;
        private Clock clock;

        public Builder store(EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder registry(SourceRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder taskQueue(TaskQueue taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public Builder refreshTool(RefreshTool refreshTool) {
            this.refreshTool = refreshTool;
            return this;
        }

        public Builder stalenessPolicy(StalenessPolicy stalenessPolicy) {
            this.stalenessPolicy = stalenessPolicy;
            return this;
        }

        public Builder backgroundFields(Set<String> backgroundFields) {
            this.backgroundFields = Objects.requireNonNull(backgroundFields, "backgroundFields is required");
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FetchPolicyEngine build() {
            return new FetchPolicyEngine(this);
        }
    }
}
