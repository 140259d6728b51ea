package com.entity.datamining.policy;

import com.entity.datamining.MutableClock;
import com.entity.datamining.core.model.Entity;
import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.enrichment.FetchTask;
import com.entity.datamining.enrichment.RecordingTaskQueue;
import com.entity.datamining.enrichment.TaskQueue;
import com.entity.datamining.source.FetchResult;
import com.entity.datamining.source.RecordingSource;
import com.entity.datamining.source.SourceRegistry;
import com.entity.datamining.store.EntityStore;
import com.entity.datamining.store.SqliteEntityStore;
import com.entity.datamining.store.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("FetchPolicyEngine Tests")
class FetchPolicyEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteEntityStore store;
    private RecordingTaskQueue queue;
    private AtomicInteger refreshCalls;
    private boolean refreshResult;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = SqliteEntityStore.open(tempDir.resolve("policy.db"), Duration.ofMinutes(5), clock);
        store.createEntity(Entity.builder().id("P1").type(EntityType.POLITICIAN).name("Jane Senator").build());
        store.createEntity(Entity.builder().id("P2").type(EntityType.POLITICIAN).name("Tom Rep")
                .twitterHandle("@tomrep").build());
        store.createEntity(Entity.builder().id("I1").type(EntityType.INFLUENCER).name("Max Stream").build());
        queue = new RecordingTaskQueue();
        refreshCalls = new AtomicInteger();
        refreshResult = true;
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private FetchPolicyEngine engine(SourceRegistry registry) {
        return engine(registry, queue, StalenessPolicy.presenceOnly());
    }

    private FetchPolicyEngine engine(SourceRegistry registry, TaskQueue taskQueue, StalenessPolicy staleness) {
        return FetchPolicyEngine.builder()
                .store(store)
                .registry(registry)
                .taskQueue(taskQueue)
                .refreshTool(force -> {
                    refreshCalls.incrementAndGet();
                    return refreshResult;
                })
                .stalenessPolicy(staleness)
                .clock(clock)
                .build();
    }

    @Nested
    @DisplayName("Local values")
    class LocalValues {

        @Test
        @DisplayName("Should serve a present value locally without calling the source")
        void servesPresentValue() {
            RecordingSource bioSource = RecordingSource.returning("fetched bio");
            store.setField(EntityType.POLITICIAN, "P1", "bio", "Stored bio");

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.BIO, bioSource).build())
                    .fetch(EntityType.POLITICIAN, "P1", "bio", Map.of());

            assertTrue(response.success());
            assertEquals("Stored bio", response.data());
            assertEquals(ResponseSource.LOCAL, response.source());
            assertEquals(0, bioSource.callCount());
            assertTrue(queue.tasks().isEmpty());
        }

        @Test
        @DisplayName("Should serve a previously fetched value locally")
        void servesCachedSourcedValue() {
            RecordingSource metrics = RecordingSource.returning(Map.of("followers", 5));
            FetchPolicyEngine engine = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build());

            engine.fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());
            FieldResponse second = engine.fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertEquals(ResponseSource.LOCAL, second.source());
            assertEquals(Map.of("followers", 5), second.data());
            assertEquals(1, metrics.callCount());
        }

        @Test
        @DisplayName("Should refetch a value older than its TTL")
        void refetchesStaleValue() {
            RecordingSource metrics = RecordingSource.returning(Map.of("followers", 7));
            StalenessPolicy staleness = new StalenessPolicy(Map.of("metrics", Duration.ofHours(1)), clock);
            FetchPolicyEngine engine = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build(), queue, staleness);

            engine.fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());
            clock.advance(Duration.ofMinutes(30));
            assertEquals(ResponseSource.LOCAL, engine.fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of()).source());

            clock.advance(Duration.ofMinutes(31));
            FieldResponse refreshed = engine.fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertEquals(ResponseSource.EXTERNAL, refreshed.source());
            assertEquals(2, metrics.callCount());
        }
    }

    @Nested
    @DisplayName("Background-only fields")
    class BackgroundOnly {

        @ParameterizedTest
        @ValueSource(strings = {"voting_record", "committees"})
        @DisplayName("Missing background-only fields should return local_empty without calling any source")
        void neverFetchesLive(String field) {
            RecordingSource source = RecordingSource.returning(List.of("vote"));
            SourceRegistry registry = SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.VOTING_RECORD, source)
                    .register(EntityType.POLITICIAN, EntityField.COMMITTEES, source)
                    .build();

            FieldResponse response = engine(registry).fetch(EntityType.POLITICIAN, "P1", field, Map.of());

            assertTrue(response.success());
            assertEquals(ResponseSource.LOCAL_EMPTY, response.source());
            assertEquals(List.of(), response.data());
            assertEquals(0, source.callCount());
            assertTrue(queue.tasks().isEmpty());
        }

        @Test
        @DisplayName("Stale background-only fields should still never be fetched live")
        void staleBackgroundFieldNotFetched() {
            RecordingSource source = RecordingSource.returning(List.of("new vote"));
            store.setField(EntityType.POLITICIAN, "P1", "voting_record", List.of("old vote"));
            clock.advance(Duration.ofDays(2));
            StalenessPolicy staleness = new StalenessPolicy(Map.of("voting_record", Duration.ofDays(1)), clock);

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.VOTING_RECORD, source).build(), queue, staleness)
                    .fetch(EntityType.POLITICIAN, "P1", "voting_record", Map.of());

            assertEquals(ResponseSource.LOCAL_EMPTY, response.source());
            assertEquals(0, source.callCount());
        }

        @Test
        @DisplayName("Present background-only values should be served locally")
        void presentBackgroundFieldServed() {
            store.setField(EntityType.POLITICIAN, "P1", "committees", List.of("Finance"));

            FieldResponse response = engine(SourceRegistry.empty())
                    .fetch(EntityType.POLITICIAN, "P1", "committees", Map.of());

            assertEquals(ResponseSource.LOCAL, response.source());
            assertEquals(List.of("Finance"), response.data());
        }
    }

    @Nested
    @DisplayName("Live fetch")
    class LiveFetch {

        @Test
        @DisplayName("Should persist, then enqueue exactly one task, then respond")
        void persistThenEnqueueThenRespond() {
            Map<String, Object> fetched = Map.of("followers", 1200);
            RecordingSource metrics = RecordingSource.returning(fetched);
            List<Object> storedAtEnqueue = new ArrayList<>();
            RecordingTaskQueue orderingQueue = new RecordingTaskQueue(task ->
                    storedAtEnqueue.add(store.getField(EntityType.INFLUENCER, "I1", "metrics").orElse(null)));

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build(),
                    orderingQueue, StalenessPolicy.presenceOnly())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertTrue(response.success());
            assertEquals(ResponseSource.EXTERNAL, response.source());
            assertEquals(fetched, response.data());
            assertEquals(List.of(fetched), storedAtEnqueue);

            assertEquals(1, orderingQueue.tasks().size());
            FetchTask task = orderingQueue.tasks().get(0);
            assertEquals(FetchTask.ENRICH, task.type());
            assertEquals(EntityType.INFLUENCER, task.entityType());
            assertEquals("metrics", task.field());
            assertEquals("I1", task.referenceId());
            assertEquals(T0, task.enqueuedAt());
        }

        @Test
        @DisplayName("Should pass the request context through to the source")
        void passesContext() {
            RecordingSource stances = RecordingSource.returning(List.of("pro"));

            engine(SourceRegistry.builder().register(EntityType.INFLUENCER, EntityField.STANCES, stances).build())
                    .fetch(EntityType.INFLUENCER, "I1", "stances", Map.of("topic", "energy"));

            assertEquals("I1", stances.lastCall().entityId());
            assertEquals("energy", stances.lastCall().context().get("topic"));
        }

        @Test
        @DisplayName("Should report a missing source")
        void noFetchFunction() {
            FieldResponse response = engine(SourceRegistry.empty())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertFalse(response.success());
            assertEquals(FetchErrorKind.NO_FETCH_FUNCTION, response.errorKind());
            assertEquals("no fetch function for influencer/metrics", response.error());
        }

        @Test
        @DisplayName("Should propagate the source's error verbatim without storing or enqueuing")
        void propagatesSourceError() {
            RecordingSource metrics = RecordingSource.failing("rate limited by upstream (429)");

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertFalse(response.success());
            assertEquals(FetchErrorKind.EXTERNAL_FETCH_FAILED, response.errorKind());
            assertEquals("rate limited by upstream (429)", response.error());
            assertTrue(store.getField(EntityType.INFLUENCER, "I1", "metrics").isEmpty());
            assertTrue(queue.tasks().isEmpty());
        }

        @Test
        @DisplayName("Should convert a throwing source into a failed response")
        void sourceThrows() {
            RecordingSource metrics = new RecordingSource(id -> {
                throw new IllegalStateException("socket closed");
            });

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertFalse(response.success());
            assertEquals(FetchErrorKind.EXTERNAL_FETCH_FAILED, response.errorKind());
            assertEquals("external fetch failed: socket closed", response.error());
        }

        @Test
        @DisplayName("Should still succeed when enqueuing fails")
        void enqueueFailureIgnored() {
            RecordingSource metrics = RecordingSource.returning(Map.of("followers", 3));
            TaskQueue broken = new RecordingTaskQueue(task -> {
                throw new IllegalStateException("queue closed");
            });

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build(),
                    broken, StalenessPolicy.presenceOnly())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertTrue(response.success());
            assertEquals(ResponseSource.EXTERNAL, response.source());
        }
    }

    @Nested
    @DisplayName("Latest tweet context")
    class LatestTweet {

        @Test
        @DisplayName("Should fail without calling the source when no handle is known")
        void missingHandle() {
            RecordingSource tweets = RecordingSource.returning(Map.of("text", "hi"));

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.LATEST_TWEET, tweets).build())
                    .fetch(EntityType.POLITICIAN, "P1", "latest_tweet", Map.of());

            assertFalse(response.success());
            assertEquals(FetchErrorKind.MISSING_CONTEXT, response.errorKind());
            assertTrue(response.error().startsWith("missing twitter_handle"));
            assertEquals("missing twitter_handle for P1", response.error());
            assertEquals(0, tweets.callCount());
        }

        @Test
        @DisplayName("Should take the handle from the context and strip the @")
        void handleFromContext() {
            RecordingSource tweets = RecordingSource.returning(Map.of("text", "hi"));

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.LATEST_TWEET, tweets).build())
                    .fetch(EntityType.POLITICIAN, "P1", "latest_tweet", Map.of("twitter_handle", "@janesenator"));

            assertTrue(response.success());
            assertEquals("janesenator", tweets.lastCall().context().get("twitter_handle"));
        }

        @Test
        @DisplayName("Should fall back to the stored handle")
        void handleFromStore() {
            RecordingSource tweets = RecordingSource.returning(Map.of("text", "hi"));

            engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.LATEST_TWEET, tweets).build())
                    .fetch(EntityType.POLITICIAN, "P2", "latest_tweet", Map.of());

            assertEquals("tomrep", tweets.lastCall().context().get("twitter_handle"));
        }
    }

    @Nested
    @DisplayName("Forced fetch")
    class ForcedFetch {

        @Test
        @DisplayName("Should abort a forced voting record fetch when the refresh tool fails")
        void refreshToolFailure() {
            refreshResult = false;
            RecordingSource votes = RecordingSource.returning(List.of("vote"));

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.VOTING_RECORD, votes).build())
                    .forceFetch(EntityType.POLITICIAN, "P1", "voting_record", Map.of());

            assertFalse(response.success());
            assertEquals(FetchErrorKind.REFRESH_TOOL_FAILED, response.errorKind());
            assertTrue(response.error().contains("force update"));
            assertEquals(1, refreshCalls.get());
            assertEquals(0, votes.callCount());
        }

        @Test
        @DisplayName("Should run the refresh tool, fetch and persist a forced voting record")
        void refreshThenFetch() {
            RecordingSource votes = RecordingSource.returning(List.of("HR1: yea"));

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.VOTING_RECORD, votes).build())
                    .forceFetch(EntityType.POLITICIAN, "P1", "voting_record", Map.of());

            assertTrue(response.success());
            assertEquals(ResponseSource.EXTERNAL_FORCED, response.source());
            assertEquals(1, refreshCalls.get());
            assertEquals(1, votes.callCount());
            assertEquals(Optional.of(List.of("HR1: yea")), store.getField(EntityType.POLITICIAN, "P1", "voting_record"));
            assertTrue(queue.tasks().isEmpty());
        }

        @Test
        @DisplayName("Should bypass a present local value")
        void bypassesLocal() {
            RecordingSource metrics = RecordingSource.returning(Map.of("followers", 99));
            store.setField(EntityType.INFLUENCER, "I1", "metrics", Map.of("followers", 1));

            FieldResponse response = engine(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build())
                    .forceFetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertEquals(ResponseSource.EXTERNAL_FORCED, response.source());
            assertEquals(Map.of("followers", 99), response.data());
            assertEquals(0, refreshCalls.get());
        }

        @Test
        @DisplayName("Should not run the refresh tool when no source is registered")
        void noSourceSkipsRefresh() {
            FieldResponse response = engine(SourceRegistry.empty())
                    .forceFetch(EntityType.POLITICIAN, "P1", "voting_record", Map.of());

            assertEquals(FetchErrorKind.NO_FETCH_FUNCTION, response.errorKind());
            assertEquals(0, refreshCalls.get());
        }

        @Test
        @DisplayName("A throwing refresh tool should count as a refresh failure")
        void refreshToolThrows() {
            RecordingSource votes = RecordingSource.returning(List.of());
            FetchPolicyEngine engine = FetchPolicyEngine.builder()
                    .store(store)
                    .registry(SourceRegistry.builder()
                            .register(EntityType.POLITICIAN, EntityField.VOTING_RECORD, votes).build())
                    .taskQueue(queue)
                    .refreshTool(force -> {
                        throw new IllegalStateException("tool missing");
                    })
                    .build();

            FieldResponse response = engine.forceFetch(EntityType.POLITICIAN, "P1", "voting_record", Map.of());

            assertEquals(FetchErrorKind.REFRESH_TOOL_FAILED, response.errorKind());
            assertEquals(0, votes.callCount());
        }
    }

    @Nested
    @DisplayName("Storage failures")
    class StorageFailures {

        private final EntityStore failingStore = mock(EntityStore.class);
        private final TaskQueue mockQueue = mock(TaskQueue.class);

        private FetchPolicyEngine engineOver(SourceRegistry registry) {
            return FetchPolicyEngine.builder()
                    .store(failingStore)
                    .registry(registry)
                    .taskQueue(mockQueue)
                    .refreshTool(force -> true)
                    .build();
        }

        @Test
        @DisplayName("Read errors should surface as storage errors")
        void readErrorSurfaces() {
            when(failingStore.getField(any(), anyString(), anyString()))
                    .thenThrow(new StorageException("Failed to read field: disk I/O error"));

            FieldResponse response = engineOver(SourceRegistry.empty())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertFalse(response.success());
            assertEquals(FetchErrorKind.STORAGE_ERROR, response.errorKind());
            assertEquals("Failed to read field: disk I/O error", response.error());
            verifyNoInteractions(mockQueue);
        }

        @Test
        @DisplayName("Write errors after a successful fetch should not change the response")
        void writeErrorAfterFetchIsLogged() {
            RecordingSource metrics = RecordingSource.returning(Map.of("followers", 8));
            when(failingStore.getField(any(), anyString(), anyString())).thenReturn(Optional.empty());
            when(failingStore.setField(any(), anyString(), anyString(), any()))
                    .thenThrow(new StorageException("Failed to write field: database is locked"));

            FieldResponse response = engineOver(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            assertTrue(response.success());
            assertEquals(Map.of("followers", 8), response.data());

            InOrder inOrder = inOrder(failingStore, mockQueue);
            inOrder.verify(failingStore).setField(EntityType.INFLUENCER, "I1", "metrics", Map.of("followers", 8));
            inOrder.verify(mockQueue).enqueue(any(FetchTask.class));
        }

        @Test
        @DisplayName("Successful fetches should persist before enqueuing")
        void persistBeforeEnqueue() {
            RecordingSource metrics = RecordingSource.returning("value");
            when(failingStore.getField(any(), anyString(), anyString())).thenReturn(Optional.empty());
            when(failingStore.setField(any(), anyString(), anyString(), any())).thenReturn(true);

            engineOver(SourceRegistry.builder()
                    .register(EntityType.INFLUENCER, EntityField.METRICS, metrics).build())
                    .fetch(EntityType.INFLUENCER, "I1", "metrics", Map.of());

            InOrder inOrder = inOrder(failingStore, mockQueue);
            inOrder.verify(failingStore).setField(EntityType.INFLUENCER, "I1", "metrics", "value");
            inOrder.verify(mockQueue).enqueue(argThat(task ->
                    task.field().equals("metrics") && task.referenceId().equals("I1")));
            verify(mockQueue, times(1)).enqueue(any());
        }
    }
}
