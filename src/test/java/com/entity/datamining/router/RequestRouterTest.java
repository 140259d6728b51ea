package com.entity.datamining.router;

import com.entity.datamining.MutableClock;
import com.entity.datamining.core.model.Entity;
import com.entity.datamining.core.model.EntityField;
import com.entity.datamining.core.model.EntityType;
import com.entity.datamining.enrichment.RecordingTaskQueue;
import com.entity.datamining.metrics.MicrometerMetricsService;
import com.entity.datamining.policy.FetchPolicyEngine;
import com.entity.datamining.source.FetchResult;
import com.entity.datamining.source.PostEvaluator;
import com.entity.datamining.source.RecordingSource;
import com.entity.datamining.source.SourceRegistry;
import com.entity.datamining.store.EntityStore;
import com.entity.datamining.store.SqliteEntityStore;
import com.entity.datamining.store.StorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RequestRouter Tests")
class RequestRouterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @TempDir
    Path tempDir;

    @Mock
    private PostEvaluator evaluator;

    private MutableClock clock;
    private SqliteEntityStore store;
    private RecordingTaskQueue queue;
    private RecordingSource tweets;
    private RecordingSource metricsSource;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = SqliteEntityStore.open(tempDir.resolve("router.db"), Duration.ofMinutes(5), clock);
        store.createEntity(Entity.builder().id("P1").type(EntityType.POLITICIAN).name("Jane Senator")
                .bio("Senator focused on energy policy").twitterHandle("@janesenator").relevanceScore(0.9).build());
        store.createEntity(Entity.builder().id("P2").type(EntityType.POLITICIAN).name("Tom Rep")
                .bio("Representative working on energy grants").relevanceScore(0.4).build());
        store.createEntity(Entity.builder().id("I1").type(EntityType.INFLUENCER).name("Max Stream")
                .bio("Streams about energy markets").relevanceScore(0.7).build());
        queue = new RecordingTaskQueue();
        tweets = RecordingSource.returning(Map.of("id", "t-1", "text", "Great day for clean energy!"));
        metricsSource = RecordingSource.returning(Map.of("followers", 1200));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private RequestRouter router() {
        return router(store, SourceRegistry.builder()
                .register(EntityType.POLITICIAN, EntityField.LATEST_TWEET, tweets)
                .register(EntityType.INFLUENCER, EntityField.METRICS, metricsSource)
                .build());
    }

    private RequestRouter router(EntityStore entityStore, SourceRegistry registry) {
        FetchPolicyEngine engine = FetchPolicyEngine.builder()
                .store(entityStore)
                .registry(registry)
                .taskQueue(queue)
                .refreshTool(force -> true)
                .clock(clock)
                .build();
        return new RequestRouter(engine, entityStore, registry, evaluator, 50, null, clock);
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("Should reject unknown request types")
        void unknownType() {
            OrchestratorResponse response = router().route(
                    new OrchestratorRequest("unknown_x", "politician", "P1", "bio", null, null, null));

            assertFalse(response.success());
            assertEquals("unknown request type: unknown_x", response.error());
            assertEquals(T0.toString(), response.timestamp());
            assertNull(response.source());
        }

        @Test
        @DisplayName("Should reject a missing request")
        void nullRequest() {
            OrchestratorResponse response = router().route(null);

            assertFalse(response.success());
            assertEquals("request is required", response.error());
        }

        @Test
        @DisplayName("Should turn unexpected exceptions into failure envelopes")
        void neverThrows() {
            EntityStore broken = mock(EntityStore.class);
            when(broken.getField(any(), anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

            OrchestratorResponse response = router(broken, SourceRegistry.empty())
                    .route(OrchestratorRequest.fetch("politician", "P1", "bio", null));

            assertFalse(response.success());
            assertEquals("request failed: boom", response.error());
        }

        @Test
        @DisplayName("Should record request durations by type")
        void recordsDuration() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            FetchPolicyEngine engine = FetchPolicyEngine.builder()
                    .store(store).registry(SourceRegistry.empty()).taskQueue(queue).refreshTool(force -> true).build();
            RequestRouter measured = new RequestRouter(engine, store, SourceRegistry.empty(), evaluator, 50,
                    new MicrometerMetricsService(registry), clock);

            measured.route(OrchestratorRequest.search("energy", null, null));
            measured.route(new OrchestratorRequest("bogus", null, null, null, null, null, null));

            assertEquals(1, registry.timer("orchestrator.request.duration", "type", "search").count());
            assertEquals(1, registry.timer("orchestrator.request.duration", "type", "unknown").count());
        }
    }

    @Nested
    @DisplayName("Fetch requests")
    class FetchRequests {

        @Test
        @DisplayName("Should serve a local field")
        void localField() {
            OrchestratorResponse response = router().route(OrchestratorRequest.fetch("politician", "P1", "bio", null));

            assertTrue(response.success());
            assertEquals("Senator focused on energy policy", response.data());
            assertEquals("local", response.source());
            assertNull(response.error());
        }

        @Test
        @DisplayName("Should fetch live and report the external source")
        void externalField() {
            OrchestratorResponse response = router().route(OrchestratorRequest.fetch("influencer", "I1", "metrics", Map.of()));

            assertTrue(response.success());
            assertEquals(Map.of("followers", 1200), response.data());
            assertEquals("external", response.source());
            assertEquals(1, queue.tasks().size());
        }

        @Test
        @DisplayName("Should report local_empty for background-only fields")
        void backgroundOnly() {
            OrchestratorResponse response = router().route(
                    OrchestratorRequest.fetch("politician", "P1", "voting_record", null));

            assertTrue(response.success());
            assertEquals(List.of(), response.data());
            assertEquals("local_empty", response.source());
        }

        @Test
        @DisplayName("Should route force_fetch to the forced path")
        void forceFetch() {
            store.setField(EntityType.INFLUENCER, "I1", "metrics", Map.of("followers", 1));

            OrchestratorResponse response = router().route(
                    OrchestratorRequest.forceFetch("influencer", "I1", "metrics", null));

            assertTrue(response.success());
            assertEquals("external_forced", response.source());
            assertEquals(Map.of("followers", 1200), response.data());
            assertTrue(queue.tasks().isEmpty());
        }

        @Test
        @DisplayName("Should pass engine failures through as the error")
        void engineFailure() {
            OrchestratorResponse response = router().route(
                    OrchestratorRequest.fetch("influencer", "I1", "stances", null));

            assertFalse(response.success());
            assertEquals("no fetch function for influencer/stances", response.error());
            assertNull(response.data());
        }

        @Test
        @DisplayName("Should validate required fields")
        void validation() {
            RequestRouter router = router();

            assertEquals("entity_type is required",
                    router.route(OrchestratorRequest.fetch(null, "P1", "bio", null)).error());
            assertEquals("unknown entity_type: senator",
                    router.route(OrchestratorRequest.fetch("senator", "P1", "bio", null)).error());
            assertEquals("entity_id is required",
                    router.route(OrchestratorRequest.fetch("politician", " ", "bio", null)).error());
            assertEquals("field is required",
                    router.route(OrchestratorRequest.forceFetch("politician", "P1", null, null)).error());
        }
    }

    @Nested
    @DisplayName("Evaluate latest post")
    class EvaluateLatestPost {

        @Test
        @DisplayName("Should combine the tweet and its evaluation")
        void success() {
            Map<String, Object> analysis = Map.of("sentiment_classification", "Positive");
            when(evaluator.getEvaluatorName()).thenReturn("Mock");
            when(evaluator.evaluate("Great day for clean energy!")).thenReturn(FetchResult.success(analysis));

            OrchestratorResponse response = router().route(
                    OrchestratorRequest.evaluateLatestPost("politician", "P1", null));

            assertTrue(response.success());
            Map<?, ?> data = (Map<?, ?>) response.data();
            assertEquals("P1", tweets.lastCall().entityId());
            assertEquals("janesenator", tweets.lastCall().context().get("twitter_handle"));
            assertEquals("Great day for clean energy!", ((Map<?, ?>) data.get("tweet")).get("text"));
            assertEquals(analysis, data.get("ai_evaluation"));
            assertNull(response.source());
            assertTrue(queue.tasks().isEmpty());
        }

        @Test
        @DisplayName("Should only evaluate politicians")
        void politiciansOnly() {
            OrchestratorResponse response = router().route(
                    OrchestratorRequest.evaluateLatestPost("influencer", "I1", null));

            assertFalse(response.success());
            assertEquals("evaluation only supported for entity_type 'politician'", response.error());
            verifyNoInteractions(evaluator);
        }

        @Test
        @DisplayName("Should fail when no handle is known")
        void missingHandle() {
            OrchestratorResponse response = router().route(
                    OrchestratorRequest.evaluateLatestPost("politician", "P2", null));

            assertFalse(response.success());
            assertEquals("missing twitter_handle for P2 to fetch tweet", response.error());
            assertEquals(0, tweets.callCount());
        }

        @Test
        @DisplayName("Should fail when the tweet has no text")
        void tweetWithoutText() {
            RecordingSource emptyTweets = RecordingSource.returning(Map.of("id", "t-2"));
            SourceRegistry registry = SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.LATEST_TWEET, emptyTweets).build();

            OrchestratorResponse response = router(store, registry).route(
                    OrchestratorRequest.evaluateLatestPost("politician", "P1", null));

            assertFalse(response.success());
            assertEquals("fetched tweet data did not contain text", response.error());
            verifyNoInteractions(evaluator);
        }

        @Test
        @DisplayName("Should return the fetched tweet alongside an evaluator failure")
        void evaluatorFailure() {
            when(evaluator.getEvaluatorName()).thenReturn("Mock");
            when(evaluator.evaluate(anyString())).thenReturn(FetchResult.failure("AI response was not valid JSON."));

            OrchestratorResponse response = router().route(
                    OrchestratorRequest.evaluateLatestPost("politician", "P1", Map.of("twitter_handle", "@override")));

            assertFalse(response.success());
            assertEquals("AI response was not valid JSON.", response.error());
            Map<?, ?> data = (Map<?, ?>) response.data();
            assertEquals(Map.of("id", "t-1", "text", "Great day for clean energy!"), data.get("fetched_tweet"));
            assertEquals("override", tweets.lastCall().context().get("twitter_handle"));
        }

        @Test
        @DisplayName("Should pass the tweet source's error through")
        void tweetSourceFailure() {
            SourceRegistry registry = SourceRegistry.builder()
                    .register(EntityType.POLITICIAN, EntityField.LATEST_TWEET, RecordingSource.failing("Twitter API rate limited"))
                    .build();

            OrchestratorResponse response = router(store, registry).route(
                    OrchestratorRequest.evaluateLatestPost("politician", "P1", null));

            assertEquals("Twitter API rate limited", response.error());
        }

        @Test
        @DisplayName("Should fail when no tweet source is registered")
        void noTweetSource() {
            OrchestratorResponse response = router(store, SourceRegistry.empty()).route(
                    OrchestratorRequest.evaluateLatestPost("politician", "P1", null));

            assertEquals("no fetch function for politician/latest_tweet", response.error());
        }
    }

    @Nested
    @DisplayName("Search")
    class Search {

        @Test
        @DisplayName("Should search by relevance and tag the source")
        void searchByRelevance() {
            OrchestratorResponse response = router().route(OrchestratorRequest.search("energy", null, null));

            assertTrue(response.success());
            assertEquals("database_search", response.source());
            List<?> results = (List<?>) response.data();
            assertEquals(List.of("P1", "I1", "P2"), results.stream().map(r -> ((Map<?, ?>) r).get("id")).toList());
        }

        @Test
        @DisplayName("Should apply the type filter and the limit from context")
        void filtersAndLimit() {
            OrchestratorResponse response = router().route(
                    OrchestratorRequest.search("energy", "politician", Map.of("limit", "1")));

            List<?> results = (List<?>) response.data();
            assertEquals(1, results.size());
            assertEquals("P1", ((Map<?, ?>) results.get(0)).get("id"));
        }

        @Test
        @DisplayName("Should return an empty list when nothing matches")
        void noMatches() {
            OrchestratorResponse response = router().route(OrchestratorRequest.search("zoning", null, null));

            assertTrue(response.success());
            assertEquals(List.of(), response.data());
        }

        @Test
        @DisplayName("Should reject empty queries and bad limits")
        void rejectsBadInput() {
            RequestRouter router = router();

            assertEquals("search query cannot be empty",
                    router.route(OrchestratorRequest.search("  ", null, null)).error());
            assertEquals("invalid search limit: many",
                    router.route(OrchestratorRequest.search("energy", null, Map.of("limit", "many"))).error());
            assertEquals("search limit must be positive",
                    router.route(OrchestratorRequest.search("energy", null, Map.of("limit", 0))).error());
            assertEquals("unknown entity_type: senator",
                    router.route(OrchestratorRequest.search("energy", "senator", null)).error());
        }

        @Test
        @DisplayName("Should report storage failures")
        void storageFailure() {
            EntityStore broken = mock(EntityStore.class);
            when(broken.search(anyString(), any(), any(), anyInt()))
                    .thenThrow(new StorageException("Failed to search 'energy': disk I/O error"));

            OrchestratorResponse response = router(broken, SourceRegistry.empty())
                    .route(OrchestratorRequest.search("energy", null, null));

            assertFalse(response.success());
            assertEquals("search failed: Failed to search 'energy': disk I/O error", response.error());
        }
    }
}
