package fr.lapetina.possibility.pool;

import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.PossibilityResult;
import fr.lapetina.possibility.domain.model.PossibilityStatus;
import fr.lapetina.possibility.domain.model.Priority;
import fr.lapetina.possibility.infrastructure.http.GenerationException;
import fr.lapetina.possibility.integration.StubGenerationEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static fr.lapetina.possibility.integration.Conditions.waitUntil;
import static fr.lapetina.possibility.integration.Conditions.waitUntilAsserted;

class PossibilityPoolTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final List<ChatMessage> CONVERSATION = List.of(ChatMessage.user("Tell me a story"));

    private StubGenerationEndpoint endpoint;
    private PossibilityPool pool;

    @BeforeEach
    void setUp() {
        endpoint = new StubGenerationEndpoint();
        pool = newPool(2);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private PossibilityPool newPool(int maxConcurrentConnections) {
        return PossibilityPool.builder()
                .maxConcurrentConnections(maxConcurrentConnections)
                .ringBufferSize(256)
                .endpoint(endpoint)
                .loadTimeEstimator(m -> Duration.ofSeconds(2))
                .build()
                .start();
    }

    private static PossibilityMetadata metadata(String id, Priority priority) {
        return PossibilityMetadata.builder()
                .id(id)
                .provider("acme")
                .model("model-" + id)
                .priority(priority)
                .build();
    }

    private void initializeAndQueue(PossibilityMetadata... metadata) {
        pool.initializePool(List.of(metadata), CONVERSATION);
        for (PossibilityMetadata m : metadata) {
            pool.queuePossibility(m.id(), m.priority());
        }
    }

    private PossibilityStatus status(String id) {
        return pool.getPossibilityStatus(id).orElseThrow();
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("should fill the free slots by priority and leave the rest pending")
        void shouldDispatchUpToCeiling() {
            List<String> dispatchOrder = new CopyOnWriteArrayList<>();
            pool.addListener((previous, current) -> {
                if (current.status() == PossibilityStatus.LOADING) {
                    dispatchOrder.add(current.id());
                }
            });

            initializeAndQueue(
                    metadata("high", Priority.HIGH),
                    metadata("medium", Priority.MEDIUM),
                    metadata("low", Priority.LOW));

            LoadingStats stats = pool.getLoadingStats();
            assertThat(stats.loading()).isEqualTo(2);
            assertThat(stats.pending()).isEqualTo(1);
            assertThat(status("low")).isEqualTo(PossibilityStatus.PENDING);
            assertThat(pool.getState().queue()).containsExactly("low");
            assertThat(dispatchOrder).first().isEqualTo("high");
            waitUntil(TIMEOUT, () -> endpoint.getLastConversation().equals(CONVERSATION));
        }

        @Test
        @DisplayName("should promote the pending item when an active one completes")
        void shouldPromotePendingOnCompletion() {
            initializeAndQueue(
                    metadata("high", Priority.HIGH),
                    metadata("medium", Priority.MEDIUM),
                    metadata("low", Priority.LOW));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("high") == 1);

            endpoint.stream("high").token("Once upon a time").done();

            waitUntil(TIMEOUT, () -> status("high") == PossibilityStatus.COMPLETE);
            waitUntil(TIMEOUT, () -> status("low").isActive());
            assertThat(pool.getState().loadingCount()).isEqualTo(2);
            assertThat(pool.getState().queue()).isEmpty();
            assertThat(pool.getPossibilityResult("high").orElseThrow().content()).isEqualTo("Once upon a time");
        }

        @Test
        @DisplayName("should never exceed the concurrency ceiling under load")
        void shouldRespectCeilingUnderLoad() {
            pool.close();
            pool = newPool(3);
            AtomicInteger maxLoading = new AtomicInteger();
            pool.addListener((previous, current) ->
                    maxLoading.accumulateAndGet(pool.getState().loadingCount(), Math::max));
            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.tokenLine("Hello from " + m.id())));

            List<PossibilityMetadata> metadata = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                metadata.add(metadata("p" + i, Priority.values()[i % 3]));
            }
            initializeAndQueue(metadata.toArray(new PossibilityMetadata[0]));

            waitUntil(TIMEOUT, () -> pool.getLoadingStats().completed() == 10);
            assertThat(maxLoading.get()).isBetween(1, 3);
            assertThat(endpoint.getMaxActiveExchanges()).isLessThanOrEqualTo(3);
            assertThat(pool.getLoadingStats().isFinished()).isTrue();
            assertThat(pool.getState().loadingCount()).isZero();
        }

        @Test
        @DisplayName("should ignore queue requests for unknown or dispatched items")
        void shouldIgnoreInapplicableQueueRequests() {
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            PoolState before = pool.getState();

            pool.queuePossibility("unknown", Priority.HIGH);
            pool.queuePossibility("a", Priority.HIGH);

            assertThat(pool.getState().queue()).isEqualTo(before.queue());
            assertThat(pool.getState().loadingCount()).isEqualTo(1);
            assertThat(status("a").isActive()).isTrue();
        }

        @Test
        @DisplayName("should treat a null priority as MEDIUM")
        void shouldDefaultNullPriority() {
            pool.close();
            pool = newPool(1);
            pool.initializePool(List.of(
                    metadata("busy", Priority.LOW),
                    metadata("first", Priority.LOW),
                    metadata("second", Priority.LOW),
                    metadata("middle", Priority.LOW)), CONVERSATION);
            pool.queuePossibility("busy", Priority.LOW);
            pool.queuePossibility("first", Priority.LOW);
            pool.queuePossibility("second", Priority.LOW);

            pool.queuePossibility("middle", null);

            assertThat(pool.getState().queue()).containsExactly("first", "middle", "second");
        }
    }

    @Nested
    @DisplayName("Streaming")
    class Streaming {

        @Test
        @DisplayName("should accumulate tokens and probability while streaming")
        void shouldAccumulateTokens() {
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 1);

            endpoint.stream("a").token("Hel").token("lo");
            waitUntilAsserted(TIMEOUT, () -> {
                assertThat(status("a")).isEqualTo(PossibilityStatus.STREAMING);
                assertThat(pool.getPossibilityResult("a").orElseThrow().content()).isEqualTo("Hello");
            });

            endpoint.stream("a").probability(0.42).done();
            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);

            PossibilityResult result = pool.getPossibilityResult("a").orElseThrow();
            assertThat(result.content()).isEqualTo("Hello");
            assertThat(result.probability()).isEqualTo(0.42);
            assertThat(result.isComplete()).isTrue();
            waitUntil(TIMEOUT, () -> endpoint.stream("a").isClosed());
        }

        @Test
        @DisplayName("should complete when the body ends without a done event")
        void shouldCompleteOnEndOfBody() {
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 1);

            endpoint.stream("a").emit(": keep-alive").emit("data: not json").token("ok").end();

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);
            assertThat(pool.getPossibilityResult("a").orElseThrow().content()).isEqualTo("ok");
        }

        @Test
        @DisplayName("should sort completed results by probability, missing probability last")
        void shouldSortCompletedByProbability() {
            pool.close();
            pool = newPool(3);
            endpoint.respondWith(m -> switch (m.id()) {
                case "low" -> List.of(StubGenerationEndpoint.tokenLine("l"), StubGenerationEndpoint.probabilityLine(0.2));
                case "best" -> List.of(StubGenerationEndpoint.tokenLine("b"), StubGenerationEndpoint.probabilityLine(0.9));
                default -> List.of(StubGenerationEndpoint.tokenLine("n"));
            });

            initializeAndQueue(
                    metadata("none", Priority.MEDIUM),
                    metadata("low", Priority.MEDIUM),
                    metadata("best", Priority.MEDIUM));

            waitUntil(TIMEOUT, () -> pool.getLoadingStats().completed() == 3);
            assertThat(pool.getCompletedPossibilities())
                    .extracting(PossibilityResult::id)
                    .containsExactly("best", "low", "none");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should isolate a failed request from the other possibilities")
        void shouldIsolateFailure() {
            endpoint.failNextOpen("a", new GenerationException(ErrorType.SERVER_ERROR, "HTTP 503", 503, null));
            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.tokenLine("fine"), StubGenerationEndpoint.doneLine()));

            initializeAndQueue(metadata("a", Priority.MEDIUM), metadata("b", Priority.MEDIUM));

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.ERROR
                    && status("b") == PossibilityStatus.COMPLETE);
            assertThat(pool.getPossibilityError("a")).contains("HTTP 503");
            assertThat(pool.getState().item("a").orElseThrow().errorType()).isEqualTo(ErrorType.SERVER_ERROR);
            assertThat(pool.getState().loadingCount()).isZero();
            assertThat(pool.getCompletedPossibilities()).extracting(PossibilityResult::id).containsExactly("b");
        }

        @Test
        @DisplayName("should fail the item on a provider error event and keep partial output")
        void shouldFailOnErrorEvent() {
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 1);

            endpoint.stream("a").token("half").error("Rate limit exceeded");

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.ERROR);
            PoolItem item = pool.getState().item("a").orElseThrow();
            assertThat(item.errorType()).isEqualTo(ErrorType.PROVIDER_ERROR);
            assertThat(item.error()).isEqualTo("Rate limit exceeded");
            assertThat(item.result().content()).isEqualTo("half");
        }

        @Test
        @DisplayName("should classify transport failures as network errors")
        void shouldClassifyTransportFailure() {
            endpoint.failNextOpen("a", new ConnectException("Connection refused"));

            initializeAndQueue(metadata("a", Priority.MEDIUM));

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.ERROR);
            assertThat(pool.getState().item("a").orElseThrow().errorType()).isEqualTo(ErrorType.NETWORK_ERROR);
            assertThat(pool.getPossibilityError("a")).contains("Connection refused");
        }
    }

    @Nested
    @DisplayName("Cancellation and retry")
    class CancellationAndRetry {

        @Test
        @DisplayName("should abort the stream on cancel and free the slot")
        void shouldCancelActiveItem() {
            initializeAndQueue(
                    metadata("a", Priority.HIGH),
                    metadata("b", Priority.MEDIUM),
                    metadata("c", Priority.LOW));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 1);
            endpoint.stream("a").token("part");
            waitUntil(TIMEOUT, () -> pool.getPossibilityResult("a")
                    .map(PossibilityResult::content).orElse("").equals("part"));

            pool.cancelPossibility("a");

            assertThat(status("a")).isEqualTo(PossibilityStatus.CANCELLED);
            assertThat(status("c").isActive()).isTrue();
            assertThat(pool.getState().loadingCount()).isEqualTo(2);
            waitUntil(TIMEOUT, () -> endpoint.stream("a").isClosed());
            assertThat(pool.getPossibilityResult("a").orElseThrow().content()).isEqualTo("part");
        }

        @Test
        @DisplayName("should run a cancelled item again after retry and queue")
        void shouldRetryCancelledItem() {
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 1);
            pool.cancelPossibility("a");

            pool.retryPossibility("a");
            assertThat(status("a")).isEqualTo(PossibilityStatus.PENDING);
            assertThat(pool.getPossibilityResult("a")).isEmpty();
            assertThat(pool.getState().isQueued("a")).isFalse();

            pool.queuePossibility("a", Priority.MEDIUM);
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 2);
            endpoint.stream("a").token("second try").done();

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);
            assertThat(pool.getPossibilityResult("a").orElseThrow().content()).isEqualTo("second try");
        }

        @Test
        @DisplayName("should retry a failed item")
        void shouldRetryFailedItem() {
            endpoint.failNextOpen("a", new GenerationException(ErrorType.TIMEOUT, "connect timed out"));
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.ERROR);

            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.tokenLine("ok"), StubGenerationEndpoint.doneLine()));
            pool.retryPossibility("a");
            assertThat(pool.getPossibilityError("a")).isEmpty();
            pool.queuePossibility("a", Priority.HIGH);

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);
        }

        @Test
        @DisplayName("should leave terminal items untouched by cancel and pending items by retry")
        void shouldIgnoreInapplicableCancelAndRetry() {
            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.doneLine()));
            pool.initializePool(List.of(metadata("a", Priority.MEDIUM), metadata("b", Priority.MEDIUM)), CONVERSATION);
            pool.queuePossibility("a", Priority.MEDIUM);
            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);

            pool.cancelPossibility("a");
            pool.retryPossibility("b");
            pool.cancelPossibility("unknown");

            assertThat(status("a")).isEqualTo(PossibilityStatus.COMPLETE);
            assertThat(status("b")).isEqualTo(PossibilityStatus.PENDING);
        }

        @Test
        @DisplayName("should cancel every unfinished item and keep completed results")
        void shouldCancelAll() {
            initializeAndQueue(
                    metadata("a", Priority.HIGH),
                    metadata("b", Priority.MEDIUM),
                    metadata("c", Priority.LOW));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("a") == 1);
            endpoint.stream("a").token("kept").done();
            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);

            pool.cancelAll();

            assertThat(status("a")).isEqualTo(PossibilityStatus.COMPLETE);
            assertThat(status("b")).isEqualTo(PossibilityStatus.CANCELLED);
            assertThat(status("c")).isEqualTo(PossibilityStatus.CANCELLED);
            assertThat(pool.getState().loadingCount()).isZero();
            assertThat(pool.getState().queue()).isEmpty();
            assertThat(pool.getCompletedPossibilities()).extracting(PossibilityResult::content).containsExactly("kept");
            waitUntil(TIMEOUT, () -> endpoint.getActiveExchanges() == 0);
        }

        @Test
        @DisplayName("should dispatch normally after cancelAll once items are retried")
        void shouldDispatchAfterCancelAll() {
            initializeAndQueue(metadata("a", Priority.MEDIUM));
            pool.cancelAll();

            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.tokenLine("again"), StubGenerationEndpoint.doneLine()));
            pool.retryPossibility("a");
            pool.queuePossibility("a", Priority.MEDIUM);

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);
        }
    }

    @Nested
    @DisplayName("Pool lifecycle")
    class PoolLifecycle {

        @Test
        @DisplayName("should abort previous streams when re-initialized")
        void shouldAbortPreviousRound() {
            initializeAndQueue(metadata("old", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("old") == 1);

            pool.initializePool(List.of(metadata("new", Priority.MEDIUM)), CONVERSATION);

            waitUntil(TIMEOUT, () -> endpoint.stream("old").isClosed());
            assertThat(pool.getPossibilityStatus("old")).isEmpty();
            assertThat(status("new")).isEqualTo(PossibilityStatus.PENDING);
            assertThat(pool.getState().loadingCount()).isZero();
            assertThat(pool.getState().totalCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should empty the pool on clear")
        void shouldClearPool() {
            initializeAndQueue(metadata("a", Priority.MEDIUM), metadata("b", Priority.MEDIUM));
            waitUntil(TIMEOUT, () -> endpoint.getOpenCount("b") == 1);

            pool.clearPool();

            assertThat(pool.getState().items()).isEmpty();
            assertThat(pool.getLoadingStats()).isEqualTo(LoadingStats.empty());
            waitUntil(TIMEOUT, () -> endpoint.getActiveExchanges() == 0);
        }

        @Test
        @DisplayName("should reject rounds with duplicate ids")
        void shouldRejectDuplicateIds() {
            assertThatThrownBy(() -> pool.initializePool(
                    List.of(metadata("a", Priority.LOW), metadata("a", Priority.HIGH)), CONVERSATION))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should keep working when a listener throws")
        void shouldIsolateFailingListener() {
            pool.addListener((previous, current) -> {
                throw new IllegalStateException("listener bug");
            });
            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.tokenLine("x"), StubGenerationEndpoint.doneLine()));

            initializeAndQueue(metadata("a", Priority.MEDIUM));

            waitUntil(TIMEOUT, () -> status("a") == PossibilityStatus.COMPLETE);
        }

        @Test
        @DisplayName("should notify listeners with previous and current item")
        void shouldNotifyTransitions() {
            List<String> transitions = new CopyOnWriteArrayList<>();
            PoolListener listener = (previous, current) -> transitions.add(
                    (previous != null ? previous.status() : null) + "->" + current.status());
            pool.addListener(listener);
            endpoint.respondWith(m -> List.of(StubGenerationEndpoint.doneLine()));

            initializeAndQueue(metadata("a", Priority.MEDIUM));

            waitUntilAsserted(TIMEOUT, () -> assertThat(transitions)
                    .containsExactly("PENDING->LOADING", "LOADING->STREAMING", "STREAMING->COMPLETE"));
            pool.removeListener(listener);
        }

        @Test
        @DisplayName("should release callers waiting on a command when the pool closes")
        void shouldReleaseWaitingCallersOnClose() throws Exception {
            CountDownLatch loopBlocked = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            pool.addListener((previous, current) -> {
                if (current.id().equals("a") && current.status() == PossibilityStatus.LOADING) {
                    loopBlocked.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
            pool.initializePool(List.of(metadata("a", Priority.MEDIUM), metadata("b", Priority.MEDIUM)), CONVERSATION);

            CompletableFuture<Void> first = CompletableFuture.runAsync(() -> pool.queuePossibility("a", Priority.MEDIUM));
            assertThat(loopBlocked.await(5, TimeUnit.SECONDS)).isTrue();
            CompletableFuture<Void> second = CompletableFuture.runAsync(() -> pool.queuePossibility("b", Priority.MEDIUM));
            CompletableFuture<Void> closing = CompletableFuture.runAsync(pool::close);
            waitUntil(TIMEOUT, () -> !pool.isRunning());
            release.countDown();

            closing.get(15, TimeUnit.SECONDS);
            first.get(5, TimeUnit.SECONDS);
            Throwable secondOutcome = catchThrowable(() -> second.get(5, TimeUnit.SECONDS));
            if (secondOutcome != null) {
                assertThat(secondOutcome).isInstanceOf(ExecutionException.class)
                        .hasCauseInstanceOf(IllegalStateException.class);
            }
            assertThatThrownBy(() -> pool.queuePossibility("b", Priority.MEDIUM))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should refuse operations before start")
        void shouldRefuseOperationsBeforeStart() {
            PossibilityPool notStarted = PossibilityPool.builder().endpoint(endpoint).build();
            try {
                assertThatThrownBy(() -> notStarted.initializePool(List.of(), CONVERSATION))
                        .isInstanceOf(IllegalStateException.class);
            } finally {
                notStarted.close();
            }
        }

        @Test
        @DisplayName("should validate builder settings")
        void shouldValidateBuilder() {
            assertThatThrownBy(() -> PossibilityPool.builder().maxConcurrentConnections(0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> PossibilityPool.builder().ringBufferSize(100))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> PossibilityPool.builder().build())
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
