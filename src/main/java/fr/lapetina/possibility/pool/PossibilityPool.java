package fr.lapetina.possibility.pool;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.possibility.domain.event.StreamEventParser;
import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.PossibilityResult;
import fr.lapetina.possibility.domain.model.PossibilityStatus;
import fr.lapetina.possibility.domain.model.Priority;
import fr.lapetina.possibility.infrastructure.config.OrchestratorConfig;
import fr.lapetina.possibility.infrastructure.http.GenerationEndpoint;
import fr.lapetina.possibility.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Runs the possibilities of a round under a fixed concurrency ceiling.
 *
 * SINGLE CONSUMER LOOP:
 *
 * Every state change goes through one Disruptor consumer thread. Callers publish
 * commands and wait for them to be applied; streaming tasks publish their
 * observations (stream opened, tokens, completion, failure) without waiting.
 * Queue processing therefore never runs concurrently with itself, and the
 * {@code loadingCount <= maxConcurrentConnections} invariant is checked and updated
 * by a single thread.
 *
 * A pool operation called from the loop thread itself (for example from a
 * {@link PoolListener}) is applied inline. The queue processing guard keeps such
 * nested calls from re-entering the dispatch loop.
 *
 * STATE:
 *
 * The state is an immutable {@link PoolState} snapshot swapped on every change, so
 * readers on any thread see a consistent view without locking.
 *
 * CANCELLATION:
 *
 * Every dispatch gets a fresh {@link CancellationHandle} from the round's
 * {@link CancellationScope}. Reports from a task whose handle no longer owns the item
 * (cancelled, retried, re-initialized) are ignored.
 */
public final class PossibilityPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PossibilityPool.class);

    public static final int DEFAULT_MAX_CONCURRENT_CONNECTIONS = 6;

    private final int maxConcurrentConnections;
    private final GenerationEndpoint endpoint;
    private final StreamEventParser parser;
    private final Function<PossibilityMetadata, Duration> loadTimeEstimator;
    private final MetricsRegistry metrics;
    private final Clock clock;

    private final Disruptor<PoolCommand> disruptor;
    private final RingBuffer<PoolCommand> ringBuffer;
    private final ExecutorService streamExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<CompletableFuture<Void>> pendingCommands = ConcurrentHashMap.newKeySet();
    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.empty());
    private final CopyOnWriteArrayList<PoolListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger roundCounter = new AtomicInteger(0);

    private volatile Thread loopThread;

    // Confined to the loop thread
    private CancellationScope scope = new CancellationScope("pool-0");
    private List<ChatMessage> conversation = List.of();
    private boolean processingQueue;

    private PossibilityPool(Builder builder) {
        this.maxConcurrentConnections = builder.maxConcurrentConnections;
        this.endpoint = builder.endpoint;
        this.parser = builder.parser;
        this.loadTimeEstimator = builder.loadTimeEstimator;
        this.metrics = builder.metrics;
        this.clock = builder.clock;

        this.streamExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("possibility-stream", true));

        this.disruptor = new Disruptor<>(
                new PoolCommandFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("possibility-pool", true),
                ProducerType.MULTI, // callers and streaming tasks publish concurrently
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(new PoolLoop());
        disruptor.setDefaultExceptionHandler(new PoolLoopExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("PossibilityPool created: maxConcurrentConnections={}, ringBufferSize={}, waitStrategy={}",
                maxConcurrentConnections, builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the command loop. Operations fail until the pool is started.
     */
    public PossibilityPool start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("PossibilityPool started");
        }
        return this;
    }

    // ---------------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------------

    /**
     * Replaces the pool content with one PENDING item per metadata entry.
     * Streams of the previous round are aborted. Nothing is dispatched yet.
     *
     * @throws IllegalArgumentException if two entries share an id
     */
    public void initializePool(List<PossibilityMetadata> metadataList, List<ChatMessage> conversation) {
        List<PossibilityMetadata> metadataCopy = List.copyOf(metadataList);
        List<ChatMessage> conversationCopy = conversation != null ? List.copyOf(conversation) : List.of();
        execute(c -> c.initialize(PoolCommandType.INITIALIZE, null).round(metadataCopy, conversationCopy));
    }

    /**
     * Inserts a PENDING item in the queue according to its priority, then dispatches
     * as many queued items as free slots allow. Does nothing for unknown, non-pending
     * or already queued items.
     */
    public void queuePossibility(String possibilityId, Priority priority) {
        Priority effective = priority != null ? priority : Priority.MEDIUM;
        execute(c -> c.initialize(PoolCommandType.QUEUE, possibilityId).priority(effective));
    }

    /**
     * Aborts the item's stream and marks it CANCELLED. Terminal items are left untouched.
     */
    public void cancelPossibility(String possibilityId) {
        execute(c -> c.initialize(PoolCommandType.CANCEL, possibilityId));
    }

    /**
     * Moves an ERROR or CANCELLED item back to PENDING with its partial output cleared.
     * The item is not queued again; call {@link #queuePossibility} to run it.
     */
    public void retryPossibility(String possibilityId) {
        execute(c -> c.initialize(PoolCommandType.RETRY, possibilityId));
    }

    /**
     * Aborts every active stream and empties the pool.
     */
    public void clearPool() {
        execute(c -> c.initialize(PoolCommandType.CLEAR, null));
    }

    /**
     * Aborts every active stream and marks every non-terminal item CANCELLED.
     * Completed results stay readable.
     */
    public void cancelAll() {
        execute(c -> c.initialize(PoolCommandType.CANCEL_ALL, null));
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public Optional<PossibilityStatus> getPossibilityStatus(String possibilityId) {
        return state.get().item(possibilityId).map(PoolItem::status);
    }

    public Optional<PossibilityResult> getPossibilityResult(String possibilityId) {
        return state.get().item(possibilityId).map(PoolItem::result);
    }

    public Optional<String> getPossibilityError(String possibilityId) {
        return state.get().item(possibilityId).map(PoolItem::error);
    }

    /**
     * Results of COMPLETE items, highest probability first.
     * Items without probability come last; ties keep initialization order.
     */
    public List<PossibilityResult> getCompletedPossibilities() {
        return state.get().items().values().stream()
                .filter(item -> item.status() == PossibilityStatus.COMPLETE && item.result() != null)
                .map(PoolItem::result)
                .sorted(Comparator.comparing(PossibilityResult::probability,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public LoadingStats getLoadingStats() {
        return state.get().stats();
    }

    public PoolState getState() {
        return state.get();
    }

    public int getMaxConcurrentConnections() {
        return maxConcurrentConnections;
    }

    public boolean isRunning() {
        return running.get();
    }

    public void addListener(PoolListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PoolListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // Command publication
    // ---------------------------------------------------------------------

    private void execute(Consumer<PoolCommand> filler) {
        if (Thread.currentThread() == loopThread) {
            PoolCommand command = new PoolCommand();
            filler.accept(command);
            apply(command);
            return;
        }
        if (!running.get()) {
            throw new IllegalStateException("PossibilityPool not running");
        }

        CompletableFuture<Void> applied = new CompletableFuture<>();
        pendingCommands.add(applied);
        try {
            long sequence = ringBuffer.next();
            try {
                PoolCommand command = ringBuffer.get(sequence);
                filler.accept(command);
                command.completion(applied);
            } finally {
                ringBuffer.publish(sequence);
            }
            // published while close() was halting the loop
            if (!running.get()) {
                applied.completeExceptionally(new IllegalStateException("PossibilityPool closed"));
            }
            applied.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        } finally {
            pendingCommands.remove(applied);
        }
    }

    /**
     * Publishes a task observation. Dropped once the pool is closed.
     */
    private void report(Consumer<PoolCommand> filler) {
        if (!running.get()) {
            log.debug("Pool closed, dropping task report");
            return;
        }
        long sequence = ringBuffer.next();
        try {
            filler.accept(ringBuffer.get(sequence));
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    // ---------------------------------------------------------------------
    // Loop-side application
    // ---------------------------------------------------------------------

    private void apply(PoolCommand command) {
        String id = command.getPossibilityId();
        switch (command.getType()) {
            case INITIALIZE -> doInitialize(command.getMetadataList(), command.getConversation());
            case QUEUE -> {
                boolean queued = update(s -> PoolStateTransitions.enqueue(s, id, command.getPriority()));
                if (!queued) {
                    log.debug("Queue request ignored: possibilityId={}, status={}",
                            id, state.get().item(id).map(PoolItem::status).orElse(null));
                }
                processQueue();
            }
            case CANCEL -> doCancel(id);
            case RETRY -> {
                if (update(s -> PoolStateTransitions.retry(s, id))) {
                    log.info("Possibility reset for retry: possibilityId={}", id);
                } else {
                    log.debug("Retry request ignored: possibilityId={}, status={}",
                            id, state.get().item(id).map(PoolItem::status).orElse(null));
                }
            }
            case CLEAR -> doClear();
            case CANCEL_ALL -> doCancelAll();
            case STREAM_OPENED -> update(s -> PoolStateTransitions.markStreaming(s, id, command.getHandle()));
            case TOKEN -> {
                String token = command.getToken();
                if (update(s -> PoolStateTransitions.updateResult(s, id, command.getHandle(),
                        r -> r.appendToken(token))) && metrics != null) {
                    metrics.incrementTokens();
                }
            }
            case PROBABILITY -> update(s -> PoolStateTransitions.updateResult(s, id, command.getHandle(),
                    r -> r.withProbability(command.getProbability(), command.getLogprobs())));
            case COMPLETED -> doComplete(id, command.getHandle());
            case FAILED -> doFail(id, command);
            case ABORTED -> doAbort(id, command.getHandle());
        }
    }

    private void doInitialize(List<PossibilityMetadata> metadataList, List<ChatMessage> newConversation) {
        PoolState next = PoolStateTransitions.initialize(metadataList, loadTimeEstimator);

        int aborted = scope.cancelAll();
        scope = new CancellationScope("pool-" + roundCounter.incrementAndGet());
        conversation = newConversation;
        state.set(next);
        updateGauges(next);

        log.info("Pool initialized: possibilities={}, abortedPrevious={}, scope={}",
                next.totalCount(), aborted, scope.getName());
    }

    private void doCancel(String id) {
        Optional<PoolItem> item = state.get().item(id);
        if (item.isEmpty() || item.get().status().isTerminal()) {
            log.debug("Cancel request ignored: possibilityId={}, status={}",
                    id, item.map(PoolItem::status).orElse(null));
            return;
        }

        CancellationHandle handle = item.get().cancellationHandle();
        update(s -> PoolStateTransitions.cancel(s, id));
        if (handle != null) {
            handle.cancel();
            scope.detach(handle);
        }
        recordOutcome(item.get(), PossibilityStatus.CANCELLED);
        log.info("Possibility cancelled: possibilityId={}, previousStatus={}", id, item.get().status());
        processQueue();
    }

    private void doClear() {
        int aborted = scope.cancelAll();
        scope = new CancellationScope("pool-" + roundCounter.incrementAndGet());
        conversation = List.of();
        state.set(PoolState.empty());
        updateGauges(PoolState.empty());
        log.info("Pool cleared: abortedStreams={}", aborted);
    }

    private void doCancelAll() {
        int aborted = scope.cancelAll();
        scope = new CancellationScope("pool-" + roundCounter.incrementAndGet());

        int cancelled = 0;
        for (PoolItem item : state.get().items().values()) {
            if (!item.status().isTerminal() && update(s -> PoolStateTransitions.cancel(s, item.id()))) {
                recordOutcome(item, PossibilityStatus.CANCELLED);
                cancelled++;
            }
        }
        log.info("All possibilities cancelled: cancelled={}, abortedStreams={}", cancelled, aborted);
    }

    private void doComplete(String id, CancellationHandle handle) {
        Optional<PoolItem> before = state.get().item(id);
        if (!update(s -> PoolStateTransitions.complete(s, id, handle, clock.instant()))) {
            log.debug("Stale completion ignored: possibilityId={}", id);
            return;
        }
        scope.detach(handle);

        PoolItem item = before.get();
        Duration elapsed = item.loadingStartTime() != null
                ? Duration.between(item.loadingStartTime(), clock.instant())
                : Duration.ZERO;
        int length = state.get().item(id).map(PoolItem::result).map(r -> r.content().length()).orElse(0);
        log.info("Possibility completed: possibilityId={}, provider={}, model={}, chars={}, durationMs={}",
                id, item.metadata().provider(), item.metadata().model(), length, elapsed.toMillis());
        if (metrics != null) {
            metrics.recordStreamDuration(item.metadata().provider(), elapsed);
        }
        recordOutcome(item, PossibilityStatus.COMPLETE);
        processQueue();
    }

    private void doFail(String id, PoolCommand command) {
        Optional<PoolItem> before = state.get().item(id);
        CancellationHandle handle = command.getHandle();
        if (!update(s -> PoolStateTransitions.fail(s, id, handle, command.getErrorType(), command.getErrorMessage()))) {
            log.debug("Stale failure ignored: possibilityId={}", id);
            return;
        }
        scope.detach(handle);

        PoolItem item = before.get();
        log.warn("Possibility failed: possibilityId={}, provider={}, model={}, errorType={}, error={}",
                id, item.metadata().provider(), item.metadata().model(),
                command.getErrorType(), command.getErrorMessage());
        if (metrics != null) {
            metrics.incrementErrorCount(item.metadata().provider(), command.getErrorType());
        }
        recordOutcome(item, PossibilityStatus.ERROR);
        processQueue();
    }

    private void doAbort(String id, CancellationHandle handle) {
        scope.detach(handle);
        Optional<PoolItem> item = state.get().item(id);
        if (item.isPresent() && item.get().status().isActive() && item.get().isOwnedBy(handle)) {
            // Aborted from outside the pool: give the slot back, keep the item retryable
            update(s -> PoolStateTransitions.cancel(s, id));
            recordOutcome(item.get(), PossibilityStatus.CANCELLED);
            log.info("Possibility aborted: possibilityId={}", id);
        }
        processQueue();
    }

    /**
     * Dispatches queued items while slots are free. Guarded against re-entry from
     * listeners that call pool operations inline.
     */
    private void processQueue() {
        if (processingQueue) {
            return;
        }
        processingQueue = true;
        try {
            while (true) {
                PoolState current = state.get();
                String id = PoolStateTransitions.nextDispatchable(current, maxConcurrentConnections);
                if (id == null) {
                    return;
                }

                PoolItem head = current.items().get(id);
                CancellationHandle handle = head != null && head.status() == PossibilityStatus.PENDING
                        ? scope.newHandle(id)
                        : null;
                Instant now = clock.instant();
                update(s -> PoolStateTransitions.dispatchHead(s, handle, now));
                if (handle == null) {
                    continue;
                }

                PoolItem dispatched = state.get().items().get(id);
                if (dispatched != null && dispatched.status() == PossibilityStatus.LOADING
                        && dispatched.isOwnedBy(handle)) {
                    startTask(dispatched, handle);
                } else {
                    scope.detach(handle);
                }
            }
        } finally {
            processingQueue = false;
        }
    }

    private void startTask(PoolItem item, CancellationHandle handle) {
        log.debug("Dispatching possibility: possibilityId={}, provider={}, model={}, loadingCount={}",
                item.id(), item.metadata().provider(), item.metadata().model(), state.get().loadingCount());
        try {
            streamExecutor.execute(new PossibilityStreamTask(
                    item.metadata(), conversation, handle, endpoint, parser, this::report));
        } catch (RejectedExecutionException e) {
            log.error("Stream executor rejected possibility: possibilityId={}", item.id(), e);
            update(s -> PoolStateTransitions.fail(s, item.id(), handle,
                    ErrorType.INTERNAL_ERROR, "Executor rejected task"));
            scope.detach(handle);
        }
    }

    /**
     * Swaps in the next state and notifies listeners of every item that changed.
     *
     * @return false when the transition was a no-op
     */
    private boolean update(UnaryOperator<PoolState> transition) {
        PoolState previous = state.get();
        PoolState next = transition.apply(previous);
        if (next == previous) {
            return false;
        }
        state.set(next);
        updateGauges(next);

        for (PoolItem current : next.items().values()) {
            PoolItem before = previous.items().get(current.id());
            if (before != current) {
                notifyListeners(before, current);
            }
        }
        return true;
    }

    private void notifyListeners(PoolItem previous, PoolItem current) {
        for (PoolListener listener : listeners) {
            try {
                listener.onItemUpdated(previous, current);
            } catch (Exception e) {
                log.error("Pool listener failed: possibilityId={}, status={}", current.id(), current.status(), e);
            }
        }
    }

    private void updateGauges(PoolState snapshot) {
        if (metrics != null) {
            metrics.setActiveStreams(snapshot.loadingCount());
            metrics.setQueueDepth(snapshot.queue().size());
        }
    }

    private void recordOutcome(PoolItem item, PossibilityStatus status) {
        if (metrics != null) {
            metrics.incrementOutcome(item.metadata().provider(), item.metadata().model(), status);
        }
    }

    /**
     * Stops the loop, then aborts streams still running.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down PossibilityPool...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("PossibilityPool loop shutdown timed out, halting...");
                disruptor.halt();
            }
            failPendingCommands();
            scope.cancelAll();
            streamExecutor.shutdownNow();
            try {
                if (!streamExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Stream tasks still running after shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("PossibilityPool shut down");
        }
    }

    private void failPendingCommands() {
        int failed = 0;
        for (CompletableFuture<Void> pending : pendingCommands) {
            if (pending.completeExceptionally(new IllegalStateException("PossibilityPool closed"))) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Pool closed with unapplied commands: failed={}", failed);
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private final class PoolLoop implements EventHandler<PoolCommand>, LifecycleAware {

        @Override
        public void onEvent(PoolCommand command, long sequence, boolean endOfBatch) {
            CompletableFuture<Void> completion = command.getCompletion();
            try {
                apply(command);
                if (completion != null) {
                    completion.complete(null);
                }
            } catch (RuntimeException e) {
                if (completion != null) {
                    completion.completeExceptionally(e);
                } else {
                    throw e;
                }
            } finally {
                command.clear();
            }
        }

        @Override
        public void onStart() {
            loopThread = Thread.currentThread();
        }

        @Override
        public void onShutdown() {
            loopThread = null;
        }
    }

    private static final class PoolLoopExceptionHandler implements ExceptionHandler<PoolCommand> {

        @Override
        public void handleEventException(Throwable ex, long sequence, PoolCommand event) {
            log.error("Exception in pool loop: sequence={}, command={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during pool loop start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during pool loop shutdown", ex);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix, boolean daemon) {
            this.namePrefix = namePrefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }

    /**
     * Builder for PossibilityPool.
     */
    public static final class Builder {
        private int maxConcurrentConnections = DEFAULT_MAX_CONCURRENT_CONNECTIONS;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private GenerationEndpoint endpoint;
        private StreamEventParser parser = new StreamEventParser();
        private Function<PossibilityMetadata, Duration> loadTimeEstimator = m -> Duration.ZERO;
        private MetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder maxConcurrentConnections(int max) {
            if (max < 1) {
                throw new IllegalArgumentException("maxConcurrentConnections must be at least 1");
            }
            this.maxConcurrentConnections = max;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder endpoint(GenerationEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder parser(StreamEventParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder loadTimeEstimator(Function<PossibilityMetadata, Duration> estimator) {
            this.loadTimeEstimator = estimator;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            maxConcurrentConnections(config.getPool().getMaxConcurrentConnections());
            ringBufferSize(config.getPool().getRingBufferSize());
            this.waitStrategy = config.getPool().getWaitStrategy();
            return this;
        }

        public PossibilityPool build() {
            if (endpoint == null) {
                throw new IllegalStateException("GenerationEndpoint is required");
            }
            return new PossibilityPool(this);
        }
    }
}
