package fr.lapetina.possibility.round;

import fr.lapetina.possibility.domain.metadata.GenerationSettings;
import fr.lapetina.possibility.domain.metadata.PossibilityMetadataService;
import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.PossibilityResult;
import fr.lapetina.possibility.domain.model.PossibilityStatus;
import fr.lapetina.possibility.infrastructure.http.GenerationException;
import fr.lapetina.possibility.lifecycle.GenerationEvent;
import fr.lapetina.possibility.lifecycle.GenerationEventType;
import fr.lapetina.possibility.lifecycle.GenerationLifecycleStateMachine;
import fr.lapetina.possibility.lifecycle.GenerationState;
import fr.lapetina.possibility.pool.PoolItem;
import fr.lapetina.possibility.pool.PoolListener;
import fr.lapetina.possibility.pool.PoolState;
import fr.lapetina.possibility.pool.PossibilityPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one generation round: feeds the lifecycle state machine from pool activity.
 *
 * Pool notifications arrive on the pool loop thread. Pool operations issued from
 * there (re-queueing failed items) are applied inline by the pool.
 *
 * A possibility cancelled on its own never fails the round. Once every other
 * possibility has completed, the round stays STREAMING until the cancelled ones are
 * requeued with {@link #retryPossibility(String)} or the round itself is cancelled.
 */
public final class GenerationRound implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GenerationRound.class);

    static final String MDC_ROUND_ID = "roundId";

    private final PossibilityPool pool;
    private final GenerationLifecycleStateMachine machine;
    private final PossibilityMetadataService metadataService;
    private final PoolListener poolListener = this::onItemUpdated;
    private final Runnable machineSubscription;
    private final Object terminationMonitor = new Object();

    private volatile String requestId;

    public GenerationRound(
            PossibilityPool pool,
            GenerationLifecycleStateMachine machine,
            PossibilityMetadataService metadataService
    ) {
        this.pool = pool;
        this.machine = machine;
        this.metadataService = metadataService;
        this.pool.addListener(poolListener);
        this.machineSubscription = machine.onStateChange((newState, oldState, context, event) -> {
            synchronized (terminationMonitor) {
                terminationMonitor.notifyAll();
            }
        });
    }

    /**
     * Starts a round for the conversation. A machine left in a terminal state by a
     * previous round is reset first.
     *
     * @return the request id of the round
     * @throws IllegalStateException if a round is still active
     */
    public String start(List<ChatMessage> conversation, GenerationSettings settings) {
        if (machine.getState().isTerminal()) {
            machine.reset();
        }

        String newRequestId = UUID.randomUUID().toString();
        List<PossibilityMetadata> metadata = metadataService.generatePrioritizedMetadata(settings);

        MDC.put(MDC_ROUND_ID, newRequestId);
        try {
            if (!machine.send(new GenerationEvent.StartGeneration(newRequestId, metadata.size()))) {
                throw new IllegalStateException("Round already in progress: state=" + machine.getState());
            }
            requestId = newRequestId;
            log.info("Round started: requestId={}, possibilities={}", newRequestId, metadata.size());

            pool.initializePool(metadata, conversation);
            machine.send(new GenerationEvent.GenerationInitialized(newRequestId));

            if (metadata.isEmpty()) {
                machine.send(new GenerationEvent.StreamingStarted(newRequestId, 0));
                machine.send(new GenerationEvent.AllCompleted(newRequestId, 0));
                return newRequestId;
            }

            for (PossibilityMetadata m : metadata) {
                pool.queuePossibility(m.id(), m.priority());
            }
            return newRequestId;
        } finally {
            MDC.remove(MDC_ROUND_ID);
        }
    }

    /**
     * Retries a failed round: every ERROR or CANCELLED possibility is reset and queued again.
     *
     * @return false if the machine is not FAILED or the retry budget is spent
     */
    public boolean retry() {
        String id = requestId;
        if (id == null || !machine.is(GenerationState.FAILED)) {
            return false;
        }
        MDC.put(MDC_ROUND_ID, id);
        try {
            int attempt = machine.getContext().retryAttempt() + 1;
            if (!machine.send(new GenerationEvent.RetryGeneration(id, attempt))) {
                log.warn("Round retry refused: requestId={}, attempt={}, maxRetries={}",
                        id, attempt, machine.getContext().maxRetries());
                return false;
            }

            List<PoolItem> failed = retryableItems(pool.getState());
            for (PoolItem item : failed) {
                pool.retryPossibility(item.id());
            }
            machine.send(new GenerationEvent.GenerationInitialized(id));
            for (PoolItem item : failed) {
                pool.queuePossibility(item.id(), item.metadata().priority());
            }
            log.info("Round retried: requestId={}, attempt={}, requeued={}", id, attempt, failed.size());

            checkRoundFinished();
            return true;
        } finally {
            MDC.remove(MDC_ROUND_ID);
        }
    }

    /**
     * Resets one ERROR or CANCELLED possibility and queues it again while the round
     * is still running.
     *
     * @return false if the round is not running or the possibility cannot be retried
     */
    public boolean retryPossibility(String possibilityId) {
        String id = requestId;
        if (id == null || !machine.getState().isActive()) {
            return false;
        }
        PoolItem item = pool.getState().item(possibilityId).orElse(null);
        if (item == null || !item.status().isRetryable()) {
            return false;
        }
        pool.retryPossibility(possibilityId);
        pool.queuePossibility(possibilityId, item.metadata().priority());
        log.info("Possibility requeued: requestId={}, possibilityId={}", id, possibilityId);
        return true;
    }

    /**
     * Cancels the round and aborts every active stream. Completed results stay readable.
     *
     * @return whether the state machine accepted the cancellation
     */
    public boolean cancel(String reason) {
        boolean accepted = machine.send(new GenerationEvent.CancelGeneration(requestId, reason));
        pool.cancelAll();
        log.info("Round cancelled: requestId={}, reason={}, accepted={}", requestId, reason, accepted);
        return accepted;
    }

    /**
     * Waits until the round is COMPLETED, FAILED or CANCELLED.
     *
     * @return the state reached, or the current state if the timeout elapsed first
     */
    public GenerationState awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (terminationMonitor) {
            while (!machine.getState().isTerminal()) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    break;
                }
                long millis = Math.max(1, remainingNanos / 1_000_000);
                terminationMonitor.wait(millis);
            }
        }
        return machine.getState();
    }

    private void onItemUpdated(PoolItem previous, PoolItem current) {
        String id = requestId;
        if (id == null || !machine.getState().isActive()) {
            return;
        }
        PossibilityStatus before = previous != null ? previous.status() : null;
        PossibilityStatus after = current.status();

        if (after == PossibilityStatus.STREAMING && before != PossibilityStatus.STREAMING) {
            if (machine.is(GenerationState.GENERATING)) {
                machine.send(new GenerationEvent.StreamingStarted(id, pool.getState().loadingCount()));
            }
        } else if (after == PossibilityStatus.STREAMING) {
            String token = newText(previous, current);
            if (!token.isEmpty() && machine.can(GenerationEventType.TOKEN_RECEIVED)) {
                machine.send(new GenerationEvent.TokenReceived(id, current.id(), token));
            }
        } else if (after == PossibilityStatus.COMPLETE && before != PossibilityStatus.COMPLETE) {
            if (machine.can(GenerationEventType.POSSIBILITY_COMPLETED)) {
                machine.send(new GenerationEvent.PossibilityCompleted(id, current.id()));
            }
        } else if (after == PossibilityStatus.ERROR && before != PossibilityStatus.ERROR) {
            if (handleEarlyFailure(id, current)) {
                return;
            }
        }

        checkRoundFinished();
    }

    /**
     * A possibility failing before any stream opened is reported to the machine right
     * away. If the machine keeps the round alive, the round is retried in place.
     *
     * @return true if the failure was handled
     */
    private boolean handleEarlyFailure(String id, PoolItem item) {
        if (!machine.is(GenerationState.GENERATING)) {
            return false;
        }
        ErrorType errorType = item.errorType() != null ? item.errorType() : ErrorType.INTERNAL_ERROR;
        GenerationException error = new GenerationException(errorType, item.id() + ": " + item.error());

        if (machine.send(new GenerationEvent.ErrorOccurred(id, error, errorType.isRetryable()))) {
            log.warn("Round failed before streaming: requestId={}, possibilityId={}, errorType={}",
                    id, item.id(), errorType);
            return true;
        }

        int attempt = machine.getContext().retryAttempt() + 1;
        if (!machine.send(new GenerationEvent.RetryGeneration(id, attempt))) {
            return false;
        }
        pool.retryPossibility(item.id());
        machine.send(new GenerationEvent.GenerationInitialized(id));
        pool.queuePossibility(item.id(), item.metadata().priority());
        log.info("Possibility requeued after retryable failure: requestId={}, possibilityId={}, attempt={}",
                id, item.id(), attempt);
        return true;
    }

    private void checkRoundFinished() {
        String id = requestId;
        PoolState snapshot = pool.getState();
        if (id == null || !snapshot.allTerminal()) {
            return;
        }
        if (!machine.is(GenerationState.GENERATING) && !machine.is(GenerationState.STREAMING)) {
            return;
        }

        Map<PossibilityStatus, Integer> counts = snapshot.countByStatus();
        int completed = counts.get(PossibilityStatus.COMPLETE);
        if (completed == snapshot.totalCount()) {
            if (machine.is(GenerationState.GENERATING)) {
                machine.send(new GenerationEvent.StreamingStarted(id, 0));
            }
            machine.send(new GenerationEvent.AllCompleted(id, completed));
            log.info("Round completed: requestId={}, possibilities={}", id, completed);
            return;
        }

        int failed = counts.get(PossibilityStatus.ERROR);
        int cancelled = counts.get(PossibilityStatus.CANCELLED);
        if (failed == 0) {
            log.info("Round waiting on cancelled possibilities: requestId={}, completed={}, cancelled={}",
                    id, completed, cancelled);
            return;
        }
        ErrorType errorType = snapshot.items().values().stream()
                .map(PoolItem::errorType)
                .filter(t -> t != null)
                .findFirst()
                .orElse(ErrorType.INTERNAL_ERROR);
        GenerationException error = new GenerationException(errorType, String.format(
                "Round finished with failures: completed=%d, failed=%d, cancelled=%d", completed, failed, cancelled));

        machine.send(new GenerationEvent.ErrorOccurred(id, error, false));
        log.warn("Round failed: requestId={}, completed={}, failed={}, cancelled={}", id, completed, failed, cancelled);
    }

    private static String newText(PoolItem previous, PoolItem current) {
        String before = previous != null && previous.result() != null ? previous.result().content() : "";
        String after = current.result() != null ? current.result().content() : "";
        if (after.length() > before.length() && after.startsWith(before)) {
            return after.substring(before.length());
        }
        return "";
    }

    private static List<PoolItem> retryableItems(PoolState snapshot) {
        List<PoolItem> items = new ArrayList<>();
        for (PoolItem item : snapshot.items().values()) {
            if (item.status().isRetryable()) {
                items.add(item);
            }
        }
        return items;
    }

    public String getRequestId() {
        return requestId;
    }

    public GenerationState getState() {
        return machine.getState();
    }

    public List<PossibilityResult> getCompletedPossibilities() {
        return pool.getCompletedPossibilities();
    }

    public PossibilityPool getPool() {
        return pool;
    }

    public GenerationLifecycleStateMachine getMachine() {
        return machine;
    }

    /**
     * Detaches the round from its pool and state machine. Does not close them.
     */
    @Override
    public void close() {
        pool.removeListener(poolListener);
        machineSubscription.run();
    }
}
