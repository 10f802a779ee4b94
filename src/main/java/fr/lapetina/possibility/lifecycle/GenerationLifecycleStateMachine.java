package fr.lapetina.possibility.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guarded finite-state machine tracking one generation round.
 *
 * Transitions are evaluated in table order; the first one matching the current state
 * and event type whose guard passes is taken. State and context are updated under a
 * lock, listeners are notified afterwards on the sending thread so that a listener may
 * call back into the machine or into the pool without holding the lock.
 *
 * Notifications are queued under the lock and delivered by one thread at a time, so
 * every listener sees transitions in the order they were taken, also when several
 * threads send concurrently or a listener sends from inside a notification. A send
 * may therefore return before its own notification has been delivered by another
 * thread.
 */
public final class GenerationLifecycleStateMachine {

    private static final Logger log = LoggerFactory.getLogger(GenerationLifecycleStateMachine.class);

    private final List<StateTransition> transitions;
    private final int maxRetries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final CopyOnWriteArrayList<StateChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ArrayDeque<Notification> pendingNotifications = new ArrayDeque<>();
    private final AtomicBoolean delivering = new AtomicBoolean(false);

    private volatile GenerationState state = GenerationState.IDLE;
    private volatile GenerationContext context;

    public GenerationLifecycleStateMachine(List<StateTransition> transitions, int maxRetries, Clock clock) {
        this.transitions = List.copyOf(transitions);
        this.maxRetries = maxRetries;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.context = GenerationContext.initial(maxRetries);
    }

    public GenerationLifecycleStateMachine(int maxRetries) {
        this(TransitionDefinitions.standard(maxRetries), maxRetries, Clock.systemUTC());
    }

    public GenerationLifecycleStateMachine() {
        this(GenerationContext.DEFAULT_MAX_RETRIES);
    }

    /**
     * Feeds an event to the machine.
     *
     * @return true if a transition was taken, false if the event was malformed or
     *         no transition applies from the current state
     */
    public boolean send(GenerationEvent event) {
        if (event == null || event.type() == null) {
            log.warn("Rejected invalid lifecycle event: event={}", event);
            return false;
        }
        if (!event.isWellFormed()) {
            log.warn("Rejected malformed lifecycle event: type={}, event={}", event.type(), event);
            return false;
        }

        GenerationState oldState;
        GenerationState newState;
        GenerationContext newContext;

        lock.lock();
        try {
            oldState = state;
            StateTransition transition = findTransition(oldState, event);
            if (transition == null) {
                log.warn("No valid transition: state={}, event={}", oldState, event.type());
                return false;
            }
            newContext = transition.apply(context, event, clock.instant());
            newState = transition.to();
            context = newContext;
            state = newState;
            pendingNotifications.add(new Notification(newState, oldState, newContext, event));
        } finally {
            lock.unlock();
        }

        if (oldState != newState) {
            log.info("Lifecycle transition: requestId={}, from={}, to={}, event={}",
                    newContext.requestId(), oldState, newState, event.type());
        } else {
            log.trace("Lifecycle self-transition: state={}, event={}", newState, event.type());
        }
        deliverNotifications();
        return true;
    }

    private StateTransition findTransition(GenerationState from, GenerationEvent event) {
        for (StateTransition transition : transitions) {
            if (transition.matches(from, event.type()) && transition.allows(context, event)) {
                return transition;
            }
        }
        return null;
    }

    private void deliverNotifications() {
        while (delivering.compareAndSet(false, true)) {
            try {
                Notification notification;
                while ((notification = pollNotification()) != null) {
                    notifyListeners(notification);
                }
            } finally {
                delivering.set(false);
            }
            // a sender may have queued after the last poll and seen delivery in progress
            if (!hasPendingNotifications()) {
                return;
            }
        }
    }

    private Notification pollNotification() {
        lock.lock();
        try {
            return pendingNotifications.poll();
        } finally {
            lock.unlock();
        }
    }

    private boolean hasPendingNotifications() {
        lock.lock();
        try {
            return !pendingNotifications.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    private void notifyListeners(Notification notification) {
        for (StateChangeListener listener : listeners) {
            try {
                listener.onStateChange(notification.newState(), notification.oldState(),
                        notification.context(), notification.event());
            } catch (Exception e) {
                log.error("State change listener failed: state={}, event={}",
                        notification.newState(), notification.event().type(), e);
            }
        }
    }

    private record Notification(GenerationState newState, GenerationState oldState,
                                GenerationContext context, GenerationEvent event) {
    }

    public GenerationState getState() {
        return state;
    }

    public GenerationContext getContext() {
        return context;
    }

    public boolean is(GenerationState candidate) {
        return state == candidate;
    }

    /**
     * Whether some transition exists for this event type from the current state.
     * Guards are not evaluated since they depend on the event payload.
     */
    public boolean can(GenerationEventType eventType) {
        GenerationState current = state;
        for (StateTransition transition : transitions) {
            if (transition.matches(current, eventType)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Registers a listener.
     *
     * @return a handle that unregisters the listener when run
     */
    public Runnable onStateChange(StateChangeListener listener) {
        Objects.requireNonNull(listener, "listener is required");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public MachineStatus getStatus() {
        GenerationState current;
        GenerationContext ctx;
        lock.lock();
        try {
            current = state;
            ctx = context;
        } finally {
            lock.unlock();
        }

        double progress = ctx.possibilityCount() > 0
                ? (double) ctx.completedCount() / ctx.possibilityCount()
                : 0.0;
        Instant start = ctx.startTime();
        Duration duration = start != null ? Duration.between(start, clock.instant()) : null;
        boolean canRetry = ctx.retryAttempt() < ctx.maxRetries()
                && (current == GenerationState.FAILED || !ctx.errors().isEmpty());

        return new MachineStatus(current, progress, duration, current.isActive(), canRetry, ctx.errors().size());
    }

    /**
     * Returns to IDLE with a fresh context. Does nothing when already idle.
     */
    public void reset() {
        if (state != GenerationState.IDLE) {
            send(new GenerationEvent.Reset());
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "GenerationLifecycleStateMachine{" +
                "state=" + state +
                ", requestId=" + context.requestId() +
                '}';
    }
}
