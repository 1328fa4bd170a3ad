package com.warden.state;

import com.warden.config.BotConfig;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative holder of the bot's current state.
 *
 * <p>{@link #requestTransition} is the only way to change state. Callers on any thread
 * may request a transition; the machine serializes them so that at most one is in
 * flight at a time. Arbitration:
 * <ul>
 *   <li>A request that meets an in-flight transition of equal or higher priority is
 *       rejected as {@code BUSY}; the first request received wins.</li>
 *   <li>A {@link TransitionPriority#PREEMPTIVE} request that meets a {@code NORMAL}
 *       transition supersedes it. Before commit the normal transition is abandoned.
 *       After commit, while its enter hooks still run, the preemptive request waits for
 *       it to finish and is then resolved from the state the normal transition left.
 *       Either way the normal caller receives {@code SUPERSEDED}.</li>
 *   <li>After a preemptive transition commits, normal requests are rejected as
 *       {@code PREEMPTED} until the loop starts its next tick. The loop therefore never
 *       overrides a safety decision it has not yet seen.</li>
 * </ul>
 *
 * <p>{@link #currentState()} is a lock-free read and never blocks.
 */
@Slf4j
@Singleton
public class BotStateMachine {

    private static final int HISTORY_LIMIT = 200;
    private static final String DEFAULT_ORIGIN = "unspecified";

    private final TransitionGraph graph;
    private final Duration waitTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition settled = lock.newCondition();
    private final Condition stateChanged = lock.newCondition();

    private final Map<BotState, List<StateHook>> hooks = new EnumMap<>(BotState.class);
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<TransitionRecord> history = new ArrayDeque<>();
    private final AtomicLong invalidTransitions = new AtomicLong();
    private final AtomicLong acceptedTransitions = new AtomicLong();

    private volatile BotState current = BotState.IDLE;
    private volatile BotState previous = BotState.IDLE;
    private volatile Instant enteredAt = Instant.now();
    private volatile Observation latestObservation = Observation.unknown();

    // guarded by lock
    private Flight inFlight;
    private boolean preemptionLatched;

    @Inject
    public BotStateMachine(TransitionGraph graph, BotConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.waitTimeout = config.getTransitionWaitTimeout();
        for (BotState state : BotState.values()) {
            hooks.put(state, new CopyOnWriteArrayList<>());
        }
        log.info("BotStateMachine initialized with {}", graph);
    }

    // ========================================================================
    // Transitions
    // ========================================================================

    /**
     * Request a transition on behalf of an unnamed caller.
     *
     * @see #requestTransition(BotState, TransitionPriority, String)
     */
    public TransitionResult requestTransition(BotState target, TransitionPriority priority) {
        return requestTransition(target, priority, DEFAULT_ORIGIN);
    }

    /**
     * Request a transition to {@code target}.
     *
     * <p>Graph and guard violations, contention losses and same-state requests are all
     * reported through the returned result; nothing is thrown. Every outcome is
     * recorded in the history and sent to listeners.
     *
     * @param target   desired state
     * @param priority arbitration priority
     * @param origin   short name of the requester, for logs
     * @return accepted result, or a rejection with its reason
     */
    public TransitionResult requestTransition(BotState target, TransitionPriority priority, String origin) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(priority, "priority");

        BotState from;
        Flight flight = null;
        Flight superseding = null;
        TransitionRejection rejection = null;
        lock.lock();
        try {
            long remaining = waitTimeout.toNanos();
            while (inFlight != null && rejection == null) {
                if (!priority.isHigherThan(inFlight.priority)) {
                    rejection = inFlight.priority == TransitionPriority.PREEMPTIVE
                            ? TransitionRejection.PREEMPTED
                            : TransitionRejection.BUSY;
                } else {
                    superseding = inFlight;
                    superseding.superseded = true;
                    if (remaining <= 0) {
                        if (superseding.committed) {
                            // the normal transition stands if we give up
                            superseding.superseded = false;
                        }
                        rejection = TransitionRejection.TIMED_OUT;
                    } else {
                        try {
                            remaining = settled.awaitNanos(remaining);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            rejection = TransitionRejection.INTERRUPTED;
                        }
                    }
                }
            }
            from = current;
            BotState leaving = current;
            if (superseding != null && superseding.committed && current == superseding.to) {
                from = superseding.from;
            }
            if (rejection == null && priority == TransitionPriority.NORMAL && preemptionLatched) {
                rejection = TransitionRejection.PREEMPTED;
            }
            if (rejection == null) {
                rejection = validate(from, target);
            }
            if (rejection == null) {
                flight = new Flight(from, leaving, target, priority);
                inFlight = flight;
            }
        } finally {
            lock.unlock();
        }
        if (flight == null) {
            return rejected(from, target, priority, rejection, origin);
        }

        runExitHooks(flight.leaving, flight.to);

        boolean committed;
        lock.lock();
        try {
            committed = !flight.superseded;
            if (!committed) {
                inFlight = null;
                settled.signalAll();
            } else {
                flight.committed = true;
                previous = flight.from;
                current = flight.to;
                enteredAt = Instant.now();
                if (priority == TransitionPriority.PREEMPTIVE) {
                    preemptionLatched = true;
                }
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (!committed) {
            return rejected(flight.from, flight.to, priority, TransitionRejection.SUPERSEDED, origin);
        }

        boolean overridden;
        try {
            runEnterHooks(flight.from, flight.to);
        } finally {
            lock.lock();
            try {
                overridden = flight.superseded;
                inFlight = null;
                settled.signalAll();
            } finally {
                lock.unlock();
            }
        }
        if (overridden) {
            return rejected(flight.from, flight.to, priority, TransitionRejection.SUPERSEDED, origin);
        }

        acceptedTransitions.incrementAndGet();
        TransitionResult result = TransitionResult.accepted(flight.from, flight.to, priority);
        if (priority == TransitionPriority.PREEMPTIVE) {
            log.warn("State {} -> {} (preemptive, by {})", flight.from, flight.to, origin);
        } else {
            log.info("State {} -> {} (by {})", flight.from, flight.to, origin);
        }
        publish(TransitionRecord.of(result, origin));
        return result;
    }

    /**
     * Like {@link #requestTransition(BotState, TransitionPriority, String)}, but throws
     * on rejection. For callers that cannot proceed without the transition.
     *
     * @throws InvalidTransitionException if the request is rejected
     */
    public TransitionResult requireTransition(BotState target, TransitionPriority priority, String origin) {
        TransitionResult result = requestTransition(target, priority, origin);
        if (result.isRejected()) {
            throw new InvalidTransitionException(result);
        }
        return result;
    }

    /**
     * Whether a transition from the current state to {@code target} would pass the graph
     * and guard checks right now. Advisory only; the state may change before a request.
     */
    public boolean canTransitionTo(BotState target) {
        return validate(current, target) == null;
    }

    // runs under the lock for requests; guards must be cheap
    private TransitionRejection validate(BotState from, BotState target) {
        if (from == target && !graph.contains(from, target)) {
            return TransitionRejection.ALREADY_IN_STATE;
        }
        if (!graph.contains(from, target)) {
            return TransitionRejection.NOT_IN_GRAPH;
        }
        TransitionGuard guard = graph.guardFor(from, target);
        try {
            return guard.allows(latestObservation) ? null : TransitionRejection.GUARD_FAILED;
        } catch (RuntimeException e) {
            log.error("Guard for {} -> {} threw, treating as failed", from, target, e);
            return TransitionRejection.GUARD_FAILED;
        }
    }

    private TransitionResult rejected(BotState from, BotState to, TransitionPriority priority,
                                      TransitionRejection reason, String origin) {
        TransitionResult result = TransitionResult.rejected(from, to, priority, reason);
        if (reason.isInvalidTransition()) {
            invalidTransitions.incrementAndGet();
            log.warn("Invalid transition {} -> {} requested by {}: {}", from, to, origin, reason);
        } else {
            log.debug("Transition {} -> {} ({}) by {} rejected: {}", from, to, priority, origin, reason);
        }
        publish(TransitionRecord.of(result, origin));
        return result;
    }

    // ========================================================================
    // Hooks and Listeners
    // ========================================================================

    /**
     * Register an entry/exit hook for a state.
     *
     * @param state the state the hook applies to
     * @param hook  the hook
     */
    public void registerHook(BotState state, StateHook hook) {
        hooks.get(state).add(hook);
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TransitionListener listener) {
        listeners.remove(listener);
    }

    private void runExitHooks(BotState from, BotState to) {
        for (StateHook hook : hooks.get(from)) {
            try {
                hook.onExit(from, to);
            } catch (RuntimeException e) {
                log.error("Exit hook for {} failed", from, e);
            }
        }
    }

    private void runEnterHooks(BotState from, BotState to) {
        for (StateHook hook : hooks.get(to)) {
            try {
                hook.onEnter(from, to);
            } catch (RuntimeException e) {
                log.error("Enter hook for {} failed", to, e);
            }
        }
    }

    private void publish(TransitionRecord record) {
        synchronized (history) {
            history.addLast(record);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
        notifyListeners(record);
    }

    private void notifyListeners(TransitionRecord record) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(record);
            } catch (RuntimeException e) {
                log.error("Transition listener failed for {}", record, e);
            }
        }
    }

    // ========================================================================
    // Tick Arbitration
    // ========================================================================

    /**
     * Called by the loop at the start of each tick. Closes the arbitration window
     * opened by the last preemptive transition.
     */
    public void beginTick() {
        acknowledgePreemption();
    }

    /**
     * Allow normal requests again after a preemptive transition.
     */
    public void acknowledgePreemption() {
        lock.lock();
        try {
            if (preemptionLatched) {
                log.debug("Preemption acknowledged in state {}", current);
            }
            preemptionLatched = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPreemptionLatched() {
        lock.lock();
        try {
            return preemptionLatched;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTransitionInFlight() {
        lock.lock();
        try {
            return inFlight != null;
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Observation
    // ========================================================================

    /**
     * Publish the latest observation; guards are evaluated against it.
     */
    public void updateObservation(Observation observation) {
        this.latestObservation = Objects.requireNonNull(observation, "observation");
    }

    public Observation getLatestObservation() {
        return latestObservation;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * The current state. Lock-free; safe from any thread and never blocks.
     */
    public BotState currentState() {
        return current;
    }

    public BotState getPreviousState() {
        return previous;
    }

    public Instant getStateEnteredAt() {
        return enteredAt;
    }

    public Duration getStateDuration() {
        return Duration.between(enteredAt, Instant.now());
    }

    public boolean isInState(BotState... states) {
        BotState now = current;
        for (BotState state : states) {
            if (state == now) {
                return true;
            }
        }
        return false;
    }

    /**
     * Block until the machine reaches {@code target} or the timeout elapses.
     *
     * @return true if the state was reached
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean waitForState(BotState target, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (current != target) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of recent transition records, oldest first.
     */
    public List<TransitionRecord> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public long getInvalidTransitionCount() {
        return invalidTransitions.get();
    }

    public long getAcceptedTransitionCount() {
        return acceptedTransitions.get();
    }

    public TransitionGraph getGraph() {
        return graph;
    }

    /**
     * Timed wait used by tests that need the machine idle before asserting.
     */
    boolean awaitSettled(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (inFlight != null) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = settled.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("BotStateMachine[state=%s, previous=%s, accepted=%d, invalid=%d]",
                current, previous, acceptedTransitions.get(), invalidTransitions.get());
    }

    private static final class Flight {
        final BotState from;
        // differs from 'from' when this flight overrides a committed normal one
        final BotState leaving;
        final BotState to;
        final TransitionPriority priority;
        boolean committed;
        boolean superseded;

        Flight(BotState from, BotState leaving, BotState to, TransitionPriority priority) {
            this.from = from;
            this.leaving = leaving;
            this.to = to;
            this.priority = priority;
        }
    }
}
