package com.warden.recovery;

import com.warden.config.BotConfig;
import com.warden.input.ActionGateway;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionResult;
import com.warden.status.Alert;
import com.warden.status.EventSink;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single route for every fault in the engine.
 *
 * <p>Any thread may {@link #report} an {@link ErrorEvent}; reported events wait in a queue
 * until the loop calls {@link #drain()}, which handles them in severity order
 * (critical first, then arrival order). Handling:
 * <ul>
 *   <li><b>Recoverable</b>: counts against the kind's {@link RetryBudget} and runs the
 *       kind's {@link RecoveryAction}. Exhausting the budget, or a failed recovery,
 *       escalates the occurrence to run-ending.</li>
 *   <li><b>Run-ending</b>: ends the current run in the kind's end state and adds to the
 *       per-run tally.</li>
 *   <li><b>Critical</b>: preemptive transition to {@link BotState#ERROR}, an alert, and
 *       a pause. While paused only critical events are acted on; the rest are recorded
 *       and discarded until {@link #resume()}.</li>
 * </ul>
 *
 * <p>Budgets and run counters are owned here and mutated only from the handling path.
 */
@Slf4j
@Singleton
public class RecoveryCoordinator implements ErrorEventSink {

    private static final String ORIGIN = "recovery";
    private static final int HISTORY_LIMIT = 500;

    private static final Comparator<Pending> HANDLING_ORDER = Comparator
            .comparing((Pending p) -> p.severity, Comparator.reverseOrder())
            .thenComparingLong(p -> p.sequence);

    private final SeverityTable severityTable;
    private final BotConfig config;
    private final BotStateMachine stateMachine;
    private final ActionGateway actions;
    private final EventSink events;

    private final Map<ErrorKind, RecoveryAction> recoveryActions = new ConcurrentHashMap<>();
    private final Map<ErrorKind, RetryBudget> budgets = new EnumMap<>(ErrorKind.class);
    private final PriorityBlockingQueue<Pending> queue = new PriorityBlockingQueue<>(16, HANDLING_ORDER);
    private final AtomicLong sequence = new AtomicLong();
    private final Deque<RecoveryRecord> history = new ArrayDeque<>();

    private volatile boolean paused;
    private volatile String pauseReason;

    // run-level counters
    private int runEndingTally;
    private int consecutiveFailedRuns;
    private int sessionDeaths;
    private ErrorKind lastRunEndingKind = ErrorKind.HANDLER_FAILURE;

    // statistics
    private final AtomicLong totalEvents = new AtomicLong();
    private final AtomicLong recoveriesAttempted = new AtomicLong();
    private final AtomicLong recoveriesSucceeded = new AtomicLong();
    private final AtomicLong escalations = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final Map<ErrorKind, AtomicLong> byKind = new ConcurrentHashMap<>();
    private final Map<ErrorSeverity, AtomicLong> bySeverity = new ConcurrentHashMap<>();

    @Inject
    public RecoveryCoordinator(SeverityTable severityTable,
                               BotConfig config,
                               BotStateMachine stateMachine,
                               ActionGateway actions,
                               @Nullable EventSink events) {
        this.severityTable = severityTable;
        this.config = config;
        this.stateMachine = stateMachine;
        this.actions = actions;
        this.events = events != null ? events : EventSink.NONE;
        log.info("RecoveryCoordinator initialized (retry threshold {})", config.getRetryThreshold());
    }

    /**
     * Install the automatic recovery for a kind, replacing any previous one.
     */
    public void registerAction(ErrorKind kind, RecoveryAction action) {
        recoveryActions.put(kind, action);
        log.debug("Recovery for {}: {}", kind, action.getName());
    }

    public Optional<RecoveryAction> getAction(ErrorKind kind) {
        return Optional.ofNullable(recoveryActions.get(kind));
    }

    // ========================================================================
    // Intake
    // ========================================================================

    /**
     * Queue an event for handling on the next {@link #drain()}. Safe from any thread.
     */
    @Override
    public void report(ErrorEvent event) {
        ErrorSeverity severity = effectiveSeverity(event);
        queue.add(new Pending(event, severity, sequence.incrementAndGet()));
        log.debug("Reported {} ({})", event, severity);
    }

    /**
     * Handle everything queued so far, critical first.
     *
     * @return records of the handled occurrences, in handling order
     */
    public synchronized List<RecoveryRecord> drain() {
        if (queue.isEmpty()) {
            return Collections.emptyList();
        }
        List<RecoveryRecord> handled = new ArrayList<>();
        Pending next;
        while ((next = queue.poll()) != null) {
            handled.add(handle(next.event));
        }
        return handled;
    }

    public int getPendingCount() {
        return queue.size();
    }

    // ========================================================================
    // Handling
    // ========================================================================

    /**
     * Classify and handle one occurrence immediately.
     *
     * @param event the fault
     * @return how it was handled
     */
    public synchronized RecoveryRecord handle(ErrorEvent event) {
        Occurrence occ = new Occurrence(event, severityTable.classify(event.getKind()));
        occ.severity = effectiveSeverity(event);
        occ.phase = RecoveryPhase.CLASSIFIED;
        totalEvents.incrementAndGet();
        byKind.computeIfAbsent(event.getKind(), k -> new AtomicLong()).incrementAndGet();

        if (paused && occ.severity != ErrorSeverity.CRITICAL) {
            log.info("Paused ({}), discarding {}", pauseReason, event);
            discarded.incrementAndGet();
            occ.resolution = Resolution.DISCARDED;
            return finish(occ);
        }

        switch (occ.severity) {
            case RECOVERABLE:
                handleRecoverable(occ);
                break;
            case RUN_ENDING:
                handleRunEnding(occ);
                break;
            default:
                handleCritical(occ);
                break;
        }
        return finish(occ);
    }

    private void handleRecoverable(Occurrence occ) {
        ErrorEvent event = occ.event;
        RetryBudget budget = budgets.computeIfAbsent(event.getKind(),
                kind -> new RetryBudget(kind, config.getRetryThreshold()));

        if (budget.recordFailure()) {
            log.warn("{} reached {} consecutive failures, escalating to RUN_ENDING",
                    event.getKind(), budget.getThreshold());
            escalate(occ, ErrorSeverity.RUN_ENDING);
            handleRunEnding(occ);
            return;
        }

        log.warn("Recoverable {} ({}/{})", event, budget.getConsecutiveFailures(), budget.getThreshold());
        RecoveryAction action = recoveryActions.get(event.getKind());
        if (action == null) {
            log.debug("No recovery action for {}, continuing", event.getKind());
            occ.phase = RecoveryPhase.RESOLVED;
            occ.resolution = Resolution.CONTINUE;
            return;
        }

        occ.phase = RecoveryPhase.RECOVERY_ATTEMPTED;
        occ.actionName = action.getName();
        occ.recoveryAttempted = true;
        recoveriesAttempted.incrementAndGet();

        boolean ok;
        try {
            ok = action.recover(new RecoveryContext(event, stateMachine, actions, config));
        } catch (RuntimeException e) {
            log.error("Recovery {} threw for {}", action.getName(), event, e);
            ok = false;
        }

        if (ok) {
            recoveriesSucceeded.incrementAndGet();
            log.info("Recovery {} carried out for {}", action.getName(), event.getKind());
            occ.recovered = true;
            occ.phase = RecoveryPhase.RESOLVED;
            occ.resolution = Resolution.CONTINUE;
            return;
        }

        log.warn("Recovery {} failed for {}, escalating to RUN_ENDING", action.getName(), event.getKind());
        escalate(occ, ErrorSeverity.RUN_ENDING);
        handleRunEnding(occ);
    }

    private void handleRunEnding(Occurrence occ) {
        ErrorEvent event = occ.event;
        runEndingTally++;
        lastRunEndingKind = event.getKind();

        if (event.getKind() == ErrorKind.CHARACTER_DEATH) {
            sessionDeaths++;
            if (sessionDeaths > config.getMaxDeathsPerSession()) {
                log.error("{} deaths this session exceeds limit of {}",
                        sessionDeaths, config.getMaxDeathsPerSession());
                escalate(occ, ErrorSeverity.CRITICAL);
                handleCritical(occ);
                return;
            }
        }

        log.warn("Run ending: {}", event);
        BotState current = stateMachine.currentState();
        BotState target = event.getKind().getRunEndState();
        if (current.isRunTerminal()) {
            log.debug("Run already ended in {}", current);
        } else if (!stateMachine.getGraph().contains(current, target)) {
            log.info("No run to end from {} (no edge to {})", current, target);
        } else {
            TransitionResult result = stateMachine.requestTransition(target, TransitionPriority.NORMAL, ORIGIN);
            if (result.isRejected()) {
                log.warn("Could not end run via {}: {}", target, result.getRejection());
            }
        }

        occ.phase = occ.isEscalated() ? RecoveryPhase.ESCALATED : RecoveryPhase.RESOLVED;
        occ.resolution = Resolution.END_RUN;
    }

    private void handleCritical(Occurrence occ) {
        ErrorEvent event = occ.event;
        paused = true;
        pauseReason = event.toString();
        log.error("CRITICAL: {} - pausing engine", event);

        BotState current = stateMachine.currentState();
        if (current != BotState.ERROR) {
            TransitionResult result = stateMachine.requestTransition(BotState.ERROR, TransitionPriority.PREEMPTIVE, ORIGIN);
            if (result.isRejected()) {
                log.error("Could not enter ERROR from {}: {}", current, result.getRejection());
            }
        }

        Alert alert = Alert.builder()
                .severity(ErrorSeverity.CRITICAL)
                .kind(event.getKind())
                .state(current)
                .title("Engine paused: " + event.getKind())
                .message(event.getMessage().isEmpty() ? event.toString() : event.getMessage())
                .build();
        try {
            events.onAlert(alert);
        } catch (RuntimeException e) {
            log.error("Alert sink failed for {}", alert, e);
        }

        occ.phase = occ.isEscalated() ? RecoveryPhase.ESCALATED : RecoveryPhase.RESOLVED;
        occ.resolution = Resolution.PAUSE_AND_ALERT;
    }

    private void escalate(Occurrence occ, ErrorSeverity to) {
        occ.severity = ErrorSeverity.max(occ.severity, to);
        escalations.incrementAndGet();
    }

    private RecoveryRecord finish(Occurrence occ) {
        bySeverity.computeIfAbsent(occ.severity, k -> new AtomicLong()).incrementAndGet();
        RecoveryRecord record = RecoveryRecord.builder()
                .event(occ.event)
                .classifiedSeverity(occ.classified)
                .severity(occ.severity)
                .phase(occ.phase)
                .resolution(occ.resolution)
                .actionName(occ.actionName)
                .recoveryAttempted(occ.recoveryAttempted)
                .recovered(occ.recovered)
                .handledAt(Instant.now())
                .build();
        synchronized (history) {
            history.addLast(record);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
        try {
            events.onError(record);
        } catch (RuntimeException e) {
            log.error("Event sink failed for {}", record, e);
        }
        return record;
    }

    private ErrorSeverity effectiveSeverity(ErrorEvent event) {
        ErrorSeverity classified = severityTable.classify(event.getKind());
        ErrorSeverity reported = event.getReportedSeverity();
        return reported == null ? classified : ErrorSeverity.max(classified, reported);
    }

    // ========================================================================
    // Confirmation and Run Bookkeeping
    // ========================================================================

    /**
     * The loop observed that a condition of this kind cleared; its budget starts over.
     */
    public synchronized void recordRecoverySuccess(ErrorKind kind) {
        RetryBudget budget = budgets.get(kind);
        if (budget != null && budget.getConsecutiveFailures() > 0) {
            log.debug("{} cleared after {} consecutive failures", kind, budget.getConsecutiveFailures());
            budget.recordSuccess();
        }
    }

    /**
     * A run finished. A run counts as failed if it did not succeed or if anything ended
     * it early. Too many failed runs in a row escalate to critical.
     *
     * @param success whether the run itself reported success
     */
    public synchronized void onRunFinished(boolean success) {
        boolean failed = !success || runEndingTally > 0;
        runEndingTally = 0;
        if (!failed) {
            if (consecutiveFailedRuns > 0) {
                log.debug("Run succeeded, clearing {} consecutive failed runs", consecutiveFailedRuns);
            }
            consecutiveFailedRuns = 0;
            return;
        }

        consecutiveFailedRuns++;
        log.info("Run failed ({} in a row, limit {})", consecutiveFailedRuns, config.getMaxConsecutiveFailedRuns());
        if (consecutiveFailedRuns > config.getMaxConsecutiveFailedRuns()) {
            ErrorEvent event = ErrorEvent.of(lastRunEndingKind, stateMachine.currentState(), ErrorSeverity.CRITICAL,
                    consecutiveFailedRuns + " consecutive failed runs");
            escalations.incrementAndGet();
            handle(event);
        }
    }

    // ========================================================================
    // Pause / Resume
    // ========================================================================

    /**
     * Pause handling without a critical event, e.g. on operator request.
     */
    public void pause(String reason) {
        pauseReason = reason;
        paused = true;
        log.warn("Recovery paused: {}", reason);
    }

    /**
     * Resume after a pause. Retry budgets and the failed-run streak start over;
     * anything still queued from the paused period is dropped.
     */
    public synchronized void resume() {
        if (!paused) {
            return;
        }
        int dropped = queue.size();
        queue.clear();
        budgets.clear();
        consecutiveFailedRuns = 0;
        runEndingTally = 0;
        paused = false;
        log.info("Recovery resumed (was: {}), dropped {} queued events", pauseReason, dropped);
        pauseReason = null;
    }

    public boolean isPaused() {
        return paused;
    }

    @Nullable
    public String getPauseReason() {
        return pauseReason;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public synchronized int getConsecutiveFailures(ErrorKind kind) {
        RetryBudget budget = budgets.get(kind);
        return budget == null ? 0 : budget.getConsecutiveFailures();
    }

    public synchronized int getConsecutiveFailedRuns() {
        return consecutiveFailedRuns;
    }

    public synchronized int getRunEndingTally() {
        return runEndingTally;
    }

    public List<RecoveryRecord> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public SeverityTable getSeverityTable() {
        return severityTable;
    }

    public synchronized RecoveryStats getStats() {
        Map<ErrorKind, Long> kinds = new EnumMap<>(ErrorKind.class);
        byKind.forEach((k, v) -> kinds.put(k, v.get()));
        Map<ErrorSeverity, Long> severities = new EnumMap<>(ErrorSeverity.class);
        bySeverity.forEach((k, v) -> severities.put(k, v.get()));
        return RecoveryStats.builder()
                .totalEvents(totalEvents.get())
                .recoveriesAttempted(recoveriesAttempted.get())
                .recoveriesSucceeded(recoveriesSucceeded.get())
                .escalations(escalations.get())
                .discarded(discarded.get())
                .consecutiveFailedRuns(consecutiveFailedRuns)
                .sessionDeaths(sessionDeaths)
                .byKind(Collections.unmodifiableMap(kinds))
                .bySeverity(Collections.unmodifiableMap(severities))
                .build();
    }

    @Override
    public String toString() {
        return String.format("RecoveryCoordinator[paused=%s, pending=%d, events=%d, escalations=%d]",
                paused, queue.size(), totalEvents.get(), escalations.get());
    }

    private static final class Pending {
        final ErrorEvent event;
        final ErrorSeverity severity;
        final long sequence;

        Pending(ErrorEvent event, ErrorSeverity severity, long sequence) {
            this.event = event;
            this.severity = severity;
            this.sequence = sequence;
        }
    }

    private static final class Occurrence {
        final ErrorEvent event;
        final ErrorSeverity classified;
        ErrorSeverity severity;
        RecoveryPhase phase = RecoveryPhase.DETECTED;
        Resolution resolution = Resolution.CONTINUE;
        String actionName;
        boolean recoveryAttempted;
        boolean recovered;

        Occurrence(ErrorEvent event, ErrorSeverity classified) {
            this.event = event;
            this.classified = classified;
            this.severity = classified;
        }

        boolean isEscalated() {
            return severity.compareTo(classified) > 0;
        }
    }
}
