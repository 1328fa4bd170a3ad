package com.warden.core;

import com.warden.config.BotConfig;
import com.warden.recovery.ErrorEvent;
import com.warden.recovery.ErrorKind;
import com.warden.recovery.RecoveryCoordinator;
import com.warden.recovery.RecoveryRecord;
import com.warden.recovery.StuckDetector;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.Observation;
import com.warden.state.ObservationPort;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionResult;
import com.warden.status.EventSink;
import com.warden.tasks.HandlerContext;
import com.warden.tasks.HandlerRegistry;
import com.warden.tasks.RunResult;
import com.warden.tasks.StateHandler;
import com.warden.timing.BoundedCall;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The engine's primary sequential loop.
 *
 * <p>Each tick:
 * <ol>
 *   <li>opens the state machine's arbitration window ({@link BotStateMachine#beginTick()});</li>
 *   <li>checks the game process, if a probe is configured;</li>
 *   <li>takes one observation, bounded by {@code observationTimeout}, and turns it into
 *       fault reports and stuck samples;</li>
 *   <li>drains the recovery coordinator, critical first;</li>
 *   <li>if nothing moved the state during the tick, dispatches the handler registered
 *       for the current state and turns its {@link RunResult} into a transition request
 *       or an error report.</li>
 * </ol>
 *
 * <p>While the coordinator is paused the loop only drains: no observations, no handlers.
 * Ticks run at {@code max(tickInterval, port refresh interval)}.
 */
@Slf4j
@Singleton
public class OrchestrationLoop {

    private static final String ORIGIN = "loop";

    private final BotConfig config;
    private final ObservationPort observationPort;
    private final BoundedCall boundedCall;
    private final BotStateMachine stateMachine;
    private final RecoveryCoordinator recovery;
    private final StuckDetector stuckDetector;
    private final HandlerRegistry handlers;
    private final HandlerContext handlerContext;
    private final ObservationInterpreter interpreter;
    @Nullable
    private final GameProcessProbe processProbe;
    private final EventSink events;

    private final AtomicLong ticks = new AtomicLong();
    private ScheduledExecutorService scheduler;
    private volatile boolean running;
    private volatile boolean stopRequested;

    @Inject
    public OrchestrationLoop(BotConfig config,
                             ObservationPort observationPort,
                             BoundedCall boundedCall,
                             BotStateMachine stateMachine,
                             RecoveryCoordinator recovery,
                             StuckDetector stuckDetector,
                             HandlerRegistry handlers,
                             HandlerContext handlerContext,
                             ObservationInterpreter interpreter,
                             @Nullable GameProcessProbe processProbe,
                             @Nullable EventSink events) {
        this.config = config;
        this.observationPort = observationPort;
        this.boundedCall = boundedCall;
        this.stateMachine = stateMachine;
        this.recovery = recovery;
        this.stuckDetector = stuckDetector;
        this.handlers = handlers;
        this.handlerContext = handlerContext;
        this.interpreter = interpreter;
        this.processProbe = processProbe;
        this.events = events != null ? events : EventSink.NONE;
        if (processProbe == null) {
            log.info("No process probe configured, crash detection disabled");
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    public synchronized void start() {
        if (running) {
            log.warn("Loop already running");
            return;
        }
        stopRequested = false;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Warden-Loop");
            t.setDaemon(true);
            return t;
        });
        long cadence = getTickCadence().toMillis();
        scheduler.scheduleAtFixedRate(this::safeTick, 0, cadence, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Loop started (tick every {}ms)", cadence);
    }

    /**
     * Stop ticking. A handler in progress is interrupted and given a moment to return.
     */
    public synchronized void stop() {
        stopRequested = true;
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(config.getTransitionWaitTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Loop thread did not finish within {}", config.getTransitionWaitTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Loop stopped after {} ticks", ticks.get());
    }

    public boolean isRunning() {
        return running;
    }

    public Duration getTickCadence() {
        Duration refresh = observationPort.getRefreshInterval();
        Duration tick = config.getTickInterval();
        return refresh != null && refresh.compareTo(tick) > 0 ? refresh : tick;
    }

    public long getTickCount() {
        return ticks.get();
    }

    /**
     * Run ticks on the calling thread.
     */
    public void runTicks(int count) {
        for (int i = 0; i < count; i++) {
            tickOnce();
        }
    }

    private void safeTick() {
        try {
            tickOnce();
        } catch (RuntimeException e) {
            log.error("Tick {} failed", ticks.get(), e);
            recovery.report(ErrorEvent.of(ErrorKind.HANDLER_FAILURE, stateMachine.currentState(),
                    "tick failed: " + e.getMessage()));
        }
    }

    // ========================================================================
    // Tick
    // ========================================================================

    public void tickOnce() {
        long tick = ticks.incrementAndGet();
        if (recovery.isPaused()) {
            List<RecoveryRecord> handled = recovery.drain();
            log.trace("Tick {} paused ({}), drained {}", tick, recovery.getPauseReason(), handled.size());
            return;
        }

        stateMachine.beginTick();
        long acceptedBefore = stateMachine.getAcceptedTransitionCount();
        BotState tickState = stateMachine.currentState();
        log.trace("Tick {} in {}", tick, tickState);

        checkProcess();
        Observation observation = observe();
        if (observation != null) {
            interpret(observation);
        }

        List<RecoveryRecord> handled = recovery.drain();
        if (!handled.isEmpty()) {
            log.debug("Tick {} handled {} error events", tick, handled.size());
        }
        if (recovery.isPaused()) {
            return;
        }

        BotState current = stateMachine.currentState();
        if (stateMachine.getAcceptedTransitionCount() == acceptedBefore) {
            dispatch(current);
        } else {
            log.debug("State moved {} -> {} during tick {}, handler deferred", tickState, current, tick);
        }

        if (!stopRequested && stateMachine.currentState() == BotState.IDLE) {
            stateMachine.requestTransition(BotState.STARTING, TransitionPriority.NORMAL, ORIGIN);
        }
    }

    private void checkProcess() {
        if (processProbe == null) {
            return;
        }
        try {
            Boolean alive = boundedCall.call(processProbe::isAlive, config.getObservationTimeout());
            if (Boolean.FALSE.equals(alive)) {
                log.error("Game process is gone");
                recovery.report(ErrorEvent.of(ErrorKind.PROCESS_CRASH, stateMachine.currentState(),
                        "game process not running"));
            }
        } catch (TimeoutException | BoundedCall.CallFailedException e) {
            log.debug("Process probe inconclusive: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Nullable
    private Observation observe() {
        BotState state = stateMachine.currentState();
        Observation observation;
        try {
            observation = boundedCall.call(observationPort::observe, config.getObservationTimeout());
        } catch (TimeoutException e) {
            recovery.report(ErrorEvent.of(ErrorKind.OBSERVATION_TIMEOUT, state,
                    "no observation within " + config.getObservationTimeout().toMillis() + "ms"));
            return null;
        } catch (BoundedCall.CallFailedException e) {
            recovery.report(ErrorEvent.of(ErrorKind.OBSERVATION_TIMEOUT, state,
                    "observation failed: " + e.getMessage()));
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
        return observation != null ? observation : Observation.unknown();
    }

    private void interpret(Observation observation) {
        BotState state = stateMachine.currentState();
        stateMachine.updateObservation(observation);

        if (!interpreter.isKnown(observation)) {
            recovery.report(ErrorEvent.of(ErrorKind.OBSERVATION_TIMEOUT, state,
                    String.format("unusable observation '%s' (confidence %.2f)",
                            observation.getLabel(), observation.getConfidence())));
            return;
        }
        recovery.recordRecoverySuccess(ErrorKind.OBSERVATION_TIMEOUT);
        recovery.recordRecoverySuccess(ErrorKind.UNKNOWN_STATE);

        interpreter.faultFor(observation).ifPresent(kind ->
                recovery.report(ErrorEvent.of(kind, state, "observed '" + observation.getLabel() + "'")));

        if (state == BotState.RUNNING || state == BotState.RETURNING) {
            interpreter.progressSample(observation).ifPresent(sample -> {
                stuckDetector.observe(sample);
                if (!stuckDetector.isStuck() && stuckDetector.isWindowFull()) {
                    recovery.recordRecoverySuccess(ErrorKind.STUCK);
                }
            });
        } else if (stuckDetector.getSampleCount() > 0) {
            stuckDetector.reset();
        }
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    private void dispatch(BotState state) {
        Optional<StateHandler> handler = handlers.get(state);
        if (handler.isEmpty()) {
            log.trace("No handler for {}", state);
            return;
        }

        RunResult result;
        try {
            result = handler.get().handle(handlerContext);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Handler for {} interrupted", state);
            return;
        } catch (Exception e) {
            log.error("Handler for {} failed", state, e);
            recovery.report(ErrorEvent.of(ErrorKind.HANDLER_FAILURE, state,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
            return;
        }

        if (result == null) {
            recovery.report(ErrorEvent.of(ErrorKind.HANDLER_FAILURE, state, "handler returned no result"));
            return;
        }
        apply(state, result);
    }

    private void apply(BotState handledIn, RunResult result) {
        BotState current = stateMachine.currentState();
        switch (result.getStatus()) {
            case SUCCESS:
                requestNext(handledIn, current, result.getNextState());
                break;
            case DEATH:
                if (current != BotState.DEAD) {
                    recovery.report(ErrorEvent.of(kindOr(result, ErrorKind.CHARACTER_DEATH), current,
                            describe(result, "character died")));
                }
                break;
            case TIMEOUT:
                recovery.report(ErrorEvent.of(kindOr(result, ErrorKind.RUN_TIMEOUT), current,
                        describe(result, "run timed out")));
                break;
            case ERROR:
                recovery.report(ErrorEvent.of(kindOr(result, ErrorKind.HANDLER_FAILURE), current,
                        describe(result, "handler error")));
                break;
            case CHICKEN:
                log.debug("{} ended by chicken", describe(result, "handler"));
                break;
            default:
                log.info("{} aborted", describe(result, "handler"));
                break;
        }

        if (result.isRun()) {
            // handle this run's own errors before closing its books
            recovery.drain();
            recovery.onRunFinished(result.isSuccess());
            events.onRunFinished(result);
        }
    }

    private void requestNext(BotState handledIn, BotState current, @Nullable BotState next) {
        if (next == null || next == current) {
            return;
        }
        if (current != handledIn && (current.isRunTerminal() || current == BotState.ERROR)) {
            log.debug("Ignoring {} -> {}, overtaken by {}", handledIn, next, current);
            return;
        }
        TransitionResult result = stateMachine.requestTransition(next, TransitionPriority.NORMAL, ORIGIN);
        if (result.isRejected()) {
            log.debug("Handler request {} -> {} rejected: {}", current, next, result.getRejection());
        }
    }

    private static ErrorKind kindOr(RunResult result, ErrorKind fallback) {
        return result.getErrorKind() != null ? result.getErrorKind() : fallback;
    }

    private static String describe(RunResult result, String fallback) {
        String name = result.getRunName() != null ? result.getRunName() : fallback;
        return result.getMessage().isEmpty() ? name : name + ": " + result.getMessage();
    }

    @Override
    public String toString() {
        return String.format("OrchestrationLoop[running=%s, ticks=%d]", running, ticks.get());
    }
}
