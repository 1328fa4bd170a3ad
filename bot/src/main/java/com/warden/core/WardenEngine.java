package com.warden.core;

import com.google.inject.Guice;
import com.warden.behavior.HealthPreemptionController;
import com.warden.config.BotConfig;
import com.warden.input.ActionPort;
import com.warden.recovery.RecoveryCoordinator;
import com.warden.recovery.RecoveryStats;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.ObservationPort;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionResult;
import com.warden.status.AsyncEventSink;
import com.warden.status.EventSink;
import com.warden.status.SessionStats;
import com.warden.status.SessionTracker;
import com.warden.tasks.HandlerRegistry;
import com.warden.tasks.Run;
import com.warden.tasks.RunRotation;
import com.warden.tasks.StateHandler;
import com.warden.timing.BoundedCall;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.List;

/**
 * Entry point for embedding the engine.
 *
 * <pre>
 * WardenEngine engine = WardenEngine.create(config, classifier, input, null);
 * engine.registerRuns(List.of(new PindleRun()));
 * engine.start();
 * </pre>
 *
 * <p>{@link #start()} begins the session, the health controller and the loop;
 * {@link #stop()} ends them, walks the state machine back to {@code IDLE} and releases
 * the engine's threads; a stopped engine cannot be started again. After a critical
 * error the engine stays paused in {@code ERROR} until {@link #resume()}.
 */
@Slf4j
@Singleton
public class WardenEngine {

    private static final String ORIGIN = "engine";

    private final BotConfig config;
    private final BotStateMachine stateMachine;
    private final RecoveryCoordinator recovery;
    private final HealthPreemptionController healthController;
    private final OrchestrationLoop loop;
    private final HandlerRegistry handlers;
    private final SessionTracker sessionTracker;
    private final EventSink events;
    private final BoundedCall boundedCall;

    private volatile boolean started;
    private volatile boolean closed;

    @Inject
    public WardenEngine(BotConfig config,
                        BotStateMachine stateMachine,
                        RecoveryCoordinator recovery,
                        HealthPreemptionController healthController,
                        OrchestrationLoop loop,
                        HandlerRegistry handlers,
                        SessionTracker sessionTracker,
                        EventSink events,
                        BoundedCall boundedCall) {
        this.config = config;
        this.stateMachine = stateMachine;
        this.recovery = recovery;
        this.healthController = healthController;
        this.loop = loop;
        this.handlers = handlers;
        this.sessionTracker = sessionTracker;
        this.events = events;
        this.boundedCall = boundedCall;
        stateMachine.addListener(events::onTransition);
    }

    /**
     * Build an engine with the standard wiring.
     *
     * @param config       validated configuration
     * @param observations classifier
     * @param actions      input executor
     * @param processProbe liveness check, or null to skip crash detection
     */
    public static WardenEngine create(BotConfig config, ObservationPort observations, ActionPort actions,
                                      @Nullable GameProcessProbe processProbe) {
        config.validate();
        return Guice.createInjector(new WardenModule(config, observations, actions, processProbe))
                .getInstance(WardenEngine.class);
    }

    // ========================================================================
    // Handlers
    // ========================================================================

    public void registerHandler(BotState state, StateHandler handler) {
        handlers.register(state, handler);
    }

    /**
     * Install the run rotation as the {@code RUNNING} handler.
     *
     * @param available every run the embedding knows; the configured subset is used
     */
    public RunRotation registerRuns(List<Run> available) {
        RunRotation rotation = new RunRotation(available, config);
        handlers.register(BotState.RUNNING, rotation);
        return rotation;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Engine was stopped; create a new one");
        }
        if (started) {
            log.warn("Engine already started");
            return;
        }
        sessionTracker.startSession();
        healthController.start();
        loop.start();
        started = true;
        log.info("Engine started in {}", stateMachine.currentState());
    }

    /**
     * End the session if one is running, then release the loop's call pool and the event
     * worker. Idempotent.
     */
    public synchronized void stop() {
        if (closed) {
            return;
        }
        if (started) {
            shutDownSession();
        }
        closed = true;
        if (events instanceof AsyncEventSink) {
            ((AsyncEventSink) events).shutdown();
        }
        boundedCall.shutdown();
    }

    private void shutDownSession() {
        started = false;
        loop.stop();
        healthController.stop();

        stateMachine.acknowledgePreemption();
        if (stateMachine.currentState() != BotState.IDLE) {
            TransitionResult stopping = stateMachine.requestTransition(BotState.STOPPING, TransitionPriority.NORMAL, ORIGIN);
            if (stopping.isRejected()) {
                log.warn("Could not enter STOPPING from {}: {}", stopping.getFrom(), stopping.getRejection());
            } else {
                stateMachine.requestTransition(BotState.IDLE, TransitionPriority.NORMAL, ORIGIN);
            }
        }

        if (events instanceof AsyncEventSink) {
            AsyncEventSink async = (AsyncEventSink) events;
            if (!async.flush(Duration.ofSeconds(2))) {
                log.warn("Event queue not drained ({} left)", async.getQueueSize());
            }
        }
        log.info("Engine stopped. {}", getStats().getSummary());
    }

    /**
     * Clear a critical pause and return to {@code IDLE}. The loop restarts from there.
     */
    public void resume() {
        if (!recovery.isPaused()) {
            log.debug("Engine not paused");
            return;
        }
        recovery.resume();
        stateMachine.acknowledgePreemption();
        if (stateMachine.currentState() == BotState.ERROR) {
            TransitionResult result = stateMachine.requestTransition(BotState.IDLE, TransitionPriority.NORMAL, ORIGIN);
            if (result.isRejected()) {
                log.warn("Could not leave ERROR: {}", result.getRejection());
            }
        }
        log.info("Engine resumed in {}", stateMachine.currentState());
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public BotState currentState() {
        return stateMachine.currentState();
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isPaused() {
        return recovery.isPaused();
    }

    public SessionStats getStats() {
        return sessionTracker.snapshot();
    }

    public RecoveryStats getRecoveryStats() {
        return recovery.getStats();
    }

    public BotStateMachine getStateMachine() {
        return stateMachine;
    }

    public RecoveryCoordinator getRecovery() {
        return recovery;
    }

    public HealthPreemptionController getHealthController() {
        return healthController;
    }

    public OrchestrationLoop getLoop() {
        return loop;
    }

    BoundedCall getBoundedCall() {
        return boundedCall;
    }

    EventSink getEvents() {
        return events;
    }
}
