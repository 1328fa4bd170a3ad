package com.warden.tasks;

import com.warden.config.BotConfig;
import com.warden.input.Action;
import com.warden.input.ActionGateway;
import com.warden.input.ActionResult;
import com.warden.recovery.ErrorEvent;
import com.warden.recovery.ErrorKind;
import com.warden.recovery.RecoveryCoordinator;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.Observation;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionResult;
import com.warden.timing.DelayTimer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;

/**
 * Engine services available to state handlers and runs.
 *
 * <p>Actions go through the bounded gateway; an action timeout is reported as an
 * {@link ErrorKind#ACTION_TIMEOUT} event, and a successful action clears that kind's
 * retry budget.
 */
@Slf4j
@Singleton
public class HandlerContext {

    private static final String ORIGIN = "handler";

    private final BotStateMachine stateMachine;
    private final ActionGateway actions;
    private final RecoveryCoordinator recovery;
    private final DelayTimer delayTimer;

    @Getter
    private final BotConfig config;

    @Inject
    public HandlerContext(BotStateMachine stateMachine, ActionGateway actions, RecoveryCoordinator recovery,
                          DelayTimer delayTimer, BotConfig config) {
        this.stateMachine = stateMachine;
        this.actions = actions;
        this.recovery = recovery;
        this.delayTimer = delayTimer;
        this.config = config;
    }

    public BotState currentState() {
        return stateMachine.currentState();
    }

    public boolean isRunActive() {
        return stateMachine.currentState().isRunPhase();
    }

    public Observation getLatestObservation() {
        return stateMachine.getLatestObservation();
    }

    /**
     * Ask for a normal-priority transition on behalf of the handler.
     */
    public TransitionResult requestTransition(BotState target) {
        return stateMachine.requestTransition(target, TransitionPriority.NORMAL, ORIGIN);
    }

    /**
     * Perform an action under the configured action timeout.
     */
    public ActionResult perform(Action action) {
        ActionResult result = actions.perform(action);
        if (result.isTimedOut()) {
            report(ErrorKind.ACTION_TIMEOUT, result.getMessage());
        } else if (result.isOk()) {
            recovery.recordRecoverySuccess(ErrorKind.ACTION_TIMEOUT);
        }
        return result;
    }

    /**
     * Raise a fault for the coordinator to handle on the next drain.
     */
    public void report(ErrorKind kind, String message) {
        recovery.report(ErrorEvent.of(kind, stateMachine.currentState(), message));
    }

    /**
     * The handler saw a condition of this kind clear.
     */
    public void recordSuccess(ErrorKind kind) {
        recovery.recordRecoverySuccess(kind);
    }

    /**
     * Sleep, returning early (false) if interrupted.
     */
    public boolean sleep(Duration duration) {
        return delayTimer.sleep(duration);
    }
}
