package com.warden.tasks;

import com.warden.recovery.ErrorKind;
import com.warden.state.BotState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for runs: timing, the run timeout, cooperative abort and result history.
 *
 * <p>Subclasses implement {@link #executeRun(HandlerContext)} and call
 * {@link #checkpoint(HandlerContext)} between steps. A checkpoint stops the run when it
 * was aborted, ran past its timeout, or the state machine left the run (an emergency
 * exit, a death, a disconnect).
 */
@Slf4j
public abstract class AbstractRun implements Run {

    private final List<RunResult> history = new ArrayList<>();

    protected volatile boolean aborted;

    @Getter
    protected Instant startTime;

    protected Duration timeout = Duration.ZERO;

    protected int kills;
    protected int itemsPicked;

    @Override
    public final RunResult execute(HandlerContext ctx) {
        aborted = false;
        kills = 0;
        itemsPicked = 0;
        timeout = ctx.getConfig().getRunTimeout();
        startTime = Instant.now();
        log.info("Starting {} run", getName());

        RunResult result;
        try {
            RunStatus status = executeRun(ctx);
            if (status == RunStatus.SUCCESS && ctx.currentState() == BotState.CHICKENED) {
                status = RunStatus.CHICKEN;
            }
            result = result(status, status == RunStatus.SUCCESS ? null : errorKindFor(status), "");
        } catch (RunStoppedException e) {
            log.info("{} run stopped: {}", getName(), e.getMessage());
            result = result(e.getStatus(), errorKindFor(e.getStatus()), e.getMessage());
        } catch (Exception e) {
            log.error("{} run error", getName(), e);
            result = result(RunStatus.ERROR, ErrorKind.HANDLER_FAILURE, String.valueOf(e.getMessage()));
        }

        synchronized (history) {
            history.add(result);
        }
        log.info("{} run complete: {} ({}ms)", getName(), result.getStatus(), result.getDuration().toMillis());
        return result;
    }

    /**
     * The run itself.
     *
     * @return how the run ended
     * @throws Exception any failure; reported as a handler failure
     */
    protected abstract RunStatus executeRun(HandlerContext ctx) throws Exception;

    /**
     * State to request once the run succeeded.
     */
    protected BotState getFinishState() {
        return BotState.RETURNING;
    }

    /**
     * Stop here if the run should not continue.
     *
     * @throws RunStoppedException with the status the run ends in
     */
    protected void checkpoint(HandlerContext ctx) {
        if (aborted) {
            throw new RunStoppedException(RunStatus.ABORTED, "aborted");
        }
        BotState state = ctx.currentState();
        if (!state.isRunPhase()) {
            throw new RunStoppedException(statusFor(state), "state is " + state);
        }
        if (isTimedOut()) {
            throw new RunStoppedException(RunStatus.TIMEOUT,
                    "exceeded " + timeout.toSeconds() + "s");
        }
    }

    public void abort() {
        log.warn("Aborting {} run", getName());
        aborted = true;
    }

    public boolean isTimedOut() {
        return startTime != null && !timeout.isZero() && getElapsed().compareTo(timeout) > 0;
    }

    public Duration getElapsed() {
        return startTime == null ? Duration.ZERO : Duration.between(startTime, Instant.now());
    }

    public List<RunResult> getHistory() {
        synchronized (history) {
            return Collections.unmodifiableList(new ArrayList<>(history));
        }
    }

    private RunResult result(RunStatus status, ErrorKind errorKind, String message) {
        return RunResult.builder()
                .status(status)
                .runName(getName())
                .duration(getElapsed())
                .nextState(status == RunStatus.SUCCESS ? getFinishState() : null)
                .errorKind(errorKind)
                .message(message)
                .kills(kills)
                .itemsPicked(itemsPicked)
                .build();
    }

    private static RunStatus statusFor(BotState state) {
        switch (state) {
            case CHICKENED:
                return RunStatus.CHICKEN;
            case DEAD:
                return RunStatus.DEATH;
            default:
                return RunStatus.ABORTED;
        }
    }

    private static ErrorKind errorKindFor(RunStatus status) {
        switch (status) {
            case DEATH:
                return ErrorKind.CHARACTER_DEATH;
            case TIMEOUT:
                return ErrorKind.RUN_TIMEOUT;
            case ERROR:
                return ErrorKind.HANDLER_FAILURE;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return String.format("%s[%s, runs=%d]", getClass().getSimpleName(), getName(), history.size());
    }

    /**
     * Thrown from {@link #checkpoint} to unwind a run that must stop.
     */
    @Getter
    public static class RunStoppedException extends RuntimeException {
        private final RunStatus status;

        public RunStoppedException(RunStatus status, String message) {
            super(message);
            this.status = status;
        }
    }
}
