package com.warden.tasks;

import com.warden.recovery.ErrorKind;
import com.warden.state.BotState;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;

/**
 * What a state handler reports back to the loop. The loop turns it into the next
 * transition request or an error event; nothing else keeps it.
 */
@Value
@Builder(toBuilder = true)
public class RunResult {

    RunStatus status;

    /** Set when the result comes from a farming run. */
    @Nullable
    String runName;

    @Builder.Default
    Duration duration = Duration.ZERO;

    /** State to request next on success; null to stay. */
    @Nullable
    BotState nextState;

    /** Error kind to report on failure; null lets the loop pick one. */
    @Nullable
    ErrorKind errorKind;

    @Builder.Default
    String message = "";

    int kills;
    int itemsPicked;

    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * Success, asking for {@code next}.
     */
    public static RunResult next(BotState next) {
        return RunResult.builder().status(RunStatus.SUCCESS).nextState(next).build();
    }

    /**
     * Success, staying in the current state.
     */
    public static RunResult stay() {
        return RunResult.builder().status(RunStatus.SUCCESS).build();
    }

    public static RunResult error(ErrorKind kind, String message) {
        return RunResult.builder().status(RunStatus.ERROR).errorKind(kind).message(message).build();
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public boolean isRun() {
        return runName != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RunResult[").append(status);
        if (runName != null) {
            sb.append(", run=").append(runName).append(", ").append(duration.toMillis()).append("ms");
        }
        if (nextState != null) {
            sb.append(", next=").append(nextState);
        }
        if (!message.isEmpty()) {
            sb.append(", ").append(message);
        }
        return sb.append(']').toString();
    }
}
