package com.warden.recovery;

import com.warden.state.BotState;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * A fault signal raised by any component and consumed once by the recovery coordinator.
 *
 * <p>The reporter may pass a severity it already knows. The coordinator never lowers it:
 * the effective severity is the higher of this value and the table's classification.
 */
@Value
@Builder
public class ErrorEvent {

    @NonNull
    ErrorKind kind;

    @NonNull
    BotState originState;

    @Builder.Default
    Instant timestamp = Instant.now();

    @Builder.Default
    String message = "";

    @Nullable
    ErrorSeverity reportedSeverity;

    public static ErrorEvent of(ErrorKind kind, BotState originState, String message) {
        return ErrorEvent.builder()
                .kind(kind)
                .originState(originState)
                .message(message)
                .build();
    }

    public static ErrorEvent of(ErrorKind kind, BotState originState, ErrorSeverity severity, String message) {
        return ErrorEvent.builder()
                .kind(kind)
                .originState(originState)
                .reportedSeverity(severity)
                .message(message)
                .build();
    }

    @Override
    public String toString() {
        return message.isEmpty()
                ? String.format("%s in %s", kind, originState)
                : String.format("%s in %s: %s", kind, originState, message);
    }
}
