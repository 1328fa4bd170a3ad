package com.warden.status;

import com.warden.recovery.ErrorKind;
import com.warden.recovery.ErrorSeverity;
import com.warden.state.BotState;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Human-readable notification that the engine needs attention.
 */
@Value
@Builder
public class Alert {

    ErrorSeverity severity;

    @Nullable
    ErrorKind kind;

    BotState state;

    String title;

    String message;

    @Builder.Default
    Instant timestamp = Instant.now();

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (state %s)", severity, title, message, state);
    }
}
