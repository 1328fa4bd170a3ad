package com.warden.recovery;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * How one error occurrence was handled. Kept in the coordinator's history and
 * sent to the event sink.
 */
@Value
@Builder
public class RecoveryRecord {

    ErrorEvent event;

    /** Severity from the lookup table. */
    ErrorSeverity classifiedSeverity;

    /** Severity the occurrence was finally handled at. */
    ErrorSeverity severity;

    RecoveryPhase phase;

    Resolution resolution;

    @Nullable
    String actionName;

    boolean recoveryAttempted;
    boolean recovered;

    Instant handledAt;

    public ErrorKind getKind() {
        return event.getKind();
    }

    /**
     * Whether the occurrence was handled above its table severity.
     */
    public boolean isEscalated() {
        return severity.compareTo(classifiedSeverity) > 0;
    }

    @Override
    public String toString() {
        return String.format("%s [%s%s] %s -> %s", event, severity,
                isEscalated() ? " escalated from " + classifiedSeverity : "", phase, resolution);
    }
}
