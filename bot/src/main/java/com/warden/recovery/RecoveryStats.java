package com.warden.recovery;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of the coordinator's counters.
 */
@Value
@Builder
public class RecoveryStats {

    public static final RecoveryStats EMPTY = RecoveryStats.builder()
            .byKind(Map.of())
            .bySeverity(Map.of())
            .build();

    long totalEvents;
    long recoveriesAttempted;
    long recoveriesSucceeded;
    long escalations;
    long discarded;
    int consecutiveFailedRuns;
    int sessionDeaths;
    Map<ErrorKind, Long> byKind;
    Map<ErrorSeverity, Long> bySeverity;

    /**
     * Percentage of attempted recoveries that succeeded, 0 if none were attempted.
     */
    public double getRecoveryRate() {
        if (recoveriesAttempted == 0) {
            return 0.0;
        }
        return recoveriesSucceeded * 100.0 / recoveriesAttempted;
    }

    public long count(ErrorKind kind) {
        return byKind.getOrDefault(kind, 0L);
    }

    public long count(ErrorSeverity severity) {
        return bySeverity.getOrDefault(severity, 0L);
    }
}
