package com.warden.status;

import com.warden.data.GsonFactory;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of session statistics.
 *
 * Aggregates what {@link SessionTracker} has seen:
 * - Run outcomes and run time
 * - Chickens, deaths and alerts
 * - Error occurrences by kind and escalations
 * - Transition counts
 */
@Value
@Builder
public class SessionStats {

    /**
     * Empty session stats for when no session is active.
     */
    public static final SessionStats EMPTY = SessionStats.builder()
            .sessionStartTime(null)
            .errorsByKind(Map.of())
            .build();

    /**
     * When this session started.
     */
    @Nullable
    Instant sessionStartTime;

    /**
     * Total runtime in milliseconds.
     */
    long runtimeMs;

    /**
     * Runs that ended in success.
     */
    int runsCompleted;

    /**
     * Runs that ended any other way.
     */
    int runsFailed;

    int chickens;

    int deaths;

    /**
     * Error occurrences handled above their table severity.
     */
    int escalations;

    int alerts;

    long transitions;

    long invalidTransitions;

    /**
     * Summed duration of all finished runs in milliseconds.
     */
    long totalRunTimeMs;

    /**
     * Error occurrences per kind code.
     */
    Map<String, Long> errorsByKind;

    // ========================================================================
    // Convenience Methods
    // ========================================================================

    public Duration getRuntime() {
        return Duration.ofMillis(runtimeMs);
    }

    public int getTotalRuns() {
        return runsCompleted + runsFailed;
    }

    /**
     * Mean duration of a finished run, zero if none finished.
     */
    public Duration getAverageRunTime() {
        int total = getTotalRuns();
        return total == 0 ? Duration.ZERO : Duration.ofMillis(totalRunTimeMs / total);
    }

    /**
     * Finished runs per hour of session time.
     */
    public double getRunsPerHour() {
        if (runtimeMs < 1000) {
            return 0;
        }
        return getTotalRuns() / (runtimeMs / 3600000.0);
    }

    /**
     * Share of finished runs that succeeded, in percent.
     */
    public double getSuccessRate() {
        int total = getTotalRuns();
        return total == 0 ? 0.0 : runsCompleted * 100.0 / total;
    }

    public long getTotalErrors() {
        return errorsByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean hasData() {
        return sessionStartTime != null && runtimeMs > 0;
    }

    public String getFormattedRuntime() {
        return formatDuration(runtimeMs);
    }

    /**
     * Pretty-printed JSON of this snapshot.
     */
    public String toJson() {
        return GsonFactory.createPrettyPrinting().toJson(this);
    }

    // ========================================================================
    // Formatting Utilities
    // ========================================================================

    private static String formatDuration(long ms) {
        long seconds = ms / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        return String.format("%02d:%02d:%02d",
                hours,
                minutes % 60,
                seconds % 60);
    }

    /**
     * Get a summary for logging.
     *
     * @return summary string
     */
    public String getSummary() {
        if (!hasData()) {
            return "SessionStats[no data]";
        }

        return String.format(
                "SessionStats[runtime=%s, runs=%d/%d, chickens=%d, deaths=%d, errors=%d, escalations=%d, runs/hr=%.1f]",
                getFormattedRuntime(),
                runsCompleted,
                getTotalRuns(),
                chickens,
                deaths,
                getTotalErrors(),
                escalations,
                getRunsPerHour()
        );
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
