package com.warden.config;

import com.warden.recovery.ErrorKind;
import com.warden.recovery.ErrorSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Immutable engine configuration.
 *
 * <p>Every component reads the values it needs once, at construction, and never
 * re-reads them. Every wait in the engine is bounded by one of the durations below;
 * {@link #validate()} rejects zero or negative durations so no wait can be infinite.
 */
@Value
@Builder(toBuilder = true)
public class BotConfig {

    /**
     * Configuration with every option at its default.
     */
    public static final BotConfig DEFAULTS = BotConfig.builder().build();

    // ========================================================================
    // Timing
    // ========================================================================

    /** Target time between orchestration ticks. */
    @Builder.Default
    Duration tickInterval = Duration.ofMillis(100);

    /** Bound on a single Observation Port call from the main loop. */
    @Builder.Default
    Duration observationTimeout = Duration.ofSeconds(2);

    /** Bound on a single Action Port call. */
    @Builder.Default
    Duration actionTimeout = Duration.ofSeconds(3);

    /** How long a preemptive request waits for an in-flight transition to settle. */
    @Builder.Default
    Duration transitionWaitTimeout = Duration.ofSeconds(2);

    // ========================================================================
    // Observation
    // ========================================================================

    /** Observations below this confidence are treated as unknown. */
    @Builder.Default
    double confidenceFloor = 0.6;

    /** Observation labels that signal a fault, mapped to error kind codes. */
    @Builder.Default
    Map<String, String> faultLabels = Map.of(
            "death", ErrorKind.CHARACTER_DEATH.getCode(),
            "disconnected", ErrorKind.DISCONNECT.getCode());

    // ========================================================================
    // Safety (health preemption)
    // ========================================================================

    /** Health percentage at or below which the bot chickens. */
    @Builder.Default
    int healthFloorPercent = 30;

    /** Mana percentage at or below which the bot chickens; 0 disables the check. */
    @Builder.Default
    int manaFloorPercent = 0;

    /** Health percentage for the potion band; 0 means min(60, floor + 20). */
    @Builder.Default
    int healthWarningPercent = 0;

    @Builder.Default
    Duration healthSampleInterval = Duration.ofMillis(100);

    @Builder.Default
    Duration healthSampleTimeout = Duration.ofMillis(500);

    @Builder.Default
    int healthSampleBufferSize = 20;

    @Builder.Default
    Duration potionCooldown = Duration.ofSeconds(1);

    /** Try a rejuvenation potion once before chickening. */
    @Builder.Default
    boolean rejuvBeforeChicken = true;

    /** Wait after the rejuvenation potion before resampling health. */
    @Builder.Default
    Duration rejuvSettleDelay = Duration.ofMillis(300);

    @Builder.Default
    String healthPotionKey = "1";

    @Builder.Default
    String rejuvPotionKey = "3";

    // ========================================================================
    // Exit sequence
    // ========================================================================

    /** Bound on each exit attempt before moving to the next fallback. */
    @Builder.Default
    Duration exitAttemptTimeout = Duration.ofSeconds(2);

    @Builder.Default
    String exitTemplate = "buttons/save_exit";

    @Builder.Default
    int saveExitButtonX = 960;

    @Builder.Default
    int saveExitButtonY = 540;

    @Builder.Default
    String cancelKey = "escape";

    @Builder.Default
    int cancelKeyRepeats = 2;

    // ========================================================================
    // Recovery
    // ========================================================================

    /** Consecutive failures of one error kind that trigger escalation. */
    @Builder.Default
    int retryThreshold = 3;

    /** Consecutive run-ending runs tolerated before the engine pauses. */
    @Builder.Default
    int maxConsecutiveFailedRuns = 6;

    /** Deaths tolerated per session before the engine pauses. */
    @Builder.Default
    int maxDeathsPerSession = 5;

    /** Base wait used by wait-and-retry recoveries. */
    @Builder.Default
    Duration recoveryWait = Duration.ofSeconds(1);

    /** Severity overrides keyed by error kind code, e.g. {"stuck": "RUN_ENDING"}. */
    @Builder.Default
    Map<String, String> severityOverrides = Map.of();

    @Builder.Default
    int escapeMinX = 400;

    @Builder.Default
    int escapeMaxX = 1500;

    @Builder.Default
    int escapeMinY = 200;

    @Builder.Default
    int escapeMaxY = 800;

    // ========================================================================
    // Stuck detection
    // ========================================================================

    @Builder.Default
    int stuckWindowSize = 5;

    /** Max per-axis distance for two positions to count as the same place. */
    @Builder.Default
    double stuckEpsilon = 10.0;

    // ========================================================================
    // Guards and runs
    // ========================================================================

    /** Health required to leave town for a run; guards IN_TOWN -> RUNNING. */
    @Builder.Default
    int minHealthToStartRun = 50;

    @Builder.Default
    List<String> enabledRuns = List.of();

    /** Number of runs before stopping; 0 runs forever. */
    @Builder.Default
    int runCount = 0;

    @Builder.Default
    Duration runTimeout = Duration.ofSeconds(120);

    /**
     * Warning threshold for the potion band.
     *
     * @return the configured value, or min(60, floor + 20) when unset
     */
    public int getEffectiveHealthWarningPercent() {
        if (healthWarningPercent > 0) {
            return healthWarningPercent;
        }
        return Math.min(60, healthFloorPercent + 20);
    }

    /**
     * Check every option and fail on the first invalid one.
     *
     * @return this config, for chaining
     * @throws ConfigException if a value is out of range
     */
    public BotConfig validate() {
        requirePositive("tickInterval", tickInterval);
        requirePositive("observationTimeout", observationTimeout);
        requirePositive("actionTimeout", actionTimeout);
        requirePositive("transitionWaitTimeout", transitionWaitTimeout);
        requirePositive("healthSampleInterval", healthSampleInterval);
        requirePositive("healthSampleTimeout", healthSampleTimeout);
        requirePositive("potionCooldown", potionCooldown);
        requirePositive("rejuvSettleDelay", rejuvSettleDelay);
        requirePositive("exitAttemptTimeout", exitAttemptTimeout);
        requirePositive("recoveryWait", recoveryWait);
        requirePositive("runTimeout", runTimeout);

        requirePercent("healthFloorPercent", healthFloorPercent);
        requirePercent("manaFloorPercent", manaFloorPercent);
        requirePercent("healthWarningPercent", healthWarningPercent);
        requirePercent("minHealthToStartRun", minHealthToStartRun);

        if (confidenceFloor < 0.0 || confidenceFloor > 1.0) {
            throw new ConfigException("confidenceFloor must be within [0, 1], was " + confidenceFloor);
        }
        if (retryThreshold < 1) {
            throw new ConfigException("retryThreshold must be at least 1, was " + retryThreshold);
        }
        if (maxConsecutiveFailedRuns < 1) {
            throw new ConfigException("maxConsecutiveFailedRuns must be at least 1, was " + maxConsecutiveFailedRuns);
        }
        if (maxDeathsPerSession < 1) {
            throw new ConfigException("maxDeathsPerSession must be at least 1, was " + maxDeathsPerSession);
        }
        if (stuckWindowSize < 2) {
            throw new ConfigException("stuckWindowSize must be at least 2, was " + stuckWindowSize);
        }
        if (stuckEpsilon < 0) {
            throw new ConfigException("stuckEpsilon must not be negative, was " + stuckEpsilon);
        }
        if (healthSampleBufferSize < 1) {
            throw new ConfigException("healthSampleBufferSize must be at least 1, was " + healthSampleBufferSize);
        }
        if (cancelKeyRepeats < 1) {
            throw new ConfigException("cancelKeyRepeats must be at least 1, was " + cancelKeyRepeats);
        }
        if (runCount < 0) {
            throw new ConfigException("runCount must not be negative, was " + runCount);
        }
        if (escapeMinX > escapeMaxX || escapeMinY > escapeMaxY) {
            throw new ConfigException("escape region is empty");
        }

        for (Map.Entry<String, String> entry : severityOverrides.entrySet()) {
            requireKind("severityOverrides", entry.getKey());
            try {
                ErrorSeverity.valueOf(entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Unknown severity '" + entry.getValue()
                        + "' for error kind '" + entry.getKey() + "'", e);
            }
        }
        for (String code : faultLabels.values()) {
            requireKind("faultLabels", code);
        }
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigException(name + " must be a positive duration, was " + value);
        }
    }

    private static void requirePercent(String name, int value) {
        if (value < 0 || value > 100) {
            throw new ConfigException(name + " must be within [0, 100], was " + value);
        }
    }

    private static void requireKind(String option, String code) {
        if (ErrorKind.fromCode(code).isEmpty()) {
            throw new ConfigException("Unknown error kind '" + code + "' in " + option);
        }
    }
}
