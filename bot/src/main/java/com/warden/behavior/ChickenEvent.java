package com.warden.behavior;

import com.warden.state.BotState;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Record of one emergency exit.
 */
@Value
@Builder
public class ChickenEvent {

    @Builder.Default
    Instant timestamp = Instant.now();

    @Nullable
    Double healthPercent;

    @Nullable
    Double manaPercent;

    String reason;

    /** State the bot was in when the chicken fired. */
    BotState fromState;

    /** Whether a rejuvenation potion was tried first. */
    boolean potionAttempted;

    /** Name of the exit strategy that worked; null if every strategy failed. */
    @Nullable
    String exitStrategy;

    public boolean isExitSucceeded() {
        return exitStrategy != null;
    }

    @Override
    public String toString() {
        return String.format("Chicken[%s from %s, health=%s, mana=%s, potion=%s, exit=%s]",
                reason, fromState, healthPercent, manaPercent, potionAttempted,
                exitStrategy == null ? "FAILED" : exitStrategy);
    }
}
