package com.warden.state;

import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Structured record of one transition request, accepted or rejected.
 * Emitted to listeners and kept in the state machine's bounded history.
 */
@Value
public class TransitionRecord {

    BotState from;
    BotState to;
    TransitionPriority priority;
    boolean accepted;

    @Nullable
    TransitionRejection rejection;

    /** Who asked, e.g. "loop", "health", "recovery". */
    String origin;

    Instant timestamp;

    static TransitionRecord of(TransitionResult result, String origin) {
        return new TransitionRecord(result.getFrom(), result.getTo(), result.getPriority(),
                result.isAccepted(), result.getRejection(), origin, Instant.now());
    }

    @Override
    public String toString() {
        return accepted
                ? String.format("%s -> %s [%s, %s]", from, to, priority, origin)
                : String.format("%s -> %s [%s, %s] rejected: %s", from, to, priority, origin, rejection);
    }
}
