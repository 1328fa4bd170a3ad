package com.warden.state;

import lombok.Value;

import javax.annotation.Nullable;

/**
 * Outcome of a transition request. A rejection is a value, not an exception.
 */
@Value
public class TransitionResult {

    boolean accepted;
    BotState from;
    BotState to;
    TransitionPriority priority;

    @Nullable
    TransitionRejection rejection;

    public static TransitionResult accepted(BotState from, BotState to, TransitionPriority priority) {
        return new TransitionResult(true, from, to, priority, null);
    }

    public static TransitionResult rejected(BotState from, BotState to, TransitionPriority priority,
                                            TransitionRejection rejection) {
        return new TransitionResult(false, from, to, priority, rejection);
    }

    public boolean isRejected() {
        return !accepted;
    }

    /**
     * Whether the request broke the graph rules (missing edge or failed guard).
     */
    public boolean isInvalidTransition() {
        return rejection != null && rejection.isInvalidTransition();
    }
}
