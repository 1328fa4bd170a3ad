package com.warden.state;

import lombok.Getter;

/**
 * Thrown by {@link BotStateMachine#requireTransition} when a request is rejected.
 * {@link BotStateMachine#requestTransition} reports the same information by value.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final transient TransitionResult result;

    public InvalidTransitionException(TransitionResult result) {
        super(String.format("Cannot transition from %s to %s (%s)",
                result.getFrom(), result.getTo(), result.getRejection()));
        this.result = result;
    }
}
