package com.warden.input;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of an action. Success only means the port accepted the input;
 * it says nothing about the effect in the game.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActionResult {

    public enum Status {
        OK,
        FAILED,
        TIMED_OUT
    }

    private static final ActionResult OK = new ActionResult(Status.OK, "");

    Status status;
    String message;

    public static ActionResult ok() {
        return OK;
    }

    public static ActionResult failed(String message) {
        return new ActionResult(Status.FAILED, message);
    }

    public static ActionResult timedOut(String message) {
        return new ActionResult(Status.TIMED_OUT, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }
}
