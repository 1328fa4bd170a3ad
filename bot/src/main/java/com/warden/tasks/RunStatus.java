package com.warden.tasks;

/**
 * How a handler invocation or a run ended.
 */
public enum RunStatus {
    /** Completed normally. */
    SUCCESS,
    /** The character died. */
    DEATH,
    /** Cut short by an emergency exit. */
    CHICKEN,
    /** Failed with an error. */
    ERROR,
    /** Ran past its time limit. */
    TIMEOUT,
    /** Stopped because the state left the run, or on request. */
    ABORTED;

    public boolean isFailure() {
        return this != SUCCESS;
    }
}
