package com.warden.recovery;

/**
 * What the loop should do after an error occurrence was handled.
 */
public enum Resolution {
    /** Keep going in the current state. */
    CONTINUE,
    /** The current run is over; start a fresh one. */
    END_RUN,
    /** Engine paused; waits for an external resume. */
    PAUSE_AND_ALERT,
    /** Dropped while paused; recorded but not acted on. */
    DISCARDED
}
