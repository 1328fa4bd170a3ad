package com.warden.state;

/**
 * Priority class of a transition request.
 */
public enum TransitionPriority {

    /**
     * Regular request from the loop or a domain handler.
     * Loses to any preemptive request in the same arbitration window.
     */
    NORMAL,

    /**
     * Emergency request (chicken, critical error).
     * Supersedes a normal request that is still in flight.
     */
    PREEMPTIVE;

    public boolean isHigherThan(TransitionPriority other) {
        return this.ordinal() > other.ordinal();
    }
}
