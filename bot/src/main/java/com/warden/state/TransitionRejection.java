package com.warden.state;

/**
 * Why a transition request was rejected.
 */
public enum TransitionRejection {

    /** The (from, to) pair is not an edge of the transition graph. */
    NOT_IN_GRAPH,

    /** The edge exists but its guard rejected the latest observation. */
    GUARD_FAILED,

    /** Target equals the current state and the graph has no self edge. */
    ALREADY_IN_STATE,

    /** Another request was already in flight and this one did not outrank it. */
    BUSY,

    /** A preemptive request arrived while this normal request was in flight. */
    SUPERSEDED,

    /** A preemptive transition already committed in this arbitration window. */
    PREEMPTED,

    /** Waiting for an in-flight transition exceeded the configured bound. */
    TIMED_OUT,

    /** The waiting thread was interrupted. */
    INTERRUPTED;

    /**
     * Whether this rejection reflects a request outside the graph rules
     * (as opposed to contention with another request).
     *
     * @return true for graph and guard violations
     */
    public boolean isInvalidTransition() {
        return this == NOT_IN_GRAPH || this == GUARD_FAILED;
    }
}
