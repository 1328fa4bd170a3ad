package com.warden.state;

/**
 * Predicate evaluated against the latest observation before an edge may be taken.
 */
@FunctionalInterface
public interface TransitionGuard {

    /**
     * @param latest the most recent observation, {@link Observation#unknown()} if none yet
     * @return true if the transition may proceed
     */
    boolean allows(Observation latest);

    /**
     * Guard that always passes.
     */
    TransitionGuard ALWAYS = latest -> true;
}
