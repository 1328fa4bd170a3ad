package com.warden.state;

/**
 * Receives every transition record. Called outside the state machine lock.
 */
@FunctionalInterface
public interface TransitionListener {

    void onTransition(TransitionRecord record);
}
