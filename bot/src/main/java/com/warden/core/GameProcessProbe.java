package com.warden.core;

/**
 * Liveness check for the game process. Optional: without one the loop does not detect
 * process crashes.
 */
@FunctionalInterface
public interface GameProcessProbe {

    boolean isAlive() throws Exception;
}
