package com.warden.behavior;

/**
 * Health band of the latest sample.
 */
public enum HealthStatus {
    /** Above the warning threshold. */
    SAFE,
    /** At or below the warning threshold, above the floor. */
    WARNING,
    /** At or below the health floor, or the mana floor when one is set. */
    CRITICAL,
    /** No usable reading. */
    UNKNOWN
}
