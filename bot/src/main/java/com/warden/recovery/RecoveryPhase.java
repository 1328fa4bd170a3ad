package com.warden.recovery;

/**
 * Lifecycle of one error occurrence.
 *
 * <pre>
 * DETECTED -> CLASSIFIED -> RECOVERY_ATTEMPTED -> RESOLVED
 *                  |                 |
 *                  +-----------------+----------> ESCALATED
 * </pre>
 */
public enum RecoveryPhase {
    DETECTED,
    CLASSIFIED,
    RECOVERY_ATTEMPTED,
    RESOLVED,
    ESCALATED;

    public boolean isTerminal() {
        return this == RESOLVED || this == ESCALATED;
    }
}
