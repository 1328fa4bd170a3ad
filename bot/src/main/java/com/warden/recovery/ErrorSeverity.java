package com.warden.recovery;

/**
 * Severity tiers, in increasing order of impact.
 * Escalation only ever moves an event to a later constant.
 */
public enum ErrorSeverity {

    /** Retried automatically up to the kind's retry budget. */
    RECOVERABLE,

    /** Terminates the current run; a fresh run starts afterwards. */
    RUN_ENDING,

    /** Pauses the engine until resumed externally. */
    CRITICAL;

    public static ErrorSeverity max(ErrorSeverity a, ErrorSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
