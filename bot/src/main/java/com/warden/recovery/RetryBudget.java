package com.warden.recovery;

import lombok.Getter;

import java.time.Instant;

/**
 * Consecutive-failure counter for one error kind.
 *
 * <p>Owned by the recovery coordinator and only touched from the loop thread.
 * The counter never goes negative. Reaching the threshold escalates once and resets it.
 */
@Getter
public class RetryBudget {

    private final ErrorKind kind;
    private final int threshold;

    private int consecutiveFailures;
    private Instant lastReset = Instant.now();
    private long totalFailures;
    private long escalations;

    public RetryBudget(ErrorKind kind, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1, was " + threshold);
        }
        this.kind = kind;
        this.threshold = threshold;
    }

    /**
     * Count one more failure.
     *
     * @return true if this failure exhausted the budget; the counter has then been reset
     */
    public boolean recordFailure() {
        consecutiveFailures++;
        totalFailures++;
        if (consecutiveFailures >= threshold) {
            escalations++;
            reset();
            return true;
        }
        return false;
    }

    /**
     * The condition cleared; start counting from zero again.
     */
    public void recordSuccess() {
        if (consecutiveFailures > 0) {
            reset();
        }
    }

    public int getRemaining() {
        return threshold - consecutiveFailures;
    }

    private void reset() {
        consecutiveFailures = 0;
        lastReset = Instant.now();
    }

    @Override
    public String toString() {
        return String.format("RetryBudget[%s %d/%d]", kind, consecutiveFailures, threshold);
    }
}
