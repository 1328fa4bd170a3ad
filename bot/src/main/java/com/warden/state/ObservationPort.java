package com.warden.state;

import java.time.Duration;

/**
 * Source of observations (the image classification pipeline).
 *
 * <p>Calls are idempotent. The engine wraps every call in a bounded wait, so an
 * implementation may block; it must not assume it is polled faster than
 * {@link #getRefreshInterval()}.
 */
public interface ObservationPort {

    /**
     * Produce the current observation.
     *
     * @return a snapshot; {@link Observation#unknown()} if the classifier cannot decide
     */
    Observation observe();

    /**
     * Internal refresh cap of the classifier. The loop never ticks faster than this.
     *
     * @return minimum useful interval between calls
     */
    default Duration getRefreshInterval() {
        return Duration.ZERO;
    }
}
