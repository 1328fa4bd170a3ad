package com.warden.timing;

import com.warden.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;

/**
 * Sleeps and jittered delays for recovery waits and settle times.
 *
 * <p>Kept behind an instance so tests can replace sleeping with a mock.
 */
@Slf4j
@Singleton
public class DelayTimer {

    private final Randomization randomization;

    @Inject
    public DelayTimer(Randomization randomization) {
        this.randomization = randomization;
    }

    /**
     * Sleep for {@code duration}. Restores the interrupt flag if interrupted.
     *
     * @return false if the sleep was interrupted
     */
    public boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Sleep of {}ms interrupted", duration.toMillis());
            return false;
        }
    }

    /**
     * A delay around {@code base}, varied by up to {@code fraction} either way
     * (Gaussian, clamped).
     *
     * @param base     nominal delay
     * @param fraction relative spread, e.g. 0.2 for +-20%
     * @return jittered delay, never negative
     */
    public Duration jittered(Duration base, double fraction) {
        long mean = base.toMillis();
        if (mean <= 0 || fraction <= 0) {
            return base;
        }
        long spread = Math.round(mean * fraction);
        long millis = randomization.gaussianRandomLong(mean, spread / 2.0, mean - spread, mean + spread);
        return Duration.ofMillis(Math.max(0, millis));
    }

    /**
     * Sleep for a jittered delay around {@code base}.
     *
     * @return false if interrupted
     */
    public boolean sleepJittered(Duration base, double fraction) {
        return sleep(jittered(base, fraction));
    }
}
