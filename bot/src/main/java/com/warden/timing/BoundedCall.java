package com.warden.timing;

import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs port calls on daemon worker threads and waits for them under a timeout.
 *
 * <p>Every blocking call into the observation or action port goes through here, so a
 * hung port can never block the caller longer than the given timeout. A timed-out call
 * is cancelled (its worker interrupted) and reported as {@link TimeoutException}.
 */
@Slf4j
@Singleton
public class BoundedCall {

    private final ExecutorService executor;

    @Inject
    public BoundedCall() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "Warden-Port-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newCachedThreadPool(tf);
        log.info("BoundedCall initialized");
    }

    /**
     * Constructor for testing with a custom executor.
     */
    BoundedCall(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Run {@code task} and wait at most {@code timeout} for its result.
     *
     * @throws TimeoutException     if the task did not finish in time
     * @throws CallFailedException  if the task threw
     * @throws InterruptedException if the caller was interrupted while waiting
     */
    public <T> T call(Callable<T> task, Duration timeout)
            throws TimeoutException, InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw new CallFailedException(e.getCause());
        } catch (CancellationException e) {
            throw new CallFailedException(e);
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * The bounded task itself threw.
     */
    public static class CallFailedException extends RuntimeException {
        public CallFailedException(Throwable cause) {
            super(cause == null ? "call failed" : cause.getMessage(), cause);
        }
    }
}
