package com.warden.status;

import com.warden.behavior.ChickenEvent;
import com.warden.recovery.RecoveryRecord;
import com.warden.state.TransitionRecord;
import com.warden.tasks.RunResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Fans events out to delegate sinks on a single background thread, so slow sinks never
 * hold up the loop or the health controller. Delegates see events in emission order.
 */
@Slf4j
public class AsyncEventSink implements EventSink {

    private final ThreadPoolExecutor executor;
    private final List<EventSink> delegates = new CopyOnWriteArrayList<>();

    public AsyncEventSink(List<EventSink> delegates) {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "Warden-Events");
            t.setDaemon(true);
            return t;
        };
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), tf);
        this.delegates.addAll(delegates);
        log.info("AsyncEventSink initialized with {} delegates", delegates.size());
    }

    public void addDelegate(EventSink sink) {
        delegates.add(sink);
    }

    @Override
    public void onTransition(TransitionRecord record) {
        dispatch(sink -> sink.onTransition(record));
    }

    @Override
    public void onError(RecoveryRecord record) {
        dispatch(sink -> sink.onError(record));
    }

    @Override
    public void onAlert(Alert alert) {
        dispatch(sink -> sink.onAlert(alert));
    }

    @Override
    public void onChicken(ChickenEvent event) {
        dispatch(sink -> sink.onChicken(event));
    }

    @Override
    public void onRunFinished(RunResult result) {
        dispatch(sink -> sink.onRunFinished(result));
    }

    private void dispatch(Consumer<EventSink> call) {
        try {
            executor.execute(() -> {
                for (EventSink sink : delegates) {
                    try {
                        call.accept(sink);
                    } catch (RuntimeException e) {
                        log.error("Event sink {} failed", sink.getClass().getSimpleName(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event dropped after shutdown");
        }
    }

    /**
     * Wait until everything emitted so far has been delivered.
     *
     * @return false if the wait timed out or was interrupted
     */
    public boolean flush(Duration timeout) {
        try {
            executor.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.debug("Flush did not complete: {}", e.toString());
            return false;
        }
    }

    /**
     * Debug helper: current queued event count.
     */
    public int getQueueSize() {
        return executor.getQueue().size();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public void shutdown() {
        executor.shutdown();
    }
}
