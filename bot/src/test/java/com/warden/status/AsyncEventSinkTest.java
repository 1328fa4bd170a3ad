package com.warden.status;

import com.warden.recovery.ErrorSeverity;
import com.warden.state.BotState;
import com.warden.tasks.RunResult;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class AsyncEventSinkTest {

    private AsyncEventSink sink;

    @Before
    public void setUp() {
        sink = new AsyncEventSink(List.of());
    }

    @After
    public void tearDown() {
        sink.shutdown();
    }

    @Test
    public void testDelivery_InEmissionOrder() {
        List<BotState> seen = Collections.synchronizedList(new ArrayList<>());
        sink.addDelegate(new EventSink() {
            @Override
            public void onRunFinished(RunResult result) {
                seen.add(result.getNextState());
            }
        });

        sink.onRunFinished(RunResult.next(BotState.RUNNING));
        sink.onRunFinished(RunResult.next(BotState.LOOTING));
        sink.onRunFinished(RunResult.next(BotState.RETURNING));

        assertTrue(sink.flush(Duration.ofSeconds(2)));
        assertEquals(List.of(BotState.RUNNING, BotState.LOOTING, BotState.RETURNING), seen);
    }

    @Test
    public void testSlowDelegate_DoesNotBlockCaller() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        sink.addDelegate(new EventSink() {
            @Override
            public void onRunFinished(RunResult result) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        long begin = System.nanoTime();
        sink.onRunFinished(RunResult.stay());
        sink.onRunFinished(RunResult.stay());
        long elapsedMs = (System.nanoTime() - begin) / 1_000_000;

        assertTrue("Emit took " + elapsedMs + "ms", elapsedMs < 500);
        assertFalse(sink.flush(Duration.ofMillis(50)));
        release.countDown();
        assertTrue(sink.flush(Duration.ofSeconds(2)));
    }

    @Test
    public void testFailingDelegate_OthersStillCalled() {
        EventSink failing = mock(EventSink.class);
        EventSink healthy = mock(EventSink.class);
        doThrow(new IllegalStateException("sink down")).when(failing).onRunFinished(any());
        sink.addDelegate(failing);
        sink.addDelegate(healthy);

        sink.onRunFinished(RunResult.stay());

        assertTrue(sink.flush(Duration.ofSeconds(2)));
        verify(healthy).onRunFinished(any());
    }

    @Test
    public void testAfterShutdown_EventsDropped() {
        EventSink delegate = mock(EventSink.class);
        sink.addDelegate(delegate);
        sink.shutdown();

        sink.onRunFinished(RunResult.stay());

        assertFalse(sink.flush(Duration.ofMillis(100)));
        verifyNoInteractions(delegate);
    }

    @Test
    public void testLoggingSink_AcceptsEveryEvent() {
        LoggingEventSink logging = new LoggingEventSink();

        logging.onRunFinished(RunResult.stay());
        logging.onAlert(Alert.builder()
                .severity(ErrorSeverity.CRITICAL)
                .state(BotState.ERROR)
                .title("t")
                .message("m")
                .build());
    }
}
