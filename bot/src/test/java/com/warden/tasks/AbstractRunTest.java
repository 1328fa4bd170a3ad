package com.warden.tasks;

import com.warden.config.BotConfig;
import com.warden.recovery.ErrorKind;
import com.warden.state.BotState;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class AbstractRunTest {

    @Mock
    private HandlerContext ctx;

    private AutoCloseable mocks;

    @Before
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(ctx.getConfig()).thenReturn(BotConfig.DEFAULTS);
        when(ctx.currentState()).thenReturn(BotState.RUNNING);
    }

    @After
    public void tearDown() throws Exception {
        mocks.close();
    }

    /**
     * Run that executes {@code steps} checkpointed steps, optionally with a body per step.
     */
    private static class SteppedRun extends AbstractRun {
        private final int steps;
        private final Runnable step;
        final AtomicInteger executed = new AtomicInteger();

        SteppedRun(int steps, Runnable step) {
            this.steps = steps;
            this.step = step;
        }

        @Override
        public String getName() {
            return "Stepped";
        }

        @Override
        protected RunStatus executeRun(HandlerContext ctx) {
            for (int i = 0; i < steps; i++) {
                checkpoint(ctx);
                step.run();
                executed.incrementAndGet();
                kills++;
            }
            return RunStatus.SUCCESS;
        }
    }

    // ========================================================================
    // Completion
    // ========================================================================

    @Test
    public void testExecute_Completes_SuccessRequestsReturning() {
        SteppedRun run = new SteppedRun(3, () -> { });

        RunResult result = run.execute(ctx);

        assertTrue(result.isSuccess());
        assertEquals(BotState.RETURNING, result.getNextState());
        assertEquals("Stepped", result.getRunName());
        assertNull(result.getErrorKind());
        assertEquals(3, result.getKills());
        assertTrue(result.isRun());
        assertEquals(1, run.getHistory().size());
    }

    @Test
    public void testExecute_Throws_ErrorWithHandlerFailure() {
        SteppedRun run = new SteppedRun(2, () -> {
            throw new IllegalStateException("template missing");
        });

        RunResult result = run.execute(ctx);

        assertEquals(RunStatus.ERROR, result.getStatus());
        assertEquals(ErrorKind.HANDLER_FAILURE, result.getErrorKind());
        assertEquals("template missing", result.getMessage());
        assertNull(result.getNextState());
    }

    // ========================================================================
    // Cooperative stop
    // ========================================================================

    @Test
    public void testCheckpoint_Chickened_StopsWithChicken() {
        when(ctx.currentState()).thenReturn(BotState.RUNNING, BotState.CHICKENED);
        SteppedRun run = new SteppedRun(5, () -> { });

        RunResult result = run.execute(ctx);

        assertEquals(RunStatus.CHICKEN, result.getStatus());
        assertEquals(1, run.executed.get());
        assertNull(result.getErrorKind());
    }

    @Test
    public void testCheckpoint_Dead_StopsWithDeath() {
        when(ctx.currentState()).thenReturn(BotState.DEAD);
        SteppedRun run = new SteppedRun(5, () -> { });

        RunResult result = run.execute(ctx);

        assertEquals(RunStatus.DEATH, result.getStatus());
        assertEquals(ErrorKind.CHARACTER_DEATH, result.getErrorKind());
        assertEquals(0, run.executed.get());
    }

    @Test
    public void testCheckpoint_OtherState_Aborted() {
        when(ctx.currentState()).thenReturn(BotState.STOPPING);
        SteppedRun run = new SteppedRun(5, () -> { });

        assertEquals(RunStatus.ABORTED, run.execute(ctx).getStatus());
    }

    @Test
    public void testAbort_StopsAtNextCheckpoint() {
        SteppedRun[] holder = new SteppedRun[1];
        holder[0] = new SteppedRun(5, () -> holder[0].abort());

        RunResult result = holder[0].execute(ctx);

        assertEquals(RunStatus.ABORTED, result.getStatus());
        assertEquals(1, holder[0].executed.get());
    }

    @Test
    public void testCheckpoint_PastTimeout_Timeout() {
        when(ctx.getConfig()).thenReturn(BotConfig.DEFAULTS.toBuilder()
                .runTimeout(Duration.ofMillis(20))
                .build());
        SteppedRun run = new SteppedRun(5, () -> {
            try {
                Thread.sleep(40);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        RunResult result = run.execute(ctx);

        assertEquals(RunStatus.TIMEOUT, result.getStatus());
        assertEquals(ErrorKind.RUN_TIMEOUT, result.getErrorKind());
        assertEquals(1, run.executed.get());
    }

    @Test
    public void testSuccessAfterChicken_ReportedAsChicken() {
        SteppedRun run = new SteppedRun(1, () -> { });
        when(ctx.currentState()).thenReturn(BotState.RUNNING, BotState.CHICKENED);

        assertEquals(RunStatus.CHICKEN, run.execute(ctx).getStatus());
    }

    @Test
    public void testExecute_ResetsCountersBetweenRuns() {
        SteppedRun run = new SteppedRun(2, () -> { });

        run.execute(ctx);
        RunResult second = run.execute(ctx);

        assertEquals(2, second.getKills());
        assertEquals(2, run.getHistory().size());
    }
}
