package com.warden.state;

import com.warden.config.BotConfig;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

/**
 * Unit tests for BotStateMachine.
 * Tests graph validation, guards, hooks, and concurrent arbitration.
 */
public class BotStateMachineTest {

    private BotConfig config;
    private BotStateMachine stateMachine;
    private ExecutorService pool;

    @Before
    public void setUp() {
        config = BotConfig.builder()
                .transitionWaitTimeout(Duration.ofSeconds(5))
                .build();
        stateMachine = new BotStateMachine(TransitionGraph.standard(config), config);
        pool = Executors.newCachedThreadPool();
    }

    @After
    public void tearDown() {
        pool.shutdownNow();
    }

    private void walkTo(BotState... path) {
        for (BotState state : path) {
            TransitionResult result = stateMachine.requestTransition(state, TransitionPriority.NORMAL, "test");
            assertTrue("Expected accepted transition to " + state + ": " + result, result.isAccepted());
        }
    }

    private void walkToRunning() {
        walkTo(BotState.STARTING, BotState.IN_TOWN, BotState.RUNNING);
    }

    /**
     * Blocks the departure from {@code from} toward {@code towards} inside its exit hook.
     */
    private CountDownLatch[] blockExit(BotState from, BotState towards) {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        stateMachine.registerHook(from, new StateHook() {
            @Override
            public void onExit(BotState f, BotState to) {
                if (to != towards) {
                    return;
                }
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        return new CountDownLatch[]{entered, release};
    }

    /**
     * Blocks the arrival at {@code state} inside its enter hook, after the transition committed.
     */
    private CountDownLatch[] blockEnter(BotState state) {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        stateMachine.registerHook(state, new StateHook() {
            @Override
            public void onEnter(BotState from, BotState to) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        return new CountDownLatch[]{entered, release};
    }

    private static void awaitTimedWaiting(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (thread.getState() != Thread.State.TIMED_WAITING) {
            assertTrue("Thread never started waiting", System.currentTimeMillis() < deadline);
            Thread.sleep(5);
        }
    }

    // ========================================================================
    // Graph Validation Tests
    // ========================================================================

    @Test
    public void testInitialState_IsIdle() {
        assertEquals(BotState.IDLE, stateMachine.currentState());
        assertEquals(BotState.IDLE, stateMachine.currentState());
        assertFalse(stateMachine.isTransitionInFlight());
    }

    @Test
    public void testRequestTransition_EdgeInGraph_Accepted() {
        TransitionResult result = stateMachine.requestTransition(BotState.STARTING, TransitionPriority.NORMAL);

        assertTrue(result.isAccepted());
        assertEquals(BotState.IDLE, result.getFrom());
        assertEquals(BotState.STARTING, result.getTo());
        assertEquals(BotState.STARTING, stateMachine.currentState());
        assertEquals(BotState.IDLE, stateMachine.getPreviousState());
        assertEquals(1, stateMachine.getAcceptedTransitionCount());
    }

    @Test
    public void testRequestTransition_EdgeNotInGraph_RejectedAndStateUnchanged() {
        TransitionResult result = stateMachine.requestTransition(BotState.RUNNING, TransitionPriority.NORMAL);

        assertTrue(result.isRejected());
        assertEquals(TransitionRejection.NOT_IN_GRAPH, result.getRejection());
        assertTrue(result.isInvalidTransition());
        assertEquals(BotState.IDLE, stateMachine.currentState());
        assertEquals(1, stateMachine.getInvalidTransitionCount());
    }

    @Test
    public void testRequestTransition_FightingToLevelingUp_RejectedAndRecorded() {
        walkToRunning();
        walkTo(BotState.FIGHTING);

        TransitionResult result = stateMachine.requestTransition(BotState.LEVELING_UP, TransitionPriority.NORMAL, "test");

        assertEquals(TransitionRejection.NOT_IN_GRAPH, result.getRejection());
        assertEquals(BotState.FIGHTING, stateMachine.currentState());
        TransitionRecord last = stateMachine.getHistory().get(stateMachine.getHistory().size() - 1);
        assertFalse(last.isAccepted());
        assertEquals(BotState.FIGHTING, last.getFrom());
        assertEquals(BotState.LEVELING_UP, last.getTo());
        assertEquals("test", last.getOrigin());
    }

    @Test
    public void testRequestTransition_PreemptiveOutsideGraph_StillRejected() {
        TransitionResult result = stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE);

        assertEquals(TransitionRejection.NOT_IN_GRAPH, result.getRejection());
        assertEquals(BotState.IDLE, stateMachine.currentState());
    }

    @Test
    public void testRequestTransition_SameState_AlreadyInState() {
        TransitionResult result = stateMachine.requestTransition(BotState.IDLE, TransitionPriority.NORMAL);

        assertEquals(TransitionRejection.ALREADY_IN_STATE, result.getRejection());
        assertFalse(result.isInvalidTransition());
        assertEquals(0, stateMachine.getInvalidTransitionCount());
    }

    @Test
    public void testRequestTransition_SelfEdgeInGraph_Accepted() {
        TransitionGraph graph = TransitionGraph.builder()
                .allow(BotState.IDLE, BotState.IDLE)
                .build();
        BotStateMachine machine = new BotStateMachine(graph, config);

        assertTrue(machine.requestTransition(BotState.IDLE, TransitionPriority.NORMAL).isAccepted());
    }

    @Test
    public void testRequireTransition_Rejected_Throws() {
        try {
            stateMachine.requireTransition(BotState.DEAD, TransitionPriority.NORMAL, "test");
            fail("Expected InvalidTransitionException");
        } catch (InvalidTransitionException e) {
            assertEquals(TransitionRejection.NOT_IN_GRAPH, e.getResult().getRejection());
            assertTrue(e.getMessage().contains("IDLE"));
        }
    }

    @Test
    public void testCanTransitionTo_ReflectsGraph() {
        assertTrue(stateMachine.canTransitionTo(BotState.STARTING));
        assertFalse(stateMachine.canTransitionTo(BotState.RUNNING));
    }

    // ========================================================================
    // Guard Tests
    // ========================================================================

    @Test
    public void testGuard_LowHealth_BlocksRunStart() {
        walkTo(BotState.STARTING, BotState.IN_TOWN);
        stateMachine.updateObservation(Observation.builder()
                .label("in_town").confidence(0.9).readout(Observation.HEALTH, 20.0).build());

        TransitionResult result = stateMachine.requestTransition(BotState.RUNNING, TransitionPriority.NORMAL);

        assertEquals(TransitionRejection.GUARD_FAILED, result.getRejection());
        assertEquals(BotState.IN_TOWN, stateMachine.currentState());
        assertEquals(1, stateMachine.getInvalidTransitionCount());
    }

    @Test
    public void testGuard_HealthyObservation_AllowsRunStart() {
        walkTo(BotState.STARTING, BotState.IN_TOWN);
        stateMachine.updateObservation(Observation.builder()
                .label("in_town").confidence(0.9).readout(Observation.HEALTH, 80.0).build());

        assertTrue(stateMachine.requestTransition(BotState.RUNNING, TransitionPriority.NORMAL).isAccepted());
    }

    @Test
    public void testGuard_Throws_TreatedAsFailed() {
        TransitionGraph graph = TransitionGraph.builder()
                .allow(BotState.IDLE, BotState.STARTING)
                .guard(BotState.IDLE, BotState.STARTING, latest -> {
                    throw new IllegalStateException("boom");
                })
                .build();
        BotStateMachine machine = new BotStateMachine(graph, config);

        TransitionResult result = machine.requestTransition(BotState.STARTING, TransitionPriority.NORMAL);

        assertEquals(TransitionRejection.GUARD_FAILED, result.getRejection());
        assertEquals(BotState.IDLE, machine.currentState());
    }

    // ========================================================================
    // Hook and Listener Tests
    // ========================================================================

    @Test
    public void testHooks_RunExitThenEnterThenListener() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        stateMachine.registerHook(BotState.IDLE, new StateHook() {
            @Override
            public void onExit(BotState from, BotState to) {
                calls.add("exit " + from + "->" + to);
            }
        });
        stateMachine.registerHook(BotState.STARTING, new StateHook() {
            @Override
            public void onEnter(BotState from, BotState to) {
                calls.add("enter " + from + "->" + to);
            }
        });
        stateMachine.addListener(record -> calls.add("listener " + record.isAccepted()));

        walkTo(BotState.STARTING);

        assertEquals(List.of("exit IDLE->STARTING", "enter IDLE->STARTING", "listener true"), calls);
    }

    @Test
    public void testHooks_ThrowingHook_DoesNotBreakTransition() {
        stateMachine.registerHook(BotState.STARTING, new StateHook() {
            @Override
            public void onEnter(BotState from, BotState to) {
                throw new IllegalStateException("hook failure");
            }
        });

        assertTrue(stateMachine.requestTransition(BotState.STARTING, TransitionPriority.NORMAL).isAccepted());
        assertEquals(BotState.STARTING, stateMachine.currentState());
        assertFalse(stateMachine.isTransitionInFlight());
    }

    @Test
    public void testListener_ReceivesRejections() {
        List<TransitionRecord> records = new ArrayList<>();
        stateMachine.addListener(records::add);

        stateMachine.requestTransition(BotState.LOOTING, TransitionPriority.NORMAL, "loop");

        assertEquals(1, records.size());
        assertEquals(TransitionRejection.NOT_IN_GRAPH, records.get(0).getRejection());
    }

    @Test
    public void testRemoveListener_StopsNotifications() {
        AtomicInteger count = new AtomicInteger();
        TransitionListener listener = record -> count.incrementAndGet();
        stateMachine.addListener(listener);
        walkTo(BotState.STARTING);
        stateMachine.removeListener(listener);
        walkTo(BotState.IN_TOWN);

        assertEquals(1, count.get());
    }

    // ========================================================================
    // Arbitration Tests
    // ========================================================================

    @Test
    public void testPreemptive_SupersedesInFlightNormal() throws Exception {
        walkToRunning();
        CountDownLatch[] gate = blockExit(BotState.RUNNING, BotState.FIGHTING);
        AtomicInteger exitCalls = new AtomicInteger();
        stateMachine.registerHook(BotState.RUNNING, new StateHook() {
            @Override
            public void onExit(BotState from, BotState to) {
                exitCalls.incrementAndGet();
            }
        });

        Future<TransitionResult> normal = pool.submit(() ->
                stateMachine.requestTransition(BotState.FIGHTING, TransitionPriority.NORMAL, "loop"));
        assertTrue(gate[0].await(5, TimeUnit.SECONDS));

        AtomicReference<TransitionResult> preemptive = new AtomicReference<>();
        Thread health = new Thread(() -> preemptive.set(
                stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health")));
        health.start();
        awaitTimedWaiting(health);
        gate[1].countDown();

        TransitionResult normalResult = normal.get(5, TimeUnit.SECONDS);
        health.join(5000);

        assertEquals(TransitionRejection.SUPERSEDED, normalResult.getRejection());
        assertTrue(preemptive.get().isAccepted());
        assertEquals(BotState.RUNNING, preemptive.get().getFrom());
        assertEquals(BotState.CHICKENED, stateMachine.currentState());
        assertEquals("exit hooks run once per attempt", 2, exitCalls.get());
    }

    @Test
    public void testPreemptive_DuringNormalEnterHooks_SupersedesCommittedNormal() throws Exception {
        walkToRunning();
        CountDownLatch[] gate = blockEnter(BotState.IN_TOWN);
        AtomicInteger townExits = new AtomicInteger();
        stateMachine.registerHook(BotState.IN_TOWN, new StateHook() {
            @Override
            public void onExit(BotState from, BotState to) {
                townExits.incrementAndGet();
            }
        });

        Future<TransitionResult> normal = pool.submit(() ->
                stateMachine.requestTransition(BotState.IN_TOWN, TransitionPriority.NORMAL, "loop"));
        assertTrue(gate[0].await(5, TimeUnit.SECONDS));
        assertEquals(BotState.IN_TOWN, stateMachine.currentState());

        AtomicReference<TransitionResult> preemptive = new AtomicReference<>();
        Thread health = new Thread(() -> preemptive.set(
                stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health")));
        health.start();
        awaitTimedWaiting(health);
        gate[1].countDown();

        TransitionResult normalResult = normal.get(5, TimeUnit.SECONDS);
        health.join(5000);

        assertEquals(TransitionRejection.SUPERSEDED, normalResult.getRejection());
        assertTrue(preemptive.get().isAccepted());
        assertEquals(BotState.RUNNING, preemptive.get().getFrom());
        assertEquals(BotState.CHICKENED, stateMachine.currentState());
        assertEquals(BotState.RUNNING, stateMachine.getPreviousState());
        assertEquals("the entered state is still exited", 1, townExits.get());
    }

    @Test
    public void testPreemptive_TimesOutDuringNormalEnterHooks_NormalStands() throws Exception {
        BotConfig shortWait = BotConfig.builder().transitionWaitTimeout(Duration.ofMillis(100)).build();
        stateMachine = new BotStateMachine(TransitionGraph.standard(shortWait), shortWait);
        walkToRunning();
        CountDownLatch[] gate = blockEnter(BotState.IN_TOWN);
        Future<TransitionResult> normal = pool.submit(() ->
                stateMachine.requestTransition(BotState.IN_TOWN, TransitionPriority.NORMAL, "loop"));
        assertTrue(gate[0].await(5, TimeUnit.SECONDS));

        TransitionResult preemptive = stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health");
        gate[1].countDown();

        assertEquals(TransitionRejection.TIMED_OUT, preemptive.getRejection());
        assertTrue(normal.get(5, TimeUnit.SECONDS).isAccepted());
        assertEquals(BotState.IN_TOWN, stateMachine.currentState());
    }

    @Test
    public void testNormal_WhileNormalInFlight_Busy() throws Exception {
        CountDownLatch[] gate = blockExit(BotState.IDLE, BotState.STARTING);
        Future<TransitionResult> first = pool.submit(() ->
                stateMachine.requestTransition(BotState.STARTING, TransitionPriority.NORMAL, "first"));
        assertTrue(gate[0].await(5, TimeUnit.SECONDS));

        TransitionResult second = stateMachine.requestTransition(BotState.STOPPING, TransitionPriority.NORMAL, "second");
        gate[1].countDown();

        assertEquals(TransitionRejection.BUSY, second.getRejection());
        assertTrue(first.get(5, TimeUnit.SECONDS).isAccepted());
        assertEquals(BotState.STARTING, stateMachine.currentState());
    }

    @Test
    public void testNormal_WhilePreemptiveInFlight_Preempted() throws Exception {
        walkToRunning();
        CountDownLatch[] gate = blockExit(BotState.RUNNING, BotState.CHICKENED);
        Future<TransitionResult> chicken = pool.submit(() ->
                stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health"));
        assertTrue(gate[0].await(5, TimeUnit.SECONDS));

        TransitionResult normal = stateMachine.requestTransition(BotState.FIGHTING, TransitionPriority.NORMAL, "loop");
        gate[1].countDown();

        assertEquals(TransitionRejection.PREEMPTED, normal.getRejection());
        assertTrue(chicken.get(5, TimeUnit.SECONDS).isAccepted());
        assertEquals(BotState.CHICKENED, stateMachine.currentState());
    }

    @Test
    public void testPreemptive_WaitBeyondTimeout_TimedOut() throws Exception {
        BotConfig shortWait = BotConfig.builder().transitionWaitTimeout(Duration.ofMillis(100)).build();
        stateMachine = new BotStateMachine(TransitionGraph.standard(shortWait), shortWait);
        walkToRunning();
        CountDownLatch[] gate = blockExit(BotState.RUNNING, BotState.FIGHTING);
        Future<TransitionResult> normal = pool.submit(() ->
                stateMachine.requestTransition(BotState.FIGHTING, TransitionPriority.NORMAL, "loop"));
        assertTrue(gate[0].await(5, TimeUnit.SECONDS));

        TransitionResult preemptive = stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health");
        gate[1].countDown();

        assertEquals(TransitionRejection.TIMED_OUT, preemptive.getRejection());
        assertEquals("the normal request was marked superseded",
                TransitionRejection.SUPERSEDED, normal.get(5, TimeUnit.SECONDS).getRejection());
        assertEquals(BotState.RUNNING, stateMachine.currentState());
    }

    @Test
    public void testPreemptionLatch_RejectsNormalUntilNextTick() {
        walkToRunning();
        assertTrue(stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health").isAccepted());
        assertTrue(stateMachine.isPreemptionLatched());

        TransitionResult blocked = stateMachine.requestTransition(BotState.IN_TOWN, TransitionPriority.NORMAL, "loop");
        assertEquals(TransitionRejection.PREEMPTED, blocked.getRejection());
        assertEquals(BotState.CHICKENED, stateMachine.currentState());

        stateMachine.beginTick();

        assertFalse(stateMachine.isPreemptionLatched());
        assertTrue(stateMachine.requestTransition(BotState.IN_TOWN, TransitionPriority.NORMAL, "loop").isAccepted());
    }

    @Test
    public void testPreemptionLatch_DoesNotBlockPreemptive() {
        walkToRunning();
        stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health");

        assertTrue(stateMachine.requestTransition(BotState.ERROR, TransitionPriority.PREEMPTIVE, "recovery").isAccepted());
    }

    @Test
    public void testConcurrentRequests_PreemptiveTargetWins() throws Exception {
        for (int round = 0; round < 20; round++) {
            stateMachine = new BotStateMachine(TransitionGraph.standard(config), config);
            walkToRunning();
            stateMachine.beginTick();
            CountDownLatch start = new CountDownLatch(1);

            Future<?> normal = pool.submit(() -> {
                start.await();
                stateMachine.requestTransition(BotState.FIGHTING, TransitionPriority.NORMAL, "loop");
                stateMachine.requestTransition(BotState.LOOTING, TransitionPriority.NORMAL, "loop");
                return null;
            });
            Future<?> preemptive = pool.submit(() -> {
                start.await();
                return stateMachine.requestTransition(BotState.CHICKENED, TransitionPriority.PREEMPTIVE, "health");
            });
            start.countDown();
            normal.get(5, TimeUnit.SECONDS);
            TransitionResult chicken = (TransitionResult) preemptive.get(5, TimeUnit.SECONDS);

            assertTrue("round " + round + ": " + chicken, chicken.isAccepted());
            assertEquals("round " + round, BotState.CHICKENED, stateMachine.currentState());
            assertTrue(stateMachine.awaitSettled(1, TimeUnit.SECONDS));
        }
    }

    // ========================================================================
    // Bookkeeping Tests
    // ========================================================================

    @Test
    public void testWaitForState_ReachedFromOtherThread() throws Exception {
        pool.submit(() -> {
            Thread.sleep(50);
            return stateMachine.requestTransition(BotState.STARTING, TransitionPriority.NORMAL);
        });

        assertTrue(stateMachine.waitForState(BotState.STARTING, Duration.ofSeconds(5)));
    }

    @Test
    public void testWaitForState_NotReached_ReturnsFalse() throws Exception {
        assertFalse(stateMachine.waitForState(BotState.RUNNING, Duration.ofMillis(50)));
    }

    @Test
    public void testIsInState_MatchesAnyOf() {
        walkTo(BotState.STARTING);

        assertTrue(stateMachine.isInState(BotState.IDLE, BotState.STARTING));
        assertFalse(stateMachine.isInState(BotState.RUNNING, BotState.FIGHTING));
    }

    @Test
    public void testHistory_RecordsAcceptedAndRejected() {
        walkTo(BotState.STARTING);
        stateMachine.requestTransition(BotState.LOOTING, TransitionPriority.NORMAL);

        List<TransitionRecord> history = stateMachine.getHistory();
        assertEquals(2, history.size());
        assertTrue(history.get(0).isAccepted());
        assertFalse(history.get(1).isAccepted());
    }

    @Test
    public void testStateDuration_NonNegative() {
        walkTo(BotState.STARTING);

        assertFalse(stateMachine.getStateDuration().isNegative());
        assertNotNull(stateMachine.getStateEnteredAt());
    }
}
