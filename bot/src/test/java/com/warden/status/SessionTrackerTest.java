package com.warden.status;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.warden.behavior.ChickenEvent;
import com.warden.recovery.ErrorEvent;
import com.warden.recovery.ErrorKind;
import com.warden.recovery.ErrorSeverity;
import com.warden.recovery.RecoveryPhase;
import com.warden.recovery.RecoveryRecord;
import com.warden.recovery.Resolution;
import com.warden.state.BotState;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionRecord;
import com.warden.state.TransitionRejection;
import com.warden.tasks.RunResult;
import com.warden.tasks.RunStatus;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.Assert.*;

public class SessionTrackerTest {

    private SessionTracker tracker;

    @Before
    public void setUp() {
        tracker = new SessionTracker();
    }

    private static TransitionRecord accepted(BotState from, BotState to) {
        return new TransitionRecord(from, to, TransitionPriority.NORMAL, true, null, "test", Instant.now());
    }

    private static TransitionRecord rejected(BotState from, BotState to, TransitionRejection rejection) {
        return new TransitionRecord(from, to, TransitionPriority.NORMAL, false, rejection, "test", Instant.now());
    }

    private static RecoveryRecord handled(ErrorKind kind, ErrorSeverity classified, ErrorSeverity severity) {
        return RecoveryRecord.builder()
                .event(ErrorEvent.of(kind, BotState.RUNNING, ""))
                .classifiedSeverity(classified)
                .severity(severity)
                .phase(RecoveryPhase.RESOLVED)
                .resolution(Resolution.END_RUN)
                .handledAt(Instant.now())
                .build();
    }

    private static RunResult run(RunStatus status, long millis) {
        return RunResult.builder().status(status).runName("Pindleskin").duration(Duration.ofMillis(millis)).build();
    }

    // ========================================================================
    // Counting
    // ========================================================================

    @Test
    public void testSnapshot_NoSession_Empty() {
        assertSame(SessionStats.EMPTY, tracker.snapshot());
        assertFalse(tracker.isSessionActive());
        assertEquals("SessionStats[no data]", SessionStats.EMPTY.getSummary());
    }

    @Test
    public void testTransitions_CountsAcceptedDeathsAndInvalid() {
        tracker.startSession();

        tracker.onTransition(accepted(BotState.IDLE, BotState.STARTING));
        tracker.onTransition(accepted(BotState.FIGHTING, BotState.DEAD));
        tracker.onTransition(rejected(BotState.FIGHTING, BotState.LEVELING_UP, TransitionRejection.NOT_IN_GRAPH));
        tracker.onTransition(rejected(BotState.RUNNING, BotState.LOOTING, TransitionRejection.BUSY));

        SessionStats stats = tracker.snapshot();
        assertEquals(2, stats.getTransitions());
        assertEquals(1, stats.getDeaths());
        assertEquals(1, stats.getInvalidTransitions());
    }

    @Test
    public void testErrors_ByKindAndEscalations() {
        tracker.startSession();

        tracker.onError(handled(ErrorKind.STUCK, ErrorSeverity.RECOVERABLE, ErrorSeverity.RECOVERABLE));
        tracker.onError(handled(ErrorKind.STUCK, ErrorSeverity.RECOVERABLE, ErrorSeverity.RUN_ENDING));
        tracker.onError(handled(ErrorKind.DISCONNECT, ErrorSeverity.RUN_ENDING, ErrorSeverity.RUN_ENDING));

        SessionStats stats = tracker.snapshot();
        assertEquals(Long.valueOf(2), stats.getErrorsByKind().get("stuck"));
        assertEquals(3, stats.getTotalErrors());
        assertEquals(1, stats.getEscalations());
    }

    @Test
    public void testRuns_SuccessRateAndAverage() {
        tracker.startSession();

        tracker.onRunFinished(run(RunStatus.SUCCESS, 1000));
        tracker.onRunFinished(run(RunStatus.SUCCESS, 3000));
        tracker.onRunFinished(run(RunStatus.CHICKEN, 2000));
        tracker.onRunFinished(RunResult.next(BotState.RUNNING));

        SessionStats stats = tracker.snapshot();
        assertEquals(2, stats.getRunsCompleted());
        assertEquals(1, stats.getRunsFailed());
        assertEquals(3, stats.getTotalRuns());
        assertEquals(Duration.ofMillis(2000), stats.getAverageRunTime());
        assertEquals(66.67, stats.getSuccessRate(), 0.01);
    }

    @Test
    public void testChickensAndAlerts() {
        tracker.startSession();

        tracker.onChicken(ChickenEvent.builder().reason("health 20%").fromState(BotState.FIGHTING).build());
        tracker.onAlert(Alert.builder()
                .severity(ErrorSeverity.CRITICAL)
                .kind(ErrorKind.PROCESS_CRASH)
                .state(BotState.RUNNING)
                .title("Engine paused")
                .message("crash")
                .build());

        SessionStats stats = tracker.snapshot();
        assertEquals(1, stats.getChickens());
        assertEquals(1, stats.getAlerts());
    }

    // ========================================================================
    // SessionStats
    // ========================================================================

    @Test
    public void testFormattedRuntime() {
        SessionStats stats = SessionStats.builder()
                .sessionStartTime(Instant.now())
                .runtimeMs(3_723_000)
                .errorsByKind(Map.of())
                .build();

        assertEquals("01:02:03", stats.getFormattedRuntime());
        assertTrue(stats.getSummary().contains("runtime=01:02:03"));
    }

    @Test
    public void testRunsPerHour() {
        SessionStats stats = SessionStats.builder()
                .sessionStartTime(Instant.now())
                .runtimeMs(1_800_000)
                .runsCompleted(9)
                .runsFailed(1)
                .errorsByKind(Map.of())
                .build();

        assertEquals(20.0, stats.getRunsPerHour(), 0.001);
    }

    @Test
    public void testToJson_WritesCounters() {
        tracker.startSession();
        tracker.onRunFinished(run(RunStatus.SUCCESS, 1000));
        tracker.onError(handled(ErrorKind.STUCK, ErrorSeverity.RECOVERABLE, ErrorSeverity.RECOVERABLE));

        JsonObject json = JsonParser.parseString(tracker.snapshot().toJson()).getAsJsonObject();

        assertEquals(1, json.get("runsCompleted").getAsInt());
        assertEquals(1, json.getAsJsonObject("errorsByKind").get("stuck").getAsLong());
        assertTrue(json.get("sessionStartTime").getAsString().endsWith("Z"));
    }
}
