package com.warden.status;

import com.warden.behavior.ChickenEvent;
import com.warden.recovery.RecoveryRecord;
import com.warden.state.BotState;
import com.warden.state.TransitionRecord;
import com.warden.tasks.RunResult;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates in-memory session statistics from the engine's events.
 * Nothing is persisted.
 */
@Slf4j
@Singleton
public class SessionTracker implements EventSink {

    private Instant sessionStart;
    private int runsCompleted;
    private int runsFailed;
    private int chickens;
    private int deaths;
    private int escalations;
    private int alerts;
    private long transitions;
    private long invalidTransitions;
    private long totalRunTimeMs;
    private final Map<String, Long> errorsByKind = new LinkedHashMap<>();

    public synchronized void startSession() {
        sessionStart = Instant.now();
        log.info("Session started");
    }

    public synchronized boolean isSessionActive() {
        return sessionStart != null;
    }

    @Override
    public synchronized void onTransition(TransitionRecord record) {
        if (record.isAccepted()) {
            transitions++;
            if (record.getTo() == BotState.DEAD) {
                deaths++;
            }
        } else if (record.getRejection() != null && record.getRejection().isInvalidTransition()) {
            invalidTransitions++;
        }
    }

    @Override
    public synchronized void onError(RecoveryRecord record) {
        errorsByKind.merge(record.getKind().getCode(), 1L, Long::sum);
        if (record.isEscalated()) {
            escalations++;
        }
    }

    @Override
    public synchronized void onAlert(Alert alert) {
        alerts++;
    }

    @Override
    public synchronized void onChicken(ChickenEvent event) {
        chickens++;
    }

    @Override
    public synchronized void onRunFinished(RunResult result) {
        if (!result.isRun()) {
            return;
        }
        if (result.isSuccess()) {
            runsCompleted++;
        } else {
            runsFailed++;
        }
        totalRunTimeMs += result.getDuration().toMillis();
    }

    /**
     * Snapshot of everything counted so far.
     */
    public synchronized SessionStats snapshot() {
        if (sessionStart == null) {
            return SessionStats.EMPTY;
        }
        return SessionStats.builder()
                .sessionStartTime(sessionStart)
                .runtimeMs(Duration.between(sessionStart, Instant.now()).toMillis())
                .runsCompleted(runsCompleted)
                .runsFailed(runsFailed)
                .chickens(chickens)
                .deaths(deaths)
                .escalations(escalations)
                .alerts(alerts)
                .transitions(transitions)
                .invalidTransitions(invalidTransitions)
                .totalRunTimeMs(totalRunTimeMs)
                .errorsByKind(Map.copyOf(errorsByKind))
                .build();
    }
}
