package com.warden.status;

import com.warden.behavior.ChickenEvent;
import com.warden.recovery.RecoveryRecord;
import com.warden.state.TransitionRecord;
import com.warden.tasks.RunResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes engine events to the {@code warden.events} logger.
 */
@Slf4j(topic = "warden.events")
public class LoggingEventSink implements EventSink {

    @Override
    public void onTransition(TransitionRecord record) {
        if (record.isAccepted()) {
            log.debug("transition {}", record);
        } else if (record.getRejection() != null && record.getRejection().isInvalidTransition()) {
            log.warn("invalid transition {}", record);
        } else {
            log.debug("transition {}", record);
        }
    }

    @Override
    public void onError(RecoveryRecord record) {
        switch (record.getSeverity()) {
            case CRITICAL:
                log.error("error {}", record);
                break;
            case RUN_ENDING:
                log.warn("error {}", record);
                break;
            default:
                log.info("error {}", record);
                break;
        }
    }

    @Override
    public void onAlert(Alert alert) {
        log.error("ALERT {}", alert);
    }

    @Override
    public void onChicken(ChickenEvent event) {
        log.warn("{}", event);
    }

    @Override
    public void onRunFinished(RunResult result) {
        log.info("run finished {}", result);
    }
}
