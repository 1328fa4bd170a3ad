package com.warden.status;

import com.warden.behavior.ChickenEvent;
import com.warden.recovery.RecoveryRecord;
import com.warden.state.TransitionRecord;
import com.warden.tasks.RunResult;

/**
 * Receiver of the engine's structured events. Fire-and-forget: implementations must
 * not block the caller and must not throw.
 */
public interface EventSink {

    /** Sink that ignores everything. */
    EventSink NONE = new EventSink() {
    };

    default void onTransition(TransitionRecord record) {
    }

    default void onError(RecoveryRecord record) {
    }

    default void onAlert(Alert alert) {
    }

    default void onChicken(ChickenEvent event) {
    }

    default void onRunFinished(RunResult result) {
    }
}
