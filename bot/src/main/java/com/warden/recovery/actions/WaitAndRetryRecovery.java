package com.warden.recovery.actions;

import com.warden.recovery.RecoveryAction;
import com.warden.recovery.RecoveryContext;
import com.warden.timing.DelayTimer;
import lombok.extern.slf4j.Slf4j;

/**
 * Waits {@code recoveryWait} so a screen in transition can settle, then lets the
 * loop try again on its next tick.
 */
@Slf4j
public class WaitAndRetryRecovery implements RecoveryAction {

    private final DelayTimer delayTimer;

    public WaitAndRetryRecovery(DelayTimer delayTimer) {
        this.delayTimer = delayTimer;
    }

    @Override
    public String getName() {
        return "wait-and-retry";
    }

    @Override
    public boolean recover(RecoveryContext context) {
        log.debug("Waiting {}ms before retry ({})",
                context.getConfig().getRecoveryWait().toMillis(), context.getEvent().getKind());
        return delayTimer.sleepJittered(context.getConfig().getRecoveryWait(), 0.1);
    }
}
