package com.warden.recovery.actions;

import com.warden.input.Action;
import com.warden.input.ActionResult;
import com.warden.recovery.RecoveryAction;
import com.warden.recovery.RecoveryContext;
import com.warden.timing.DelayTimer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Action-timeout recovery: press the cancel key to close whatever interface may be
 * swallowing input, then pause briefly.
 */
@Slf4j
public class CancelInterfaceRecovery implements RecoveryAction {

    private static final Duration SETTLE = Duration.ofMillis(500);

    private final DelayTimer delayTimer;

    public CancelInterfaceRecovery(DelayTimer delayTimer) {
        this.delayTimer = delayTimer;
    }

    @Override
    public String getName() {
        return "cancel-interface";
    }

    @Override
    public boolean recover(RecoveryContext context) {
        String key = context.getConfig().getCancelKey();
        ActionResult result = context.getActions().perform(Action.key(key, "close interface"));
        if (!result.isOk()) {
            log.warn("Cancel key failed: {}", result.getMessage());
            return false;
        }
        return delayTimer.sleep(SETTLE);
    }
}
