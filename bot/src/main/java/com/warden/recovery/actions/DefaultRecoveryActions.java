package com.warden.recovery.actions;

import com.warden.recovery.ErrorKind;
import com.warden.recovery.RecoveryCoordinator;
import com.warden.timing.DelayTimer;
import com.warden.util.Randomization;

/**
 * Installs the standard recovery for each recoverable kind.
 */
public final class DefaultRecoveryActions {

    private DefaultRecoveryActions() {
    }

    public static void install(RecoveryCoordinator coordinator, Randomization randomization, DelayTimer delayTimer) {
        WaitAndRetryRecovery waitAndRetry = new WaitAndRetryRecovery(delayTimer);
        coordinator.registerAction(ErrorKind.STUCK, new RandomEscapeRecovery(randomization, delayTimer));
        coordinator.registerAction(ErrorKind.OBSERVATION_TIMEOUT, waitAndRetry);
        coordinator.registerAction(ErrorKind.TEMPLATE_FAIL, waitAndRetry);
        coordinator.registerAction(ErrorKind.ACTION_TIMEOUT, new CancelInterfaceRecovery(delayTimer));
        coordinator.registerAction(ErrorKind.INVENTORY_FULL, new EndOfRunHandoffRecovery());
    }
}
