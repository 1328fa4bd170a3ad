package com.warden.recovery.actions;

import com.warden.recovery.RecoveryAction;
import com.warden.recovery.RecoveryContext;
import com.warden.state.BotState;
import com.warden.state.BotStateMachine;
import com.warden.state.TransitionPriority;
import com.warden.state.TransitionResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Inventory-full recovery: hand off to inventory management. During a run this asks to
 * return to town; in town it goes straight to managing the inventory.
 */
@Slf4j
public class EndOfRunHandoffRecovery implements RecoveryAction {

    @Override
    public String getName() {
        return "end-of-run-handoff";
    }

    @Override
    public boolean recover(RecoveryContext context) {
        BotStateMachine stateMachine = context.getStateMachine();
        BotState current = stateMachine.currentState();
        BotState target;
        if (current.isRunPhase()) {
            target = BotState.RETURNING;
        } else if (current.isTownPhase()) {
            target = BotState.MANAGING_INVENTORY;
        } else {
            log.warn("Inventory full in {}, no handoff possible", current);
            return false;
        }
        if (current == target) {
            return true;
        }
        if (!stateMachine.getGraph().contains(current, target)) {
            log.warn("Inventory full in {}, cannot hand off to {} from here", current, target);
            return false;
        }

        TransitionResult result = stateMachine.requestTransition(target, TransitionPriority.NORMAL, "recovery");
        if (result.isRejected()) {
            log.warn("Inventory handoff {} -> {} rejected: {}", current, target, result.getRejection());
            return false;
        }
        return true;
    }
}
