package com.warden.recovery.actions;

import com.warden.config.BotConfig;
import com.warden.input.Action;
import com.warden.input.ActionResult;
import com.warden.recovery.RecoveryAction;
import com.warden.recovery.RecoveryContext;
import com.warden.timing.DelayTimer;
import com.warden.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Stuck recovery: click a random point inside the configured escape region so the
 * character moves somewhere else, then give it a moment to walk.
 */
@Slf4j
public class RandomEscapeRecovery implements RecoveryAction {

    private static final Duration SETTLE = Duration.ofMillis(500);

    private final Randomization randomization;
    private final DelayTimer delayTimer;

    public RandomEscapeRecovery(Randomization randomization, DelayTimer delayTimer) {
        this.randomization = randomization;
        this.delayTimer = delayTimer;
    }

    @Override
    public String getName() {
        return "random-escape";
    }

    @Override
    public boolean recover(RecoveryContext context) {
        BotConfig config = context.getConfig();
        int x = randomization.uniformRandomInt(config.getEscapeMinX(), config.getEscapeMaxX());
        int y = randomization.uniformRandomInt(config.getEscapeMinY(), config.getEscapeMaxY());
        log.info("Escaping towards ({}, {})", x, y);

        ActionResult result = context.getActions().perform(Action.click(x, y, "stuck escape"));
        if (!result.isOk()) {
            return false;
        }
        return delayTimer.sleepJittered(SETTLE, 0.2);
    }
}
