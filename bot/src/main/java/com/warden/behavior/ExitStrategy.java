package com.warden.behavior;

import com.warden.behavior.exits.CancelKeySequenceStrategy;
import com.warden.behavior.exits.FixedPositionExitStrategy;
import com.warden.behavior.exits.TemplateExitStrategy;
import com.warden.config.BotConfig;
import com.warden.input.ActionGateway;
import com.warden.input.ActionResult;

import java.time.Duration;
import java.util.List;

/**
 * One way of leaving the game session after a chicken. Strategies are tried in order
 * until one succeeds.
 */
public interface ExitStrategy {

    String getName();

    /**
     * Try to leave the game, waiting at most {@code timeout} on the action port.
     */
    ActionResult attempt(ActionGateway actions, Duration timeout);

    /**
     * The standard fallback order: template exit, fixed-position click, then the
     * repeated cancel key.
     */
    static List<ExitStrategy> standard(BotConfig config) {
        return List.of(
                new TemplateExitStrategy(config.getExitTemplate()),
                new FixedPositionExitStrategy(config.getSaveExitButtonX(), config.getSaveExitButtonY()),
                new CancelKeySequenceStrategy(config.getCancelKey(), config.getCancelKeyRepeats()));
    }
}
