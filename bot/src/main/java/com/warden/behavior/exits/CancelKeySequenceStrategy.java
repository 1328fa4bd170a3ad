package com.warden.behavior.exits;

import com.warden.behavior.ExitStrategy;
import com.warden.input.Action;
import com.warden.input.ActionGateway;
import com.warden.input.ActionResult;

import java.time.Duration;

/**
 * Last resort: press the cancel key repeatedly to open the game menu and confirm exit.
 */
public class CancelKeySequenceStrategy implements ExitStrategy {

    private final String key;
    private final int repeats;

    public CancelKeySequenceStrategy(String key, int repeats) {
        this.key = key;
        this.repeats = repeats;
    }

    @Override
    public String getName() {
        return "cancel-keys";
    }

    @Override
    public ActionResult attempt(ActionGateway actions, Duration timeout) {
        return actions.perform(Action.keySequence(key, repeats, "menu exit"), timeout);
    }
}
