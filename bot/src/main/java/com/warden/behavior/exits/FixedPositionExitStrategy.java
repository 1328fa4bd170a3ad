package com.warden.behavior.exits;

import com.warden.behavior.ExitStrategy;
import com.warden.input.Action;
import com.warden.input.ActionGateway;
import com.warden.input.ActionResult;

import java.time.Duration;

/**
 * Clicks where the save-and-exit button normally sits, for when the template is not found.
 */
public class FixedPositionExitStrategy implements ExitStrategy {

    private final int x;
    private final int y;

    public FixedPositionExitStrategy(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public String getName() {
        return "fixed-position";
    }

    @Override
    public ActionResult attempt(ActionGateway actions, Duration timeout) {
        return actions.perform(Action.click(x, y, "save and exit (fixed)"), timeout);
    }
}
