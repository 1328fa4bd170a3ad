package com.warden.behavior.exits;

import com.warden.behavior.ExitStrategy;
import com.warden.input.Action;
import com.warden.input.ActionGateway;
import com.warden.input.ActionResult;

import java.time.Duration;

/**
 * Finds the save-and-exit button by template and clicks it.
 */
public class TemplateExitStrategy implements ExitStrategy {

    private final String template;

    public TemplateExitStrategy(String template) {
        this.template = template;
    }

    @Override
    public String getName() {
        return "template";
    }

    @Override
    public ActionResult attempt(ActionGateway actions, Duration timeout) {
        return actions.perform(Action.templateClick(template, "save and exit"), timeout);
    }
}
