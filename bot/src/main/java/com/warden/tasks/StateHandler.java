package com.warden.tasks;

/**
 * Domain logic for one state (menu navigation, town chores, a farming run).
 *
 * <p>Called by the loop when a tick leaves the state unchanged. Long work must poll
 * {@link HandlerContext#currentState()} and stop once the state has moved on, since an
 * emergency exit does not wait for the handler.
 */
@FunctionalInterface
public interface StateHandler {

    /**
     * Do this state's work.
     *
     * @param ctx engine services
     * @return outcome; an exception is reported as a handler failure
     */
    RunResult handle(HandlerContext ctx) throws Exception;
}
