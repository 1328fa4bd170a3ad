package com.warden.state;

/**
 * Entry/exit callback for a state.
 *
 * <p>Hooks run inside a transition and must be short and non-blocking; multi-step
 * work belongs in a {@code StateHandler}. An exit hook may run more than once for
 * the same departure if a preemptive request supersedes the first attempt, so exit
 * hooks must be idempotent.
 */
public interface StateHook {

    default void onEnter(BotState from, BotState to) {
    }

    default void onExit(BotState from, BotState to) {
    }
}
