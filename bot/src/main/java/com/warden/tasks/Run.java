package com.warden.tasks;

/**
 * One kind of farming run. The engine only knows this capability; each run kind is a
 * separate implementation.
 */
public interface Run {

    String getName();

    /**
     * Execute the run from start to finish. Blocks the loop thread until done, so it
     * must poll the state and stop when the run is no longer active.
     */
    RunResult execute(HandlerContext ctx);
}
