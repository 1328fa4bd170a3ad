package com.warden.input;

/**
 * Input emulation seam. Implementations drive the real mouse and keyboard.
 *
 * <p>There are no rollback semantics: an action is at-most-once and may partially
 * succeed. Implementations may block; callers always go through {@link ActionGateway},
 * which bounds the wait.
 */
@FunctionalInterface
public interface ActionPort {

    ActionResult perform(Action action) throws Exception;
}
