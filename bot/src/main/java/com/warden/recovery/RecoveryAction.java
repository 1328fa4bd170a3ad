package com.warden.recovery;

/**
 * Automatic recovery for a recoverable error kind.
 *
 * <p>Runs on the loop thread and must return within a bounded time: every input goes
 * through the {@link com.warden.input.ActionGateway} and waits are short.
 */
public interface RecoveryAction {

    String getName();

    /**
     * Try to recover.
     *
     * @param context event and collaborators
     * @return true if the recovery step was carried out; the condition itself is
     *         confirmed cleared later by the loop
     */
    boolean recover(RecoveryContext context);
}
