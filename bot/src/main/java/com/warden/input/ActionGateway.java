package com.warden.input;

import com.warden.config.BotConfig;
import com.warden.timing.BoundedCall;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounded access to the {@link ActionPort}.
 *
 * <p>Never throws: port exceptions become {@link ActionResult#failed} and a port that
 * does not answer within the timeout becomes {@link ActionResult#timedOut}. Callers
 * decide which error event, if any, a failure turns into.
 */
@Slf4j
@Singleton
public class ActionGateway {

    private final ActionPort port;
    private final BoundedCall boundedCall;
    private final Duration defaultTimeout;

    @Inject
    public ActionGateway(ActionPort port, BoundedCall boundedCall, BotConfig config) {
        this.port = port;
        this.boundedCall = boundedCall;
        this.defaultTimeout = config.getActionTimeout();
    }

    public ActionResult perform(Action action) {
        return perform(action, defaultTimeout);
    }

    /**
     * Perform {@code action}, waiting at most {@code timeout}.
     */
    public ActionResult perform(Action action, Duration timeout) {
        log.debug("Performing {}", action);
        try {
            ActionResult result = boundedCall.call(() -> port.perform(action), timeout);
            if (result == null) {
                return ActionResult.failed("port returned no result for " + action);
            }
            if (!result.isOk()) {
                log.debug("Action {} failed: {}", action, result.getMessage());
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("Action {} timed out after {}ms", action, timeout.toMillis());
            return ActionResult.timedOut(action + " timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.failed("interrupted while performing " + action);
        } catch (BoundedCall.CallFailedException e) {
            log.warn("Action {} threw: {}", action, e.getMessage());
            return ActionResult.failed(String.valueOf(e.getMessage()));
        }
    }
}
