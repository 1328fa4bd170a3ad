package com.warden.recovery;

import com.warden.config.BotConfig;
import com.warden.input.ActionGateway;
import com.warden.state.BotStateMachine;
import lombok.Value;

/**
 * What a recovery action may use while handling one event.
 */
@Value
public class RecoveryContext {

    ErrorEvent event;
    BotStateMachine stateMachine;
    ActionGateway actions;
    BotConfig config;
}
