package com.warden.tasks;

import com.warden.state.BotState;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps states to their handlers. States without a handler are simply waited in.
 */
@Slf4j
@Singleton
public class HandlerRegistry {

    private final Map<BotState, StateHandler> handlers = Collections.synchronizedMap(new EnumMap<>(BotState.class));

    public void register(BotState state, StateHandler handler) {
        StateHandler previous = handlers.put(state, handler);
        if (previous != null) {
            log.debug("Replaced handler for {}", state);
        }
    }

    public void unregister(BotState state) {
        handlers.remove(state);
    }

    public Optional<StateHandler> get(BotState state) {
        return Optional.ofNullable(handlers.get(state));
    }

    public boolean has(BotState state) {
        return handlers.containsKey(state);
    }

    public int size() {
        return handlers.size();
    }
}
