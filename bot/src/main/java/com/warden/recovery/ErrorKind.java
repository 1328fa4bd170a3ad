package com.warden.recovery;

import com.warden.state.BotState;
import lombok.Getter;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Raw failure signals. The severity of each kind is data held by {@link SeverityTable};
 * this enum only names the signal and the state a run ends in when the kind ends it.
 */
@Getter
public enum ErrorKind {

    STUCK("stuck"),
    OBSERVATION_TIMEOUT("observation-timeout"),
    ACTION_TIMEOUT("action-timeout"),
    INVENTORY_FULL("inventory-full"),
    TEMPLATE_FAIL("template-fail"),
    CHARACTER_DEATH("character-death", BotState.DEAD),
    DISCONNECT("disconnect", BotState.DISCONNECTED),
    UNKNOWN_STATE("unknown-state"),
    RUN_TIMEOUT("run-timeout"),
    HANDLER_FAILURE("handler-failure"),
    EXIT_ATTEMPT_FAILED("exit-attempt-failed"),
    EXIT_EXHAUSTED("exit-exhausted"),
    PROCESS_CRASH("process-crash");

    private static final Map<String, ErrorKind> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ErrorKind::getCode, Function.identity()));

    /** Stable external name, used in configuration. */
    private final String code;

    /** State a run is ended in when this kind ends it. */
    private final BotState runEndState;

    ErrorKind(String code) {
        this(code, BotState.CHICKENED);
    }

    ErrorKind(String code, BotState runEndState) {
        this.code = code;
        this.runEndState = runEndState;
    }

    public static Optional<ErrorKind> fromCode(String code) {
        return Optional.ofNullable(code == null ? null : BY_CODE.get(code.trim().toLowerCase()));
    }

    @Override
    public String toString() {
        return code;
    }
}
