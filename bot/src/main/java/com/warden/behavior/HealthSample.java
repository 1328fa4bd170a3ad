package com.warden.behavior;

import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;

/**
 * One reading taken by the health controller.
 */
@Value
public class HealthSample {

    @Nullable
    Double healthPercent;

    @Nullable
    Double manaPercent;

    HealthStatus status;

    Instant timestamp;
}
