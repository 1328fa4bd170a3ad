package com.warden.state;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * A position or activity marker used to detect lack of progress.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PositionSample {

    @Nullable
    Double x;

    @Nullable
    Double y;

    @Nullable
    String activity;

    Instant timestamp;

    public static PositionSample at(double x, double y) {
        return at(x, y, Instant.now());
    }

    public static PositionSample at(double x, double y, Instant timestamp) {
        return new PositionSample(x, y, null, timestamp);
    }

    public static PositionSample activity(String marker) {
        return activity(marker, Instant.now());
    }

    public static PositionSample activity(String marker, Instant timestamp) {
        return new PositionSample(null, null, Objects.requireNonNull(marker, "marker"), timestamp);
    }

    public boolean isPositional() {
        return x != null && y != null;
    }

    /**
     * Whether two samples describe the same place or activity.
     * Positions compare per axis against epsilon; markers compare by equality.
     * A position never matches a marker.
     *
     * @param other   the other sample
     * @param epsilon max per-axis distance
     * @return true if the samples are indistinguishable
     */
    public boolean isSimilarTo(PositionSample other, double epsilon) {
        if (isPositional() && other.isPositional()) {
            return Math.abs(x - other.x) <= epsilon && Math.abs(y - other.y) <= epsilon;
        }
        if (activity != null && other.activity != null) {
            return activity.equals(other.activity);
        }
        return false;
    }
}
