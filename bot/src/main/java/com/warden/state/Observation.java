package com.warden.state;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One discrete snapshot of the external process, as reported by the classifier.
 *
 * <p>Observations are ephemeral: the loop keeps only the latest one and nothing is
 * persisted. An observation whose label is {@link #UNKNOWN_LABEL} or whose confidence
 * is below the configured floor is treated as unknown.
 */
@Value
@Builder
public class Observation {

    public static final String UNKNOWN_LABEL = "unknown";

    public static final String HEALTH = "health";
    public static final String MANA = "mana";
    public static final String POSITION_X = "position.x";
    public static final String POSITION_Y = "position.y";

    /** Classifier label, e.g. "in_town", "death". */
    String label;

    /** Classifier confidence in [0, 1]. */
    double confidence;

    @Builder.Default
    Instant timestamp = Instant.now();

    /** Numeric readouts such as health percent and position. */
    @Singular
    Map<String, Double> readouts;

    /** Optional activity marker used for stuck detection when no position is available. */
    @Nullable
    String activity;

    /**
     * An observation carrying no information.
     *
     * @return unknown observation stamped now
     */
    public static Observation unknown() {
        return Observation.builder()
                .label(UNKNOWN_LABEL)
                .confidence(0.0)
                .build();
    }

    /**
     * Whether this observation can be acted on.
     *
     * @param confidenceFloor minimum confidence
     * @return false for the unknown label or low confidence
     */
    public boolean isKnown(double confidenceFloor) {
        return label != null
                && !UNKNOWN_LABEL.equals(label)
                && confidence >= confidenceFloor;
    }

    public OptionalDouble getReadout(String name) {
        Double value = readouts.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public OptionalDouble getHealthPercent() {
        return getReadout(HEALTH);
    }

    public OptionalDouble getManaPercent() {
        return getReadout(MANA);
    }

    /**
     * Extract a stuck-detection sample.
     *
     * @return position sample if both coordinates are present, else activity sample, else empty
     */
    public Optional<PositionSample> toPositionSample() {
        Double x = readouts.get(POSITION_X);
        Double y = readouts.get(POSITION_Y);
        if (x != null && y != null) {
            return Optional.of(PositionSample.at(x, y, timestamp));
        }
        if (activity != null) {
            return Optional.of(PositionSample.activity(activity, timestamp));
        }
        return Optional.empty();
    }
}
