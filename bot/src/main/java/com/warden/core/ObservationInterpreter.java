package com.warden.core;

import com.warden.config.BotConfig;
import com.warden.recovery.ErrorKind;
import com.warden.state.Observation;
import com.warden.state.PositionSample;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads meaning out of an observation: whether it can be trusted, whether its label is a
 * fault, and what it says about movement.
 */
@Singleton
public class ObservationInterpreter {

    private final double confidenceFloor;
    private final Map<String, ErrorKind> faultLabels = new LinkedHashMap<>();

    @Inject
    public ObservationInterpreter(BotConfig config) {
        this.confidenceFloor = config.getConfidenceFloor();
        config.getFaultLabels().forEach((label, code) ->
                faultLabels.put(label, ErrorKind.fromCode(code)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown error kind " + code))));
    }

    /**
     * False for the unknown label and for anything below the confidence floor.
     */
    public boolean isKnown(Observation observation) {
        return observation.isKnown(confidenceFloor);
    }

    /**
     * Error kind signalled by the label, if it is a configured fault label and the
     * observation is trusted.
     */
    public Optional<ErrorKind> faultFor(Observation observation) {
        if (!isKnown(observation)) {
            return Optional.empty();
        }
        return Optional.ofNullable(faultLabels.get(observation.getLabel()));
    }

    public Optional<PositionSample> progressSample(Observation observation) {
        return observation.toPositionSample();
    }

    /**
     * Fault labels grouped by kind, for diagnostics.
     */
    public Map<ErrorKind, String> describeFaults() {
        Map<ErrorKind, String> byKind = new EnumMap<>(ErrorKind.class);
        faultLabels.forEach((label, kind) -> byKind.merge(kind, label, (a, b) -> a + "," + b));
        return byKind;
    }

    public double getConfidenceFloor() {
        return confidenceFloor;
    }
}
