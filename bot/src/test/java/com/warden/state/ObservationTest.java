package com.warden.state;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for Observation and PositionSample.
 */
public class ObservationTest {

    @Test
    public void testIsKnown_ConfidenceFloor() {
        Observation obs = Observation.builder().label("in_town").confidence(0.59).build();

        assertFalse(obs.isKnown(0.6));
        assertTrue(obs.isKnown(0.5));
    }

    @Test
    public void testIsKnown_UnknownLabel_NeverKnown() {
        Observation obs = Observation.builder().label(Observation.UNKNOWN_LABEL).confidence(1.0).build();

        assertFalse(obs.isKnown(0.0));
        assertFalse(Observation.unknown().isKnown(0.0));
    }

    @Test
    public void testReadouts_MissingAreEmpty() {
        Observation obs = Observation.builder().label("running").confidence(0.9)
                .readout(Observation.HEALTH, 55.0).build();

        assertEquals(55.0, obs.getHealthPercent().getAsDouble(), 0.001);
        assertFalse(obs.getManaPercent().isPresent());
    }

    @Test
    public void testToPositionSample_PrefersCoordinates() {
        Observation obs = Observation.builder().label("running").confidence(0.9)
                .readout(Observation.POSITION_X, 10.0)
                .readout(Observation.POSITION_Y, 20.0)
                .activity("walking")
                .build();

        PositionSample sample = obs.toPositionSample().orElseThrow();
        assertTrue(sample.isPositional());
        assertEquals(10.0, sample.getX(), 0.001);
    }

    @Test
    public void testToPositionSample_FallsBackToActivity() {
        Observation obs = Observation.builder().label("running").confidence(0.9)
                .readout(Observation.POSITION_X, 10.0)
                .activity("casting")
                .build();

        PositionSample sample = obs.toPositionSample().orElseThrow();
        assertFalse(sample.isPositional());
        assertEquals("casting", sample.getActivity());
        assertFalse(Observation.unknown().toPositionSample().isPresent());
    }

    @Test
    public void testIsSimilarTo_PerAxisEpsilon() {
        PositionSample a = PositionSample.at(100, 100);

        assertTrue(a.isSimilarTo(PositionSample.at(110, 90), 10));
        assertFalse(a.isSimilarTo(PositionSample.at(111, 100), 10));
        assertFalse(a.isSimilarTo(PositionSample.activity("walking"), 10));
    }
}
