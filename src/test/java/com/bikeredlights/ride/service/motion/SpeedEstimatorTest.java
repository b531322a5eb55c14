package com.bikeredlights.ride.service.motion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpeedEstimatorTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final float DELTA = 0.01f;

    private final SpeedEstimator estimator = new SpeedEstimator();

    private static LocationFix withSpeed(float mps, long ts) {
        return new LocationFix(37.0, -122.0, 5f, ts, mps, null);
    }

    @Test
    void reportedGpsSpeed_isUsed() {
        SpeedSample s = estimator.estimate(withSpeed(10f, T0), null);

        assertEquals(36f, s.speedKmh(), DELTA);
        assertEquals(SpeedSource.GPS, s.source());
        assertFalse(s.stationary());
        assertEquals(T0, s.timestampMs());
    }

    @Test
    void zeroReportedSpeed_fallsBackToDerived() {
        LocationFix prev = LocationFix.of(37.0, -122.0, T0);
        LocationFix cur = new LocationFix(37.0009, -122.0, 5f, T0 + 10_000, 0f, null);

        SpeedSample s = estimator.estimate(cur, prev);

        assertEquals(SpeedSource.DERIVED, s.source());
        assertTrue(s.speedKmh() > 30f);
    }

    @Test
    void derivedSpeed_hundredMetersInTenSeconds_is36Kmh() {
        // 위도 0.000899322도 ≈ 100m
        LocationFix prev = LocationFix.of(0.0, 0.0, T0);
        LocationFix cur = LocationFix.of(0.000899322, 0.0, T0 + 10_000);

        SpeedSample s = estimator.estimate(cur, prev);

        assertEquals(36f, s.speedKmh(), 0.05f);
        assertEquals(SpeedSource.DERIVED, s.source());
    }

    @Test
    void derivedSpeed_zeroElapsed_isUnknownZero() {
        LocationFix prev = LocationFix.of(0.0, 0.0, T0);
        LocationFix cur = LocationFix.of(0.001, 0.0, T0);

        SpeedSample s = estimator.estimate(cur, prev);

        assertEquals(0f, s.speedKmh());
        assertEquals(SpeedSource.UNKNOWN, s.source());
        assertTrue(s.stationary());
    }

    @Test
    void noReportedSpeedAndNoPrevious_isUnknownZero() {
        SpeedSample s = estimator.estimate(LocationFix.of(0.0, 0.0, T0), null);

        assertEquals(0f, s.speedKmh());
        assertEquals(SpeedSource.UNKNOWN, s.source());
        assertTrue(s.stationary());
    }

    @Test
    void belowOneKmh_isStationaryAndReportsZero() {
        SpeedSample s = estimator.estimate(withSpeed(0.2f, T0), null); // 0.72 km/h

        assertTrue(s.stationary());
        assertEquals(0f, s.speedKmh());
        assertEquals(SpeedSource.GPS, s.source());
    }

    @Test
    void aboveHundredKmh_isClamped() {
        SpeedSample s = estimator.estimate(withSpeed(50f, T0), null); // 180 km/h

        assertEquals(100f, s.speedKmh(), DELTA);
        assertFalse(s.stationary());
    }
}
