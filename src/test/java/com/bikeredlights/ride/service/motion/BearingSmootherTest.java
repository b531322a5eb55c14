package com.bikeredlights.ride.service.motion;

import com.bikeredlights.ride.config.RideTrackingProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BearingSmootherTest {

    private static final long T0 = 1_700_000_000_000L;

    private final BearingSmoother smoother = new BearingSmoother(new RideTrackingProperties());

    private static LocationFix heading(float deg, long ts) {
        return new LocationFix(37.0, -122.0, 5f, ts, null, deg);
    }

    @Test
    void reportedBearing_isAdopted() {
        BearingEstimate e = smoother.update(heading(123f, T0), null, BearingEstimate.NONE);

        assertEquals(123f, e.degrees());
        assertEquals(T0, e.lastUpdatedMs());
    }

    @Test
    void withoutReportedBearing_headingIsDerivedFromMovement() {
        LocationFix prev = LocationFix.of(37.0, -122.0, T0);
        LocationFix east = LocationFix.of(37.0, -121.999, T0 + 1000);

        BearingEstimate e = smoother.update(east, prev, BearingEstimate.NONE);

        assertNotNull(e.degrees());
        assertEquals(90f, e.degrees(), 0.1f);
    }

    @Test
    void pointsCloserThanOneMeter_keepPreviousEstimate() {
        BearingEstimate prevEstimate = new BearingEstimate(45f, T0);
        LocationFix prev = LocationFix.of(37.0, -122.0, T0);
        LocationFix jitter = LocationFix.of(37.000001, -122.0, T0 + 1000); // ~0.1m

        BearingEstimate e = smoother.update(jitter, prev, prevEstimate);

        assertSame(prevEstimate, e);
    }

    @Test
    void changesWithinDebounce_keepValueButRefreshTimestamp() {
        BearingEstimate first = smoother.update(heading(90f, T0), null, BearingEstimate.NONE);

        BearingEstimate small = smoother.update(heading(94f, T0 + 1000), null, first);
        assertEquals(90f, small.degrees());
        assertEquals(T0 + 1000, small.lastUpdatedMs());

        BearingEstimate big = smoother.update(heading(96f, T0 + 2000), null, small);
        assertEquals(96f, big.degrees());
    }

    @Test
    void debounce_usesCircularDifference() {
        BearingEstimate first = smoother.update(heading(358f, T0), null, BearingEstimate.NONE);

        BearingEstimate e = smoother.update(heading(2f, T0 + 1000), null, first);

        assertEquals(358f, e.degrees());
    }

    @Test
    void jumpLargerThan180_isAccepted() {
        BearingEstimate first = smoother.update(heading(10f, T0), null, BearingEstimate.NONE);

        BearingEstimate e = smoother.update(heading(200f, T0 + 1000), null, first);

        assertEquals(200f, e.degrees());
    }

    @Test
    void estimate_becomesStaleAfter45Seconds() {
        BearingEstimate e = new BearingEstimate(180f, T0);

        assertEquals(180f, smoother.current(e, T0 + 45_000).degrees());
        assertNull(smoother.current(e, T0 + 45_001).degrees());
        assertFalse(smoother.current(null, T0).isPresent());
    }

    @Test
    void staleEstimateWithoutNewHeading_isReleased() {
        BearingEstimate old = new BearingEstimate(180f, T0);
        LocationFix noHeading = LocationFix.of(37.0, -122.0, T0 + 60_000);

        BearingEstimate e = smoother.update(noHeading, null, old);

        assertNull(e.degrees());
    }
}
