package com.bikeredlights.ride.service.motion;

import com.bikeredlights.ride.config.RideTrackingProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocationFixValidatorTest {

    private static final long T0 = 1_700_000_000_000L;

    private final LocationFixValidator validator = new LocationFixValidator(new RideTrackingProperties());

    private static LocationFix fix(double lat, double lon, float acc, long ts, Float speed, Float bearing) {
        return new LocationFix(lat, lon, acc, ts, speed, bearing);
    }

    @Test
    void validFix_isAccepted() {
        LocationFix f = fix(37.7749, -122.4194, 5f, T0, 3f, 90f);

        FixValidation v = validator.validate(f, null);

        assertTrue(v.isAccepted());
        assertSame(f, v.fix());
        assertNull(v.reason());
    }

    @Test
    void coordinatesOutOfRange_areRejected() {
        assertEquals(RejectReason.LATITUDE_OUT_OF_RANGE,
                validator.validate(fix(90.5, 0, 5f, T0, null, null), null).reason());
        assertEquals(RejectReason.LATITUDE_OUT_OF_RANGE,
                validator.validate(fix(Double.NaN, 0, 5f, T0, null, null), null).reason());
        assertEquals(RejectReason.LONGITUDE_OUT_OF_RANGE,
                validator.validate(fix(0, -180.01, 5f, T0, null, null), null).reason());
    }

    @Test
    void boundaryCoordinates_areAccepted() {
        assertTrue(validator.validate(fix(90, 180, 5f, T0, null, null), null).isAccepted());
        assertTrue(validator.validate(fix(-90, -180, 5f, T0, null, null), null).isAccepted());
    }

    @Test
    void accuracy_negativeOrTooCoarse_isRejected() {
        assertEquals(RejectReason.NEGATIVE_ACCURACY,
                validator.validate(fix(0, 0, -1f, T0, null, null), null).reason());
        assertEquals(RejectReason.ACCURACY_TOO_LOW,
                validator.validate(fix(0, 0, 50.5f, T0, null, null), null).reason());
        assertTrue(validator.validate(fix(0, 0, 50f, T0, null, null), null).isAccepted());
    }

    @Test
    void timestamp_nonPositiveOrNotIncreasing_isRejected() {
        LocationFix previous = fix(0, 0, 5f, T0, null, null);

        assertEquals(RejectReason.NON_POSITIVE_TIMESTAMP,
                validator.validate(fix(0, 0, 5f, 0, null, null), null).reason());
        assertEquals(RejectReason.OUT_OF_ORDER,
                validator.validate(fix(0, 0, 5f, T0, null, null), previous).reason());
        assertEquals(RejectReason.OUT_OF_ORDER,
                validator.validate(fix(0, 0, 5f, T0 - 1000, null, null), previous).reason());
        assertTrue(validator.validate(fix(0, 0, 5f, T0 + 1, null, null), previous).isAccepted());
    }

    @Test
    void optionalFields_outOfRange_areRejected() {
        assertEquals(RejectReason.INVALID_SPEED,
                validator.validate(fix(0, 0, 5f, T0, -0.1f, null), null).reason());
        assertEquals(RejectReason.INVALID_BEARING,
                validator.validate(fix(0, 0, 5f, T0, null, 360f), null).reason());
        assertEquals(RejectReason.INVALID_BEARING,
                validator.validate(fix(0, 0, 5f, T0, null, -1f), null).reason());
    }
}
