package com.bikeredlights.ride.service.motion;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 위치 소스가 ~1초마다 내보내는 원시 GPS fix. 생성 후 불변.
 *
 * @param reportedSpeedMps   GPS 보고 속도 (없으면 null)
 * @param reportedBearingDeg GPS 보고 방위각 (없으면 null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationFix(
        double latitude,
        double longitude,
        float accuracyMeters,
        long timestampMs,
        Float reportedSpeedMps,
        Float reportedBearingDeg
) {
    public static LocationFix of(double latitude, double longitude, long timestampMs) {
        return new LocationFix(latitude, longitude, 5.0f, timestampMs, null, null);
    }

    public double[] toLatLon() {
        return new double[]{latitude, longitude};
    }
}
