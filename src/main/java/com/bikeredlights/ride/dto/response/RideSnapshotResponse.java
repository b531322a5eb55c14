package com.bikeredlights.ride.dto.response;

import com.bikeredlights.ride.service.RideState;
import com.bikeredlights.ride.service.motion.GpsStatus;
import com.bikeredlights.ride.service.motion.SpeedSource;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 화면 렌더링용 현재 라이드 스냅샷 (불변).
 * 라이드가 없으면 state = IDLE, 나머지는 0/null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RideSnapshotResponse(
        String rideId,
        String name,
        RideState state,
        double movingDistanceMeters,
        long movingDurationMs,
        long pausedDurationMs,
        Long pausedElapsedMs,         // 일시정지 중일 때만: 현재 일시정지 경과
        float currentSpeedKmh,
        SpeedSource speedSource,
        boolean stationary,
        float maxSpeedKmh,
        List<double[]> simplifiedRoute,
        MapBounds bounds,
        Float bearingDegrees,         // null 이면 north-up
        GpsStatus gpsStatus,
        boolean locationAvailable,
        Long lastFixAgeMs,
        int pointCount,
        int rejectedFixCount
) {}
