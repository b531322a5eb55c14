package com.bikeredlights.ride.service;

import com.bikeredlights.ride.config.RideTrackingProperties;
import com.bikeredlights.ride.dto.response.RideSnapshotResponse;
import com.bikeredlights.ride.service.motion.BearingEstimate;
import com.bikeredlights.ride.service.motion.BearingSmoother;
import com.bikeredlights.ride.service.motion.GpsStatus;
import com.bikeredlights.ride.service.motion.LocationFix;
import com.bikeredlights.ride.service.motion.SpeedSample;
import com.bikeredlights.ride.service.motion.SpeedSource;
import com.bikeredlights.ride.util.RouteGeometry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * RideSession → 화면용 스냅샷.
 * 실시간 경로 단순화 결과는 (rideId, pointCount, tolerance) 가 같으면 재사용한다.
 */
@Component
@RequiredArgsConstructor
public class RideSnapshotAssembler {

    private final BearingSmoother bearingSmoother;
    private final RideTrackingProperties props;

    private RouteCacheKey cachedKey;
    private List<double[]> cachedRoute = List.of();

    private record RouteCacheKey(String rideId, int pointCount, double toleranceMeters) {}

    public synchronized RideSnapshotResponse assemble(RideSession session, boolean locationAvailable, long nowMs) {
        if (session == null) {
            return idle(locationAvailable);
        }

        List<double[]> route = simplifiedRoute(session);

        SpeedSample speed = session.getLastSpeed();
        LocationFix lastFix = session.getLastAcceptedFix();
        Long receivedAt = session.getLastFixReceivedAtMs();
        Long lastFixAge = receivedAt != null ? Math.max(0L, nowMs - receivedAt) : null;
        // 방향 갱신 시각은 기기 시계 기준이므로 만료 판정도 기기 시계로 환산해서 한다
        BearingEstimate bearing = lastFix != null && lastFixAge != null
                ? bearingSmoother.current(session.getBearing(), lastFix.timestampMs() + lastFixAge)
                : BearingEstimate.NONE;

        Long pausedElapsed = null;
        if (session.getState().isPaused() && session.getCurrentPauseStartMs() != null) {
            pausedElapsed = Math.max(0L, nowMs - session.getCurrentPauseStartMs());
        }

        return new RideSnapshotResponse(
                session.getRideId(),
                session.getName(),
                session.getState(),
                session.getMovingDistanceMeters(),
                session.getMovingDurationMs(),
                session.getPausedDurationMs(),
                pausedElapsed,
                speed != null ? speed.speedKmh() : 0f,
                speed != null ? speed.source() : SpeedSource.UNKNOWN,
                speed == null || speed.stationary(),
                session.getMaxSpeedKmh(),
                route,
                RouteGeometry.bounds(route),
                bearing.degrees(),
                GpsStatus.of(lastFix, receivedAt, locationAvailable, nowMs, props),
                locationAvailable,
                lastFixAge,
                session.getPointCount(),
                session.getRejectedFixCount()
        );
    }

    private List<double[]> simplifiedRoute(RideSession session) {
        RouteCacheKey key = new RouteCacheKey(session.getRideId(), session.getPointCount(),
                props.getSimplifyToleranceM());
        if (!key.equals(cachedKey)) {
            // 스냅샷끼리 같은 리스트를 공유하므로 읽기 전용으로 보관
            cachedRoute = List.copyOf(RouteGeometry.simplify(session.pointsAsLatLon(),
                    props.getSimplifyToleranceM(), props.getMaxSimplifyPoints()));
            cachedKey = key;
        }
        return cachedRoute;
    }

    private RideSnapshotResponse idle(boolean locationAvailable) {
        return new RideSnapshotResponse(
                null, null, RideState.IDLE,
                0.0, 0L, 0L, null,
                0f, SpeedSource.UNKNOWN, true, 0f,
                List.of(), null, null,
                locationAvailable ? GpsStatus.ACQUIRING : GpsStatus.UNAVAILABLE,
                locationAvailable, null, 0, 0
        );
    }
}
