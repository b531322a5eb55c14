package com.bikeredlights.ride.service.motion;

import com.bikeredlights.ride.util.GeoUtils;
import org.springframework.stereotype.Component;

/**
 * 속도/정지 추정.
 *
 * 우선순위:
 * 1) GPS 보고 속도 (> 0)
 * 2) 직전 fix 와의 하버사인 거리 / 경과 시간
 * 3) 0 (UNKNOWN)
 *
 * 이후 0~100 km/h 로 클램프하고, 1 km/h 미만은 정지(0 km/h)로 본다.
 * 두 입력 fix 외의 숨은 상태 없음.
 */
@Component
public class SpeedEstimator {

    /** 100 km/h 상한 (비현실적 값 필터) */
    public static final float MAX_SPEED_MPS = 100f / 3.6f;

    /** 1 km/h 미만은 GPS 지터로 보고 정지 처리 */
    public static final float STATIONARY_THRESHOLD_MPS = 1f / 3.6f;

    public SpeedSample estimate(LocationFix current, LocationFix previous) {
        float speedMs;
        SpeedSource source;

        Float reported = current.reportedSpeedMps();
        if (reported != null && reported > 0f) {
            speedMs = reported;
            source = SpeedSource.GPS;
        } else if (previous != null) {
            double elapsedSec = (current.timestampMs() - previous.timestampMs()) / 1000.0;
            if (elapsedSec > 0) {
                double meters = GeoUtils.haversine(
                        previous.latitude(), previous.longitude(),
                        current.latitude(), current.longitude());
                speedMs = (float) (meters / elapsedSec);
                source = SpeedSource.DERIVED;
            } else {
                speedMs = 0f;
                source = SpeedSource.UNKNOWN;
            }
        } else {
            speedMs = 0f;
            source = SpeedSource.UNKNOWN;
        }

        float clamped = Math.max(0f, Math.min(speedMs, MAX_SPEED_MPS));
        boolean stationary = clamped < STATIONARY_THRESHOLD_MPS;
        float kmh = stationary ? 0f : clamped * 3.6f;

        return new SpeedSample(kmh, current.timestampMs(), source, stationary);
    }
}
