package com.bikeredlights.ride.service.motion;

import com.bikeredlights.ride.config.RideTrackingProperties;
import com.bikeredlights.ride.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 진행 방향 추출/디바운스/만료.
 *
 * - GPS 보고 방위각이 있으면 그대로 채택
 * - 없으면 직전 fix → 현재 fix 벡터로 계산 (두 점이 1m 이상 떨어져 있을 때만)
 * - 둘 다 없으면 이전 추정 유지
 * - 마지막으로 내보낸 값과 debounce 각도 이하 차이면 값은 그대로 두고 시각만 갱신
 * - bearingStaleMs 동안 갱신이 없으면 null 로 해제
 *
 * 180도 이상 급변도 노이즈로 버리지 않는다 (디바운스/만료 규칙만 적용).
 */
@Component
@RequiredArgsConstructor
public class BearingSmoother {

    // 이보다 가까운 두 점으로는 방향을 계산하지 않음 (정지 중 지터)
    static final double MIN_DERIVE_DISTANCE_M = 1.0;

    private final RideTrackingProperties props;

    public BearingEstimate update(LocationFix current, LocationFix previous, BearingEstimate previousEstimate) {
        BearingEstimate prev = current(previousEstimate, current.timestampMs());

        Double raw = headingOf(current, previous);
        if (raw == null) {
            return prev;
        }

        if (!prev.isPresent()
                || GeoUtils.angularDifference(raw, prev.degrees()) > props.getBearingDebounceDeg()) {
            return new BearingEstimate((float) GeoUtils.normalizeDegrees(raw), current.timestampMs());
        }
        // 디바운스: 값은 유지, 갱신 시각만 앞으로
        return new BearingEstimate(prev.degrees(), current.timestampMs());
    }

    /**
     * 만료 규칙을 적용한 현재 추정값.
     */
    public BearingEstimate current(BearingEstimate estimate, long nowMs) {
        if (estimate == null || !estimate.isPresent()) {
            return BearingEstimate.NONE;
        }
        if (nowMs - estimate.lastUpdatedMs() > props.getBearingStaleMs()) {
            return new BearingEstimate(null, estimate.lastUpdatedMs());
        }
        return estimate;
    }

    private static Double headingOf(LocationFix current, LocationFix previous) {
        if (current.reportedBearingDeg() != null) {
            return current.reportedBearingDeg().doubleValue();
        }
        if (previous == null) {
            return null;
        }
        double d = GeoUtils.haversine(previous.latitude(), previous.longitude(),
                current.latitude(), current.longitude());
        if (d < MIN_DERIVE_DISTANCE_M) {
            return null;
        }
        return GeoUtils.initialBearing(previous.latitude(), previous.longitude(),
                current.latitude(), current.longitude());
    }
}
