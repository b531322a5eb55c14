package com.bikeredlights.ride.service.motion;

import com.bikeredlights.ride.config.RideTrackingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 원시 fix 정제 (범위/정확도/시간 순서 검사).
 * - 순서가 뒤바뀐 fix는 재정렬하지 않고 버린다.
 * - 부작용 없음: 거절 횟수 집계는 호출 측(상태 머신) 책임
 */
@Component
@RequiredArgsConstructor
public class LocationFixValidator {

    private final RideTrackingProperties props;

    /**
     * @param fix              검사할 fix
     * @param previousAccepted 직전에 통과한 fix (없으면 null)
     */
    public FixValidation validate(LocationFix fix, LocationFix previousAccepted) {
        double lat = fix.latitude();
        double lon = fix.longitude();

        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            return FixValidation.rejected(RejectReason.LATITUDE_OUT_OF_RANGE);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            return FixValidation.rejected(RejectReason.LONGITUDE_OUT_OF_RANGE);
        }
        if (Float.isNaN(fix.accuracyMeters()) || fix.accuracyMeters() < 0f) {
            return FixValidation.rejected(RejectReason.NEGATIVE_ACCURACY);
        }
        if (fix.accuracyMeters() > props.getMaxAccuracyM()) {
            return FixValidation.rejected(RejectReason.ACCURACY_TOO_LOW);
        }
        if (fix.timestampMs() <= 0) {
            return FixValidation.rejected(RejectReason.NON_POSITIVE_TIMESTAMP);
        }
        if (previousAccepted != null && fix.timestampMs() <= previousAccepted.timestampMs()) {
            return FixValidation.rejected(RejectReason.OUT_OF_ORDER);
        }

        Float speed = fix.reportedSpeedMps();
        if (speed != null && (speed.isNaN() || speed < 0f)) {
            return FixValidation.rejected(RejectReason.INVALID_SPEED);
        }
        Float bearing = fix.reportedBearingDeg();
        if (bearing != null && (bearing.isNaN() || bearing < 0f || bearing >= 360f)) {
            return FixValidation.rejected(RejectReason.INVALID_BEARING);
        }

        return FixValidation.accepted(fix);
    }
}
