package com.bikeredlights.ride.service.motion;

/**
 * 검증 결과: 통과한 fix 또는 거절 사유 중 하나만 채워진다.
 */
public record FixValidation(
        LocationFix fix,
        RejectReason reason
) {
    public static FixValidation accepted(LocationFix fix) {
        return new FixValidation(fix, null);
    }

    public static FixValidation rejected(RejectReason reason) {
        return new FixValidation(null, reason);
    }

    public boolean isAccepted() {
        return reason == null;
    }
}
