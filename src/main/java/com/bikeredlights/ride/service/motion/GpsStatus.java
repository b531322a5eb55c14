package com.bikeredlights.ride.service.motion;

import com.bikeredlights.ride.config.RideTrackingProperties;

/**
 * GPS 신호 상태.
 * - UNAVAILABLE: 위치 소스 사용 불가, 또는 마지막 fix 수신 후 gpsSignalLostMs 초과
 * - ACQUIRING : 아직 fix 없음, 또는 정확도가 gpsActiveAccuracyM 보다 나쁨
 * - ACTIVE    : 정확도 양호 + 최근 fix 있음
 * 경과 시간은 서버 시계로 잰다. 기기 타임스탬프는 서버와 어긋날 수 있다.
 */
public enum GpsStatus {
    UNAVAILABLE,
    ACQUIRING,
    ACTIVE;

    public static GpsStatus of(LocationFix lastFix, Long lastFixReceivedAtMs, boolean sourceAvailable,
                               long nowMs, RideTrackingProperties props) {
        if (!sourceAvailable) return UNAVAILABLE;
        if (lastFix == null || lastFixReceivedAtMs == null) return ACQUIRING;
        if (nowMs - lastFixReceivedAtMs > props.getGpsSignalLostMs()) return UNAVAILABLE;
        if (lastFix.accuracyMeters() > props.getGpsActiveAccuracyM()) return ACQUIRING;
        return ACTIVE;
    }
}
