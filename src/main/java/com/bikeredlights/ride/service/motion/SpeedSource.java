package com.bikeredlights.ride.service.motion;

public enum SpeedSource {
    /** GPS 칩이 보고한 속도 (도플러) */
    GPS,
    /** 직전 fix와의 위치 변화로 계산한 속도 */
    DERIVED,
    UNKNOWN
}
