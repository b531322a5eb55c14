package com.bikeredlights.ride.service.motion;

/**
 * fix 하나 (+ 직전 fix) 에서 계산한 속도 샘플.
 *
 * @param speedKmh   0 ~ 100 km/h (정지 판정 시 0)
 * @param stationary 1 km/h 미만이면 true
 */
public record SpeedSample(
        float speedKmh,
        long timestampMs,
        SpeedSource source,
        boolean stationary
) {}
