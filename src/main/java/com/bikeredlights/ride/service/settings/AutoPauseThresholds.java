package com.bikeredlights.ride.service.settings;

import java.util.List;

/**
 * 자동 일시정지 임계값(초) 허용 목록.
 * - 1s, 2s: 신호 대기 같은 짧은 정차
 * - 5s: 기본값
 * - 10s, 15s: 교차로 장시간 정차
 * - 30s: 휴식/지도 확인
 */
public final class AutoPauseThresholds {
    private AutoPauseThresholds() {}

    public static final List<Integer> VALID_SECONDS = List.of(1, 2, 5, 10, 15, 30);

    public static final int DEFAULT_SECONDS = 5;

    public static boolean isValid(Integer seconds) {
        return seconds != null && VALID_SECONDS.contains(seconds);
    }

    /** 허용 목록 밖의 값(또는 null)은 기본값 5초로 대체 */
    public static int sanitize(Integer seconds) {
        return isValid(seconds) ? seconds : DEFAULT_SECONDS;
    }
}
