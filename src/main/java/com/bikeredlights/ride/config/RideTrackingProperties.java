package com.bikeredlights.ride.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 라이드 기록 엔진 파라미터 (운영 중에도 yml로 조정)
 */
@Getter @Setter
@Configuration
@ConfigurationProperties(prefix = "bikeredlights.ride")
public class RideTrackingProperties {

    // --- 자동 일시정지 ---
    private boolean autoPauseEnabled   = true;
    private int    autoPauseThresholdSeconds = 5;   // 1, 2, 5, 10, 15, 30 중 하나 (그 외는 5로 대체)

    // --- 위치 검증 ---
    private double maxAccuracyM        = 50.0;  // 이보다 부정확한 fix는 기록하지 않음

    // --- 방위각 ---
    private double bearingDebounceDeg  = 5.0;   // 이 이하 변화는 화면에 전파하지 않음
    private long   bearingStaleMs      = 45_000; // 이 시간 동안 갱신 없으면 방위각 해제 (north-up)

    // --- 경로 단순화 ---
    private double simplifyToleranceM  = 10.0;  // 자전거 스케일에서 눈에 띄는 손실 없이 대부분의 포인트 제거
    private int    maxSimplifyPoints   = 20_000;

    // --- 일시정지 타이머 ---
    private long   pauseTickMs         = 1_000;

    // --- 라이드 종료 ---
    private long   minRideDurationMs   = 5_000; // 이보다 짧은 라이드는 저장하지 않고 폐기

    // --- GPS 상태 판정 ---
    private double gpsActiveAccuracyM  = 10.0;
    private long   gpsSignalLostMs     = 10_000;
}
