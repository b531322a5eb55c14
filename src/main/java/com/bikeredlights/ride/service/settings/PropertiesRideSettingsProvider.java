package com.bikeredlights.ride.service.settings;

import com.bikeredlights.ride.config.RideTrackingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * RideTrackingProperties 기반 설정 제공자.
 * 시작 값은 yml 에서 읽고, PUT /api/settings/auto-pause 로 바뀐 값은 여기에만 보관한다.
 * 요청 스레드에서 쓰고 위치 처리 스레드에서 읽으므로 volatile.
 */
@Slf4j
@Component
public class PropertiesRideSettingsProvider implements RideSettingsProvider {

    private volatile boolean autoPauseEnabled;
    private volatile int autoPauseThresholdSeconds;

    public PropertiesRideSettingsProvider(RideTrackingProperties props) {
        this.autoPauseEnabled = props.isAutoPauseEnabled();
        this.autoPauseThresholdSeconds = props.getAutoPauseThresholdSeconds();
    }

    @Override
    public int getAutoPauseThresholdSeconds() {
        int stored = autoPauseThresholdSeconds;
        if (!AutoPauseThresholds.isValid(stored)) {
            log.warn("[SETTINGS] 잘못된 자동 일시정지 임계값 {}s → 기본값 {}s 사용",
                    stored, AutoPauseThresholds.DEFAULT_SECONDS);
        }
        return AutoPauseThresholds.sanitize(stored);
    }

    @Override
    public boolean isAutoPauseEnabled() {
        return autoPauseEnabled;
    }

    /** 저장된 그대로의 임계값 (허용 목록 밖일 수 있음) */
    public int getStoredThresholdSeconds() {
        return autoPauseThresholdSeconds;
    }

    /**
     * 설정 저장. 임계값은 검증 없이 그대로 저장하고, 읽을 때 기본값으로 대체한다.
     */
    public void update(Boolean enabled, Integer thresholdSeconds) {
        if (enabled != null) {
            autoPauseEnabled = enabled;
        }
        if (thresholdSeconds != null) {
            autoPauseThresholdSeconds = thresholdSeconds;
        }
        log.info("[SETTINGS] autoPause enabled={} thresholdSeconds={}",
                autoPauseEnabled, autoPauseThresholdSeconds);
    }
}
