package com.bikeredlights.ride.service.settings;

/**
 * 엔진이 읽는 사용자 설정.
 * 엔진은 평가 시점마다 한 번씩 스냅샷으로 읽기만 한다 (설정 변경이 현재 일시정지 상태를 소급 변경하지 않음).
 */
public interface RideSettingsProvider {

    /**
     * @return 1, 2, 5, 10, 15, 30 중 하나. 저장된 값이 없거나 잘못되었으면 5
     */
    int getAutoPauseThresholdSeconds();

    boolean isAutoPauseEnabled();
}
