package com.bikeredlights.ride.dto.response;

import java.util.List;

/**
 * @param thresholdSeconds 실제 적용되는 값 (허용 목록 밖이면 5)
 */
public record AutoPauseSettingsResponse(
        boolean enabled,
        int thresholdSeconds,
        List<Integer> allowedThresholdSeconds
) {}
