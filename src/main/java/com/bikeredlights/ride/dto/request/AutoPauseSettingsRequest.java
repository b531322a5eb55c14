package com.bikeredlights.ride.dto.request;

/**
 * 둘 다 선택. null 이면 기존 값 유지.
 */
public record AutoPauseSettingsRequest(
        Boolean enabled,
        Integer thresholdSeconds
) {}
