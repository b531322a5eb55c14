package com.bikeredlights.ride.dto.request;

import com.bikeredlights.ride.service.motion.LocationFix;
import jakarta.validation.constraints.NotNull;

/**
 * 클라이언트 → 서버 위치 업링크.
 * 범위 검증은 엔진(LocationFixValidator)이 하고, 여기서는 필수값만 확인한다.
 */
public record LocationFixRequest(
        @NotNull Double lat,
        @NotNull Double lon,
        Float accuracyM,          // 선택: 없으면 0 (정확도 미상)
        @NotNull Long timestampMs,
        Float speedMps,           // 선택
        Float bearingDeg          // 선택
) {
    public LocationFix toFix() {
        return new LocationFix(lat, lon,
                accuracyM != null ? accuracyM : 0f,
                timestampMs,
                speedMps,
                bearingDeg);
    }
}
