package com.bikeredlights.ride.service.motion;

/**
 * 화면에 전파되는 진행 방향.
 *
 * @param degrees       [0, 360) 또는 null (방향 없음 → north-up / 방향 없는 마커)
 * @param lastUpdatedMs 마지막으로 유효한 방위각 갱신이 들어온 시각
 */
public record BearingEstimate(
        Float degrees,
        long lastUpdatedMs
) {
    public static final BearingEstimate NONE = new BearingEstimate(null, 0L);

    public boolean isPresent() {
        return degrees != null;
    }
}
