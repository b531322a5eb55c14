package com.bikeredlights.ride.dto.response;

/**
 * 경로 전체를 감싸는 사각 영역 (남서 / 북동 꼭짓점).
 */
public record MapBounds(
        double southWestLat,
        double southWestLon,
        double northEastLat,
        double northEastLon
) {
    public boolean contains(double lat, double lon) {
        return lat >= southWestLat && lat <= northEastLat
                && lon >= southWestLon && lon <= northEastLon;
    }
}
