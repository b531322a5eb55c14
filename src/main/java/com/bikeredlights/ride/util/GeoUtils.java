package com.bikeredlights.ride.util;

import java.util.List;

/**
 * 라이드 기록에 쓰이는 지오메트리 유틸 모음.
 * - 하버사인 거리(m) 계산
 * - 두 좌표 간 초기 방위각(도) 계산
 * - 폴리라인 길이(m) 계산
 *
 * 좌표 리스트는 내부 계산 일관성을 위해 double[]{lat, lon} 순서로 사용한다.
 */
public final class GeoUtils {
    private GeoUtils() {}

    // 지구 반지름 (m)
    public static final double EARTH_RADIUS_M = 6371000.0;

    /**
     * 하버사인(Haversine) 공식으로 두 좌표 간 거리(m)를 계산한다.
     */
    public static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat/2)*Math.sin(dLat/2)
                + Math.cos(Math.toRadians(lat1))*Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon/2)*Math.sin(dLon/2);
        return 2*EARTH_RADIUS_M*Math.asin(Math.sqrt(Math.min(1.0, a)));
    }

    /**
     * from → to 방향의 초기 방위각(도, 북쪽 0 / 시계방향, [0, 360)).
     */
    public static double initialBearing(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dLon = Math.toRadians(lon2 - lon1);

        double y = Math.sin(dLon) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLon);

        return normalizeDegrees(Math.toDegrees(Math.atan2(y, x)));
    }

    /** 각도를 [0, 360) 범위로 정규화 */
    public static double normalizeDegrees(double deg) {
        double d = deg % 360.0;
        if (d < 0) d += 360.0;
        // -0.0 / 360.0 경계 보정
        return d >= 360.0 ? 0.0 : d;
    }

    /**
     * 두 방위각 사이의 원형 차이(도, 0~180).
     */
    public static double angularDifference(double a, double b) {
        double diff = Math.abs(normalizeDegrees(a) - normalizeDegrees(b));
        return diff > 180.0 ? 360.0 - diff : diff;
    }

    /**
     * 폴리라인(연속된 점들)의 총 길이(m)를 계산한다.
     */
    public static double polylineLength(List<double[]> pts) {
        if (pts == null) return 0;
        double sum = 0;
        for (int i = 1; i < pts.size(); i++) {
            sum += haversine(pts.get(i-1)[0], pts.get(i-1)[1], pts.get(i)[0], pts.get(i)[1]);
        }
        return sum;
    }
}
