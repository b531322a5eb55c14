package com.bikeredlights.ride.dto.response;

import java.util.List;

/**
 * 단순화된 경로 (요청 시마다 계산, 저장하지 않음)
 *
 * @param points  [lat, lon] 목록
 * @param bounds  포인트 2개 미만이면 null (클라이언트는 고정 줌 사용)
 * @param lengthMeters 단순화된 경로의 길이
 */
public record RouteResponse(
        String rideId,
        List<double[]> points,
        double toleranceMeters,
        MapBounds bounds,
        double lengthMeters,
        int originalPointCount
) {}
