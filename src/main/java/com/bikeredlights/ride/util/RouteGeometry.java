package com.bikeredlights.ride.util;

import com.bikeredlights.ride.dto.response.MapBounds;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 지도 렌더링용 경로 지오메트리 처리.
 * - Douglas–Peucker 단순화 (허용오차 m → 도 단위 근사 변환)
 * - 경로 전체를 감싸는 bounding box 계산
 *
 * 모든 함수는 순수 함수: 입력 리스트를 수정하지 않고, 같은 입력이면 같은 결과를 돌려준다.
 * 좌표는 double[]{lat, lon}.
 */
public final class RouteGeometry {
    private RouteGeometry() {}

    /** 위도 1도 ≈ 111,000 m (허용오차 변환용 근사값) */
    public static final double METERS_PER_DEGREE = 111_000.0;

    public static List<double[]> simplify(List<double[]> pts, double toleranceMeters) {
        return simplify(pts, toleranceMeters, Integer.MAX_VALUE);
    }

    /**
     * Douglas–Peucker 단순화.
     *
     * @param pts             원본 좌표 (null/빈 리스트 허용)
     * @param toleranceMeters 허용오차(m). 0 이하이면 중복 없는 원본 그대로
     * @param maxInputPoints  이 개수를 넘는 입력은 일정 간격으로 먼저 솎아낸다 (시작/끝점 유지)
     * @return 단순화된 좌표. 시작점과 끝점은 항상 보존된다.
     */
    public static List<double[]> simplify(List<double[]> pts, double toleranceMeters, int maxInputPoints) {
        if (pts == null || pts.isEmpty()) return List.of();
        if (pts.size() <= 2) return new ArrayList<>(pts);

        List<double[]> input = decimate(pts, maxInputPoints);
        int n = input.size();
        if (n <= 2) return new ArrayList<>(input);

        double epsilonDeg = Math.max(0.0, toleranceMeters) / METERS_PER_DEGREE;

        boolean[] keep = new boolean[n];
        keep[0] = true;
        keep[n - 1] = true;

        // 재귀 대신 스택 사용 (수천 포인트 트랙에서도 스택 깊이 문제 없음)
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{0, n - 1});

        while (!stack.isEmpty()) {
            int[] range = stack.pop();
            int first = range[0];
            int last = range[1];
            if (last - first < 2) continue;

            double[] a = input.get(first);
            double[] b = input.get(last);

            double maxDist = -1;
            int index = -1;
            for (int i = first + 1; i < last; i++) {
                double d = perpendicularDistanceDeg(input.get(i), a, b);
                if (d > maxDist) {
                    maxDist = d;
                    index = i;
                }
            }

            if (index >= 0 && maxDist > epsilonDeg) {
                keep[index] = true;
                stack.push(new int[]{first, index});
                stack.push(new int[]{index, last});
            }
        }

        List<double[]> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (keep[i]) out.add(input.get(i));
        }
        return out;
    }

    /**
     * 경로 bounding box.
     * - 0개, 1개: null (1개일 때는 호출 측에서 고정 줌을 사용)
     */
    public static MapBounds bounds(List<double[]> pts) {
        if (pts == null || pts.size() < 2) return null;

        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;

        for (double[] p : pts) {
            minLat = Math.min(minLat, p[0]);
            maxLat = Math.max(maxLat, p[0]);
            minLon = Math.min(minLon, p[1]);
            maxLon = Math.max(maxLon, p[1]);
        }
        return new MapBounds(minLat, minLon, maxLat, maxLon);
    }

    // 점 P와 선분 [A, B] 사이의 거리 (도 단위 평면 근사)
    private static double perpendicularDistanceDeg(double[] p, double[] a, double[] b) {
        double vx = b[1] - a[1];
        double vy = b[0] - a[0];
        double wx = p[1] - a[1];
        double wy = p[0] - a[0];

        double segLen2 = vx*vx + vy*vy;
        double t = (segLen2 == 0) ? 0 : ((wx*vx + wy*vy) / segLen2); // 투영 스칼라

        double projx, projy;
        if (t <= 0) {                // A 쪽
            projx = a[1]; projy = a[0];
        } else if (t >= 1) {         // B 쪽
            projx = b[1]; projy = b[0];
        } else {                     // 선분 내부
            projx = a[1] + t*vx;
            projy = a[0] + t*vy;
        }
        return Math.hypot(p[1] - projx, p[0] - projy);
    }

    private static List<double[]> decimate(List<double[]> pts, int maxInputPoints) {
        int n = pts.size();
        if (maxInputPoints < 3 || n <= maxInputPoints) return pts;

        int stride = (int) Math.ceil((double) (n - 1) / (maxInputPoints - 1));
        List<double[]> out = new ArrayList<>(maxInputPoints);
        for (int i = 0; i < n - 1; i += stride) {
            out.add(pts.get(i));
        }
        out.add(pts.get(n - 1));
        return out;
    }
}
