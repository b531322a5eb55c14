package com.bikeredlights.ride.util;

import com.bikeredlights.ride.dto.response.MapBounds;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteGeometryTest {

    // 1시간 1Hz 기록: 북쪽으로 거의 직선, 좌우로 1m 이내 흔들림
    private static List<double[]> nearStraightTrack(int n) {
        List<double[]> pts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double wobble = (i % 2 == 0 ? 1 : -1) * 0.000005; // ~0.5m
            pts.add(new double[]{37.0 + i * 0.00005, -122.0 + wobble});
        }
        return pts;
    }

    @Test
    void simplify_emptyAndTiny_inputsAreReturnedAsIs() {
        assertTrue(RouteGeometry.simplify(List.of(), 10).isEmpty());
        assertTrue(RouteGeometry.simplify(null, 10).isEmpty());

        List<double[]> one = List.<double[]>of(new double[]{1, 2});
        List<double[]> out = RouteGeometry.simplify(one, 10);
        assertEquals(1, out.size());
        assertArrayEquals(new double[]{1, 2}, out.get(0));

        List<double[]> two = List.of(new double[]{1, 2}, new double[]{3, 4});
        assertEquals(2, RouteGeometry.simplify(two, 10).size());
    }

    @Test
    void simplify_3600PointNearStraightTrack_keepsEndpointsAndDropsMostPoints() {
        List<double[]> track = nearStraightTrack(3600);

        List<double[]> out = RouteGeometry.simplify(track, 10);

        assertTrue(out.size() <= track.size());
        assertTrue(out.size() < 100, "expected heavy reduction but got " + out.size());
        assertArrayEquals(track.get(0), out.get(0));
        assertArrayEquals(track.get(track.size() - 1), out.get(out.size() - 1));
    }

    @Test
    void simplify_keepsSharpCorner() {
        List<double[]> pts = new ArrayList<>();
        for (int i = 0; i <= 50; i++) pts.add(new double[]{37.0 + i * 0.0001, -122.0});
        for (int i = 1; i <= 50; i++) pts.add(new double[]{37.005, -122.0 + i * 0.0001});

        List<double[]> out = RouteGeometry.simplify(pts, 10);

        assertEquals(3, out.size());
        assertArrayEquals(new double[]{37.005, -122.0}, out.get(1), 1e-12);
    }

    @Test
    void simplify_isIdempotent() {
        List<double[]> track = nearStraightTrack(500);
        track.set(250, new double[]{track.get(250)[0], -121.999}); // 한 점 튀게

        List<double[]> first = RouteGeometry.simplify(track, 10);
        List<double[]> second = RouteGeometry.simplify(track, 10);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertArrayEquals(first.get(i), second.get(i));
        }
    }

    @Test
    void simplify_doesNotModifyInput() {
        List<double[]> track = nearStraightTrack(100);
        int before = track.size();
        RouteGeometry.simplify(track, 10);
        assertEquals(before, track.size());
    }

    @Test
    void simplify_oversizedInputIsDecimatedButKeepsEndpoints() {
        List<double[]> track = nearStraightTrack(1000);

        List<double[]> out = RouteGeometry.simplify(track, 0, 100);

        assertTrue(out.size() <= 101);
        assertArrayEquals(track.get(0), out.get(0));
        assertArrayEquals(track.get(999), out.get(out.size() - 1));
    }

    @Test
    void bounds_emptyOrSinglePoint_isNull() {
        assertNull(RouteGeometry.bounds(List.of()));
        assertNull(RouteGeometry.bounds(List.<double[]>of(new double[]{37.0, -122.0})));
    }

    @Test
    void bounds_containsBothCorners() {
        MapBounds b = RouteGeometry.bounds(List.of(new double[]{0, 0}, new double[]{1, 1}));

        assertNotNull(b);
        assertEquals(0.0, b.southWestLat());
        assertEquals(0.0, b.southWestLon());
        assertEquals(1.0, b.northEastLat());
        assertEquals(1.0, b.northEastLon());
        assertTrue(b.contains(0, 0));
        assertTrue(b.contains(1, 1));
        assertFalse(b.contains(1.5, 0.5));
    }
}
