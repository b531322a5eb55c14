package com.bikeredlights.ride.service;

import com.bikeredlights.ride.service.motion.BearingEstimate;
import com.bikeredlights.ride.service.motion.LocationFix;
import com.bikeredlights.ride.service.motion.SpeedSample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 라이드 세션 (집합 루트).
 * - RideStateMachine 만 수정한다.
 * - points 는 세션 동안 append-only. 외부에는 읽기 전용 뷰/복사본만 노출
 */
public class RideSession {

    private final String rideId;
    private final String name;
    private final long startedAtMs;
    private Long endedAtMs;

    private RideState state;

    private final DistanceDurationAccumulator totals = new DistanceDurationAccumulator();
    private Long currentPauseStartMs;

    private final List<LocationFix> points = new ArrayList<>();

    // 추정 상태
    private LocationFix lastAcceptedFix;
    // 서버 시계 기준 마지막 fix 수신 시각
    private Long lastFixReceivedAtMs;
    private SpeedSample lastSpeed;
    private BearingEstimate bearing = BearingEstimate.NONE;
    private float maxSpeedKmh;

    // 자동 일시정지: 현재 정지 구간의 첫 샘플 시각 (정지 구간 아니면 null)
    private Long stationaryRunStartMs;

    // 재개 직후 첫 포인트는 일시정지 구간 거리를 더하지 않음
    private boolean segmentBreak;

    private int rejectedFixCount;

    public RideSession(String rideId, String name, long startedAtMs, RideState state) {
        this.rideId = rideId;
        this.name = name;
        this.startedAtMs = startedAtMs;
        this.state = state;
    }

    public String getRideId() {
        return rideId;
    }

    public String getName() {
        return name;
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }

    public Long getEndedAtMs() {
        return endedAtMs;
    }

    void setEndedAtMs(Long endedAtMs) {
        this.endedAtMs = endedAtMs;
    }

    public RideState getState() {
        return state;
    }

    void setState(RideState state) {
        this.state = state;
    }

    DistanceDurationAccumulator totals() {
        return totals;
    }

    public double getMovingDistanceMeters() {
        return totals.getMovingDistanceMeters();
    }

    public long getMovingDurationMs() {
        return totals.getMovingDurationMs();
    }

    public long getPausedDurationMs() {
        return totals.getPausedDurationMs();
    }

    public long getManualPausedDurationMs() {
        return totals.getManualPausedDurationMs();
    }

    public long getAutoPausedDurationMs() {
        return totals.getAutoPausedDurationMs();
    }

    public Long getCurrentPauseStartMs() {
        return currentPauseStartMs;
    }

    void setCurrentPauseStartMs(Long currentPauseStartMs) {
        this.currentPauseStartMs = currentPauseStartMs;
    }

    /** 읽기 전용 뷰 */
    public List<LocationFix> getPoints() {
        return Collections.unmodifiableList(points);
    }

    void appendPoint(LocationFix fix) {
        points.add(fix);
    }

    public int getPointCount() {
        return points.size();
    }

    public LocationFix getLastPoint() {
        return points.isEmpty() ? null : points.get(points.size() - 1);
    }

    /** 지오메트리 계산용 [lat, lon] 복사본 */
    public List<double[]> pointsAsLatLon() {
        List<double[]> out = new ArrayList<>(points.size());
        for (LocationFix p : points) {
            out.add(p.toLatLon());
        }
        return out;
    }

    public LocationFix getLastAcceptedFix() {
        return lastAcceptedFix;
    }

    void setLastAcceptedFix(LocationFix lastAcceptedFix) {
        this.lastAcceptedFix = lastAcceptedFix;
    }

    public Long getLastFixReceivedAtMs() {
        return lastFixReceivedAtMs;
    }

    void setLastFixReceivedAtMs(Long lastFixReceivedAtMs) {
        this.lastFixReceivedAtMs = lastFixReceivedAtMs;
    }

    public SpeedSample getLastSpeed() {
        return lastSpeed;
    }

    void setLastSpeed(SpeedSample lastSpeed) {
        this.lastSpeed = lastSpeed;
    }

    public BearingEstimate getBearing() {
        return bearing;
    }

    void setBearing(BearingEstimate bearing) {
        this.bearing = bearing;
    }

    public float getMaxSpeedKmh() {
        return maxSpeedKmh;
    }

    void setMaxSpeedKmh(float maxSpeedKmh) {
        this.maxSpeedKmh = maxSpeedKmh;
    }

    Long getStationaryRunStartMs() {
        return stationaryRunStartMs;
    }

    void setStationaryRunStartMs(Long stationaryRunStartMs) {
        this.stationaryRunStartMs = stationaryRunStartMs;
    }

    boolean isSegmentBreak() {
        return segmentBreak;
    }

    void setSegmentBreak(boolean segmentBreak) {
        this.segmentBreak = segmentBreak;
    }

    public int getRejectedFixCount() {
        return rejectedFixCount;
    }

    void incrementRejectedFixCount() {
        this.rejectedFixCount++;
    }
}
