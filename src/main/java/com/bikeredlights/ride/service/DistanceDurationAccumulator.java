package com.bikeredlights.ride.service;

/**
 * 이동 거리 / 이동 시간 / 일시정지 시간 누적기.
 * 모든 누적값은 감소하지 않는다 (음수·NaN 입력은 무시).
 * 어떤 상태에서 무엇을 더할지는 상태 머신이 결정한다.
 */
public class DistanceDurationAccumulator {

    private double movingDistanceMeters;
    private long movingDurationMs;
    private long pausedDurationMs;
    private long manualPausedDurationMs;
    private long autoPausedDurationMs;

    // 이동 시간 측정 기준 시각 (RECORDING 이 아니면 null)
    private Long movingSinceMs;

    public void addDistance(double meters) {
        if (Double.isNaN(meters) || Double.isInfinite(meters) || meters <= 0) return;
        movingDistanceMeters += meters;
    }

    public void startMoving(long nowMs) {
        movingSinceMs = nowMs;
    }

    /** 기준 시각부터 지금까지를 이동 시간에 더하고 기준 시각을 옮긴다. */
    public void tickMoving(long nowMs) {
        if (movingSinceMs == null) return;
        if (nowMs > movingSinceMs) {
            movingDurationMs += nowMs - movingSinceMs;
            movingSinceMs = nowMs;
        }
    }

    public void stopMoving(long nowMs) {
        tickMoving(nowMs);
        movingSinceMs = null;
    }

    public boolean isMoving() {
        return movingSinceMs != null;
    }

    public void addPause(long elapsedMs, boolean auto) {
        if (elapsedMs <= 0) return;
        pausedDurationMs += elapsedMs;
        if (auto) {
            autoPausedDurationMs += elapsedMs;
        } else {
            manualPausedDurationMs += elapsedMs;
        }
    }

    public double getMovingDistanceMeters() {
        return movingDistanceMeters;
    }

    public long getMovingDurationMs() {
        return movingDurationMs;
    }

    public long getPausedDurationMs() {
        return pausedDurationMs;
    }

    public long getManualPausedDurationMs() {
        return manualPausedDurationMs;
    }

    public long getAutoPausedDurationMs() {
        return autoPausedDurationMs;
    }
}
