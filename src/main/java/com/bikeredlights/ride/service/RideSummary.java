package com.bikeredlights.ride.service;

/**
 * 종료된 라이드의 저장용 요약.
 *
 * @param elapsedDurationMs endedAt - startedAt (이동 + 일시정지 + 대기)
 * @param avgSpeedKmh       이동 거리 / 이동 시간 (이동 시간 0 이면 0)
 */
public record RideSummary(
        String rideId,
        String name,
        long startedAtMs,
        long endedAtMs,
        long elapsedDurationMs,
        long movingDurationMs,
        long pausedDurationMs,
        long manualPausedDurationMs,
        long autoPausedDurationMs,
        double distanceMeters,
        double avgSpeedKmh,
        double maxSpeedKmh,
        int pointCount
) {
    public static RideSummary from(RideSession s) {
        long ended = s.getEndedAtMs() != null ? s.getEndedAtMs() : s.getStartedAtMs();
        long moving = s.getMovingDurationMs();
        double distance = s.getMovingDistanceMeters();
        double avg = moving > 0 ? (distance / (moving / 1000.0)) * 3.6 : 0.0;
        return new RideSummary(
                s.getRideId(),
                s.getName(),
                s.getStartedAtMs(),
                ended,
                ended - s.getStartedAtMs(),
                moving,
                s.getPausedDurationMs(),
                s.getManualPausedDurationMs(),
                s.getAutoPausedDurationMs(),
                distance,
                avg,
                s.getMaxSpeedKmh(),
                s.getPointCount()
        );
    }
}
