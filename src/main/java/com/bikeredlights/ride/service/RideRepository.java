package com.bikeredlights.ride.service;

import com.bikeredlights.ride.service.motion.LocationFix;

import java.util.List;

/**
 * 라이드 저장소.
 * 기록 중에는 fix 를 하나씩 append, 종료 시 요약을 저장한다.
 */
public interface RideRepository {

    /** 기록된 경로 포인트 하나 추가 (순서 유지) */
    void appendFix(String rideId, LocationFix fix);

    /** 저장 순서대로. 없으면 빈 리스트 */
    List<LocationFix> loadFixes(String rideId);

    void saveSummary(RideSummary summary);

    RideSummary findSummary(String rideId);

    List<RideSummary> findAllSummaries();

    /** 요약과 fix 를 모두 삭제 */
    void delete(String rideId);
}
