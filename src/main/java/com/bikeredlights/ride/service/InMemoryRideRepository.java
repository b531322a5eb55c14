package com.bikeredlights.ride.service;

import com.bikeredlights.ride.service.motion.LocationFix;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 서버 메모리 저장소 (기본). redis 프로필에서는 RedisRideRepository 사용.
 */
@Component
@Profile("!redis")
public class InMemoryRideRepository implements RideRepository {

    private final Map<String, List<LocationFix>> fixes = new ConcurrentHashMap<>();
    private final Map<String, RideSummary> summaries = new ConcurrentHashMap<>();

    @Override
    public void appendFix(String rideId, LocationFix fix) {
        fixes.computeIfAbsent(rideId, k -> new CopyOnWriteArrayList<>()).add(fix);
    }

    @Override
    public List<LocationFix> loadFixes(String rideId) {
        List<LocationFix> list = fixes.get(rideId);
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public void saveSummary(RideSummary summary) {
        if (summary != null) {
            summaries.put(summary.rideId(), summary);
        }
    }

    @Override
    public RideSummary findSummary(String rideId) {
        return summaries.get(rideId);
    }

    @Override
    public List<RideSummary> findAllSummaries() {
        return new ArrayList<>(summaries.values());
    }

    @Override
    public void delete(String rideId) {
        fixes.remove(rideId);
        summaries.remove(rideId);
    }
}
