package com.bikeredlights.ride.service;

import com.bikeredlights.ride.service.motion.LocationFix;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
@Profile("redis")
@RequiredArgsConstructor
public class RedisRideRepository implements RideRepository {

    private static final String KEY_FIXES_PREFIX   = "ride:fixes:";    // 경로 포인트 (list)
    private static final String KEY_SUMMARY_PREFIX = "ride:summary:";  // 요약 (value)
    private static final String KEY_INDEX          = "ride:index";     // 저장된 rideId 목록 (set)
    private static final Duration TTL = Duration.ofDays(30);

    private final RedisTemplate<String, LocationFix> fixRedisTemplate;
    private final RedisTemplate<String, RideSummary> summaryRedisTemplate;
    private final StringRedisTemplate indexRedisTemplate;

    private String fixesKey(String rideId) {
        return KEY_FIXES_PREFIX + rideId;
    }

    private String summaryKey(String rideId) {
        return KEY_SUMMARY_PREFIX + rideId;
    }

    @Override
    public void appendFix(String rideId, LocationFix fix) {
        String key = fixesKey(rideId);
        fixRedisTemplate.opsForList().rightPush(key, fix);
        fixRedisTemplate.expire(key, TTL);
    }

    @Override
    public List<LocationFix> loadFixes(String rideId) {
        List<LocationFix> list = fixRedisTemplate.opsForList().range(fixesKey(rideId), 0, -1);
        return list != null ? list : List.of();
    }

    @Override
    public void saveSummary(RideSummary summary) {
        if (summary == null) return;
        summaryRedisTemplate.opsForValue().set(summaryKey(summary.rideId()), summary, TTL);
        indexRedisTemplate.opsForSet().add(KEY_INDEX, summary.rideId());
    }

    @Override
    public RideSummary findSummary(String rideId) {
        return summaryRedisTemplate.opsForValue().get(summaryKey(rideId));
    }

    @Override
    public List<RideSummary> findAllSummaries() {
        Set<String> ids = indexRedisTemplate.opsForSet().members(KEY_INDEX);
        List<RideSummary> out = new ArrayList<>();
        if (ids == null) return out;
        for (String id : ids) {
            RideSummary s = findSummary(id);
            if (s != null) {
                out.add(s);
            } else {
                // TTL 만료된 요약은 인덱스에서도 정리
                indexRedisTemplate.opsForSet().remove(KEY_INDEX, id);
            }
        }
        return out;
    }

    @Override
    public void delete(String rideId) {
        fixRedisTemplate.delete(fixesKey(rideId));
        summaryRedisTemplate.delete(summaryKey(rideId));
        indexRedisTemplate.opsForSet().remove(KEY_INDEX, rideId);
    }
}
