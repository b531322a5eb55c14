package com.bikeredlights.ride.service;

import com.bikeredlights.ride.config.RideTrackingProperties;
import com.bikeredlights.ride.dto.response.RouteResponse;
import com.bikeredlights.ride.exception.RideNotFoundException;
import com.bikeredlights.ride.service.motion.LocationFix;
import com.bikeredlights.ride.util.GeoUtils;
import com.bikeredlights.ride.util.RouteGeometry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 저장된 라이드 조회/삭제.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RideHistoryService {

    private final RideRepository repository;
    private final RideTrackingProperties props;

    /**
     * @param fromMs 시작 시각 하한 (포함, 선택)
     * @param toMs   시작 시각 상한 (포함, 선택)
     */
    public List<RideSummary> list(SortPreference sort, Long fromMs, Long toMs) {
        List<RideSummary> out = new ArrayList<>();
        for (RideSummary s : repository.findAllSummaries()) {
            if (fromMs != null && s.startedAtMs() < fromMs) continue;
            if (toMs != null && s.startedAtMs() > toMs) continue;
            out.add(s);
        }
        out.sort(sort.comparator());
        return out;
    }

    public RideSummary get(String rideId) {
        RideSummary s = repository.findSummary(rideId);
        if (s == null) {
            throw new RideNotFoundException(rideId);
        }
        return s;
    }

    /**
     * 저장된 경로를 단순화해서 반환 (매 요청 계산).
     *
     * @param toleranceM null 또는 0 이하면 기본 허용오차
     */
    public RouteResponse route(String rideId, Double toleranceM) {
        get(rideId);
        double tol = (toleranceM != null && toleranceM > 0) ? toleranceM : props.getSimplifyToleranceM();

        List<LocationFix> fixes = repository.loadFixes(rideId);
        List<double[]> pts = new ArrayList<>(fixes.size());
        for (LocationFix f : fixes) {
            pts.add(f.toLatLon());
        }

        List<double[]> simplified = RouteGeometry.simplify(pts, tol, props.getMaxSimplifyPoints());
        return new RouteResponse(
                rideId,
                simplified,
                tol,
                RouteGeometry.bounds(simplified),
                GeoUtils.polylineLength(simplified),
                pts.size()
        );
    }

    public void delete(String rideId) {
        get(rideId);
        repository.delete(rideId);
        log.info("[RIDE] 라이드 삭제 rideId={}", rideId);
    }
}
