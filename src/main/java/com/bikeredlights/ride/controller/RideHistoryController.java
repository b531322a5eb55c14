package com.bikeredlights.ride.controller;

import com.bikeredlights.ride.dto.response.RouteResponse;
import com.bikeredlights.ride.service.RideHistoryService;
import com.bikeredlights.ride.service.RideSummary;
import com.bikeredlights.ride.service.SortPreference;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "라이드 기록 조회", description = "종료된 라이드 목록/상세/경로 조회 및 삭제")
@RestController
@RequestMapping("/api/rides")
@RequiredArgsConstructor
public class RideHistoryController {

    private final RideHistoryService historyService;

    @Operation(summary = "라이드 목록",
            description = "sort: NEWEST_FIRST(기본), OLDEST_FIRST, LONGEST_DISTANCE, LONGEST_DURATION. fromMs/toMs 로 시작 시각 필터.")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RideSummary> list(@RequestParam(required = false) String sort,
                                  @RequestParam(required = false) Long fromMs,
                                  @RequestParam(required = false) Long toMs) {
        return historyService.list(SortPreference.parse(sort), fromMs, toMs);
    }

    @Operation(summary = "라이드 상세")
    @GetMapping(value = "/{rideId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public RideSummary get(@PathVariable String rideId) {
        return historyService.get(rideId);
    }

    @Operation(summary = "라이드 경로", description = "저장된 경로를 Douglas-Peucker 로 단순화하고 지도 영역을 함께 반환합니다.")
    @GetMapping(value = "/{rideId}/route", produces = MediaType.APPLICATION_JSON_VALUE)
    public RouteResponse route(@PathVariable String rideId,
                               @RequestParam(required = false) Double toleranceM) {
        return historyService.route(rideId, toleranceM);
    }

    @Operation(summary = "라이드 삭제")
    @DeleteMapping("/{rideId}")
    public ResponseEntity<Void> delete(@PathVariable String rideId) {
        historyService.delete(rideId);
        return ResponseEntity.noContent().build();
    }
}
