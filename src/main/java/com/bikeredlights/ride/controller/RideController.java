package com.bikeredlights.ride.controller;

import com.bikeredlights.ride.dto.request.LocationFixRequest;
import com.bikeredlights.ride.dto.request.RideEventRequest;
import com.bikeredlights.ride.dto.response.PauseTickResponse;
import com.bikeredlights.ride.dto.response.RideSnapshotResponse;
import com.bikeredlights.ride.service.PauseTimer;
import com.bikeredlights.ride.service.RideRecordingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.Locale;

@Tag(name = "라이드 기록", description = "라이드 시작/종료, 위치 업링크, 일시정지 및 실시간 스냅샷 API")
@RestController
@RequestMapping("/api/rides")
@RequiredArgsConstructor
public class RideController {

    private final RideRecordingService recordingService;

    @Operation(summary = "라이드 시작", description = "IDLE 이면 새 라이드를 만들고 첫 fix 를 기다립니다. 이미 진행 중이면 현재 스냅샷을 그대로 반환합니다.")
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public RideSnapshotResponse start() {
        return recordingService.startRide();
    }

    @Operation(summary = "현재 라이드 스냅샷")
    @GetMapping(value = "/current", produces = MediaType.APPLICATION_JSON_VALUE)
    public RideSnapshotResponse current() {
        return recordingService.snapshot();
    }

    @Operation(summary = "스냅샷 스트림 (SSE)", description = "상태가 바뀔 때마다 스냅샷을 보냅니다. 구독 즉시 최신값 1개.")
    @GetMapping(value = "/current/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<RideSnapshotResponse>> stream() {
        return recordingService.snapshots()
                .map(s -> ServerSentEvent.builder(s).event("snapshot").build());
    }

    @Operation(summary = "일시정지 타이머 (SSE)", description = "일시정지 중에만 1초마다 경과 시간을 보냅니다.")
    @GetMapping(value = "/current/pause-timer", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<PauseTickResponse>> pauseTimer() {
        return recordingService.pauseTimer()
                .map(d -> new PauseTickResponse(d.toMillis(), PauseTimer.format(d)))
                .map(t -> ServerSentEvent.builder(t).event("pause-tick").build());
    }

    /**
     * 위치 업링크. 범위를 벗어난 fix 는 400 이 아니라 rejectedFixCount 로 집계된다.
     */
    @Operation(summary = "위치 fix 업링크")
    @PostMapping(value = "/current/fixes",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public RideSnapshotResponse fix(@Valid @RequestBody LocationFixRequest req) {
        return recordingService.submitFix(req.toFix());
    }

    @Operation(summary = "라이드 이벤트", description = "type: PAUSE, RESUME, STOP. 현재 상태에서 불가능한 이벤트는 무시됩니다.")
    @PostMapping(value = "/current/events",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public RideSnapshotResponse event(@Valid @RequestBody RideEventRequest req) {
        String type = req.type().trim().toUpperCase(Locale.ROOT);
        return switch (type) {
            case "PAUSE" -> recordingService.pause();
            case "RESUME" -> recordingService.resume();
            case "STOP" -> {
                recordingService.stopRide();
                yield recordingService.snapshot();
            }
            default -> throw new IllegalArgumentException("unknown event type: " + req.type());
        };
    }
}
