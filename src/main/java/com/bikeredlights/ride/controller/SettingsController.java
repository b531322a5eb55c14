package com.bikeredlights.ride.controller;

import com.bikeredlights.ride.dto.request.AutoPauseSettingsRequest;
import com.bikeredlights.ride.dto.response.AutoPauseSettingsResponse;
import com.bikeredlights.ride.service.settings.AutoPauseThresholds;
import com.bikeredlights.ride.service.settings.PropertiesRideSettingsProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@Tag(name = "설정", description = "자동 일시정지 설정")
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final PropertiesRideSettingsProvider settingsProvider;

    @Operation(summary = "자동 일시정지 설정 조회")
    @GetMapping(value = "/auto-pause", produces = MediaType.APPLICATION_JSON_VALUE)
    public AutoPauseSettingsResponse get() {
        return current();
    }

    @Operation(summary = "자동 일시정지 설정 변경",
            description = "허용 목록(1, 2, 5, 10, 15, 30초) 밖의 임계값은 저장되지만 5초로 적용됩니다. 다음 판정부터 반영.")
    @PutMapping(value = "/auto-pause",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public AutoPauseSettingsResponse update(@RequestBody AutoPauseSettingsRequest req) {
        settingsProvider.update(req.enabled(), req.thresholdSeconds());
        return current();
    }

    private AutoPauseSettingsResponse current() {
        return new AutoPauseSettingsResponse(
                settingsProvider.isAutoPauseEnabled(),
                settingsProvider.getAutoPauseThresholdSeconds(),
                AutoPauseThresholds.VALID_SECONDS
        );
    }
}
