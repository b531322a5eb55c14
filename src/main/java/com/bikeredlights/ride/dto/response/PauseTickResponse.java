package com.bikeredlights.ride.dto.response;

public record PauseTickResponse(
        long elapsedMs,
        String display    // "0:05", "1:02:03"
) {}
