package com.bikeredlights.ride.dto.request;

import jakarta.validation.constraints.NotBlank;

public record RideEventRequest(
        @NotBlank String type     // "PAUSE", "RESUME", "STOP"
) {}
