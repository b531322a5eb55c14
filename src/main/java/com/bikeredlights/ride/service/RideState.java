package com.bikeredlights.ride.service;

public enum RideState {
    IDLE,
    WAITING_FOR_FIX,
    RECORDING,
    MANUALLY_PAUSED,
    AUTO_PAUSED;

    public boolean isPaused() {
        return this == MANUALLY_PAUSED || this == AUTO_PAUSED;
    }
}
