package com.bikeredlights.ride.service;

public enum RideEvent {
    START_RIDE,
    FIRST_VALID_FIX,
    MANUAL_PAUSE,
    STATIONARY_THRESHOLD_REACHED,
    MANUAL_RESUME,
    MOTION_RESUMED,
    STOP_RIDE
}
