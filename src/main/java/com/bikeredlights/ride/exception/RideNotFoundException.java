package com.bikeredlights.ride.exception;

public class RideNotFoundException extends RuntimeException {

    public RideNotFoundException(String rideId) {
        super("ride not found: " + rideId);
    }
}
