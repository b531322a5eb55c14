package com.bikeredlights.ride.service.location;

/**
 * 위치 권한이 없거나 위치 프로바이더가 꺼져 있음.
 */
public class LocationUnavailableException extends RuntimeException {

    public LocationUnavailableException(String message) {
        super(message);
    }

    public LocationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
