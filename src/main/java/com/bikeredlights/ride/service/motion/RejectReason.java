package com.bikeredlights.ride.service.motion;

public enum RejectReason {
    LATITUDE_OUT_OF_RANGE,
    LONGITUDE_OUT_OF_RANGE,
    NEGATIVE_ACCURACY,
    ACCURACY_TOO_LOW,
    NON_POSITIVE_TIMESTAMP,
    OUT_OF_ORDER,
    INVALID_SPEED,
    INVALID_BEARING
}
