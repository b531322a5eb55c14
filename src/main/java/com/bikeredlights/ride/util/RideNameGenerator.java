package com.bikeredlights.ride.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 기본 라이드 이름 생성: "Ride on MMM d, yyyy" (예: "Ride on Jan 15, 2025")
 */
public final class RideNameGenerator {
    private RideNameGenerator() {}

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

    public static String defaultName(long epochMs, ZoneId zone) {
        return "Ride on " + FORMAT.format(Instant.ofEpochMilli(epochMs).atZone(zone));
    }
}
