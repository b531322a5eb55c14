package com.bikeredlights.ride.service;

import java.util.Comparator;
import java.util.Locale;

/**
 * 라이드 목록 정렬. 동률이면 최신 순.
 */
public enum SortPreference {
    NEWEST_FIRST(Comparator.comparingLong(RideSummary::startedAtMs).reversed()),
    OLDEST_FIRST(Comparator.comparingLong(RideSummary::startedAtMs)),
    LONGEST_DISTANCE(Comparator.comparingDouble(RideSummary::distanceMeters).reversed()
            .thenComparing(Comparator.comparingLong(RideSummary::startedAtMs).reversed())),
    LONGEST_DURATION(Comparator.comparingLong(RideSummary::movingDurationMs).reversed()
            .thenComparing(Comparator.comparingLong(RideSummary::startedAtMs).reversed()));

    public static final SortPreference DEFAULT = NEWEST_FIRST;

    private final Comparator<RideSummary> comparator;

    SortPreference(Comparator<RideSummary> comparator) {
        this.comparator = comparator;
    }

    public Comparator<RideSummary> comparator() {
        return comparator;
    }

    /**
     * 빈 값이면 DEFAULT, 알 수 없는 값이면 IllegalArgumentException.
     */
    public static SortPreference parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown sort: " + value, e);
        }
    }
}
