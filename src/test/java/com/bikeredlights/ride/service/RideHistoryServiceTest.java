package com.bikeredlights.ride.service;

import com.bikeredlights.ride.config.RideTrackingProperties;
import com.bikeredlights.ride.dto.response.RouteResponse;
import com.bikeredlights.ride.exception.RideNotFoundException;
import com.bikeredlights.ride.service.motion.LocationFix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RideHistoryServiceTest {

    private static final long DAY = 86_400_000L;
    private static final long BASE = 1_700_000_000_000L;

    private InMemoryRideRepository repository;
    private RideHistoryService history;

    private static RideSummary summary(String id, long startedAt, double distance, long moving) {
        return new RideSummary(id, "Ride " + id, startedAt, startedAt + moving, moving, moving,
                0, 0, 0, distance, 0, 0, 0);
    }

    @BeforeEach
    void setUp() {
        repository = new InMemoryRideRepository();
        history = new RideHistoryService(repository, new RideTrackingProperties());

        repository.saveSummary(summary("a", BASE, 5_000, 3_600_000));
        repository.saveSummary(summary("b", BASE + DAY, 20_000, 1_800_000));
        repository.saveSummary(summary("c", BASE + 2 * DAY, 12_000, 7_200_000));
    }

    private static List<String> ids(List<RideSummary> rides) {
        return rides.stream().map(RideSummary::rideId).toList();
    }

    @Test
    void list_sortsByPreference() {
        assertEquals(List.of("c", "b", "a"), ids(history.list(SortPreference.NEWEST_FIRST, null, null)));
        assertEquals(List.of("a", "b", "c"), ids(history.list(SortPreference.OLDEST_FIRST, null, null)));
        assertEquals(List.of("b", "c", "a"), ids(history.list(SortPreference.LONGEST_DISTANCE, null, null)));
        assertEquals(List.of("c", "a", "b"), ids(history.list(SortPreference.LONGEST_DURATION, null, null)));
    }

    @Test
    void list_filtersByStartTime() {
        List<RideSummary> rides = history.list(SortPreference.NEWEST_FIRST, BASE + DAY, BASE + 2 * DAY - 1);

        assertEquals(List.of("b"), ids(rides));
    }

    @Test
    void sortPreference_parse() {
        assertEquals(SortPreference.NEWEST_FIRST, SortPreference.parse(null));
        assertEquals(SortPreference.NEWEST_FIRST, SortPreference.parse(" "));
        assertEquals(SortPreference.LONGEST_DISTANCE, SortPreference.parse("longest_distance"));
        assertThrows(IllegalArgumentException.class, () -> SortPreference.parse("FASTEST"));
    }

    @Test
    void get_unknownRide_throwsNotFound() {
        assertThrows(RideNotFoundException.class, () -> history.get("nope"));
    }

    @Test
    void route_simplifiesStoredFixes() {
        for (int i = 0; i < 100; i++) {
            repository.appendFix("a", LocationFix.of(37.0 + i * 0.0001, -122.0, BASE + i * 1_000L));
        }

        RouteResponse route = history.route("a", null);

        assertEquals(2, route.points().size());
        assertEquals(100, route.originalPointCount());
        assertEquals(10.0, route.toleranceMeters());
        assertNotNull(route.bounds());
        assertEquals(1_100.8, route.lengthMeters(), 1.0);
    }

    @Test
    void route_singleFix_hasNoBounds() {
        repository.appendFix("b", LocationFix.of(37.0, -122.0, BASE));

        RouteResponse route = history.route("b", 5.0);

        assertEquals(1, route.points().size());
        assertNull(route.bounds());
        assertEquals(5.0, route.toleranceMeters());
    }

    @Test
    void delete_removesSummaryAndFixes() {
        repository.appendFix("a", LocationFix.of(37.0, -122.0, BASE));

        history.delete("a");

        assertNull(repository.findSummary("a"));
        assertTrue(repository.loadFixes("a").isEmpty());
        assertThrows(RideNotFoundException.class, () -> history.delete("a"));
    }
}
