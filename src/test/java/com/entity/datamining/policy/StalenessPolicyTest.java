package com.entity.datamining.policy;

import com.entity.datamining.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StalenessPolicyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final StalenessPolicy policy = new StalenessPolicy(Map.of("metrics", Duration.ofHours(1)), clock);

    @Test
    @DisplayName("Fields without a TTL should never be stale")
    void noTtlIsFresh() {
        assertFalse(policy.hasTtl("bio"));
        assertFalse(policy.isStale("bio", Optional.empty()));
        assertFalse(policy.isStale("bio", Optional.of(NOW.minus(Duration.ofDays(365)))));
    }

    @Test
    @DisplayName("Values younger than the TTL should be fresh")
    void youngValueIsFresh() {
        assertFalse(policy.isStale("metrics", Optional.of(NOW.minus(Duration.ofMinutes(59)))));
        assertFalse(policy.isStale("metrics", Optional.of(NOW.minus(Duration.ofHours(1)))));
    }

    @Test
    @DisplayName("Values older than the TTL should be stale")
    void oldValueIsStale() {
        assertTrue(policy.isStale("metrics", Optional.of(NOW.minus(Duration.ofMinutes(61)))));
    }

    @Test
    @DisplayName("Values with a TTL but no recorded update time should be stale")
    void unknownAgeIsStale() {
        assertTrue(policy.isStale("metrics", Optional.empty()));
    }

    @Test
    @DisplayName("Presence-only policy should have no TTLs")
    void presenceOnly() {
        StalenessPolicy presenceOnly = StalenessPolicy.presenceOnly();
        assertFalse(presenceOnly.hasTtl("metrics"));
        assertFalse(presenceOnly.isStale("metrics", Optional.empty()));
    }

    @Test
    @DisplayName("Should reject non-positive TTLs")
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class,
                () -> new StalenessPolicy(Map.of("metrics", Duration.ZERO), clock));
    }
}
