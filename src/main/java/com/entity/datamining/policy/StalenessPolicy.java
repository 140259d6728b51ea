package com.entity.datamining.policy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-field time-to-live for locally stored values.
 * A field without a TTL is fresh whenever it is present.
 */
public class StalenessPolicy {

    private final Map<String, Duration> ttls;
    private final Clock clock;

    public StalenessPolicy(Map<String, Duration> ttls, Clock clock) {
        Objects.requireNonNull(ttls, "ttls is required");
        ttls.forEach((field, ttl) -> {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("TTL for " + field + " must be positive");
            }
        });
        this.ttls = Map.copyOf(ttls);
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Presence-only policy: nothing ever goes stale.
     */
    public static StalenessPolicy presenceOnly() {
        return new StalenessPolicy(Map.of(), Clock.systemUTC());
    }

    public boolean hasTtl(String field) {
        return ttls.containsKey(field);
    }

    /**
     * Checks whether a present value is too old to serve.
     * A field with a TTL but no recorded update time is treated as stale.
     *
     * @param field     the field wire name
     * @param updatedAt when the value was last written, if known
     */
    public boolean isStale(String field, Optional<Instant> updatedAt) {
        Duration ttl = ttls.get(field);
        if (ttl == null) {
            return false;
        }
        return updatedAt
                .map(at -> at.plus(ttl).isBefore(clock.instant()))
                .orElse(true);
    }
}
