package me.golemcore.meter.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Cache entry wrapping a {@link UsageSnapshot} with the instant it was stored.
 * Freshness is evaluated at read time against the cache TTL.
 */
public record CachedSnapshot(UsageSnapshot snapshot, Instant storedAt) {

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }
}
