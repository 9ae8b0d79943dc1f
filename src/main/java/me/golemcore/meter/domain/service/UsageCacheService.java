package me.golemcore.meter.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.CachedSnapshot;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest snapshot per service with a freshness window.
 *
 * <p>
 * Entries are never evicted; freshness is decided at read time by comparing
 * the entry's age with the configured TTL (60 seconds by default).
 */
@Service
@Slf4j
public class UsageCacheService {

    private final SharedStateLock stateLock;
    private final Clock clock;
    private final Duration ttl;

    private final Map<String, CachedSnapshot> entries = new HashMap<>();

    public UsageCacheService(SharedStateLock stateLock, MeterProperties properties, Clock clock) {
        this.stateLock = stateLock;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(properties.getCache().getTtlSeconds());
    }

    public void put(String serviceId, UsageSnapshot snapshot) {
        CachedSnapshot entry = new CachedSnapshot(snapshot, clock.instant());
        stateLock.runLocked(() -> entries.put(serviceId, entry));
        log.debug("[Cache] Stored snapshot for {} (error: {})", serviceId, !snapshot.isSuccessful());
    }

    public Optional<CachedSnapshot> get(String serviceId) {
        return stateLock.withLock(() -> Optional.ofNullable(entries.get(serviceId)));
    }

    /**
     * Returns the cached snapshot only if it is younger than the TTL.
     */
    public Optional<UsageSnapshot> getFresh(String serviceId) {
        return get(serviceId)
                .filter(this::isFresh)
                .map(CachedSnapshot::snapshot);
    }

    public boolean isFresh(CachedSnapshot entry) {
        return entry.age(clock.instant()).compareTo(ttl) < 0;
    }

    public Duration getTtl() {
        return ttl;
    }
}
