package me.golemcore.meter.domain.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.ServiceConfig;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.UsageAdapterPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates fetching, caching and recording of service usage.
 *
 * <p>
 * A refresh reads the service's settings, calls its adapter outside of the
 * shared lock with a wall-clock bound, stores the result in the cache and, if
 * it succeeded, appends it to the history. Adapter faults and timeouts become
 * error snapshots; they never reach the caller and never enter the history.
 */
@Service
@Slf4j
public class UsageService {

    private static final String LOG_PREFIX = "[Usage]";
    static final String NOT_YET_POLLED = "Not yet polled";

    private final ServiceAdapterRegistry adapterRegistry;
    private final RuntimeConfigService runtimeConfigService;
    private final UsageCacheService cacheService;
    private final UsageHistoryService historyService;
    private final Clock clock;
    private final long fetchTimeoutMillis;

    private final AtomicInteger fetchThreadCounter = new AtomicInteger();
    private final ExecutorService fetchExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "usage-fetch-" + fetchThreadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public UsageService(ServiceAdapterRegistry adapterRegistry, RuntimeConfigService runtimeConfigService,
            UsageCacheService cacheService, UsageHistoryService historyService, MeterProperties properties,
            Clock clock) {
        this.adapterRegistry = adapterRegistry;
        this.runtimeConfigService = runtimeConfigService;
        this.cacheService = cacheService;
        this.historyService = historyService;
        this.clock = clock;
        this.fetchTimeoutMillis = properties.getHttp().getFetchTimeout();
    }

    @PreDestroy
    void destroy() {
        fetchExecutor.shutdownNow();
    }

    /**
     * Fetches fresh usage for one service, bypassing the cache.
     *
     * @throws me.golemcore.meter.domain.model.UnknownServiceException
     *             if no adapter is registered for the id
     */
    public UsageSnapshot refresh(String serviceId) {
        UsageAdapterPort adapter = adapterRegistry.require(serviceId);
        ServiceConfig config = runtimeConfigService.getServiceConfig(serviceId).orElseGet(ServiceConfig::new);
        return refresh(adapter, config);
    }

    /**
     * Refreshes every enabled service with a registered adapter. A failure of
     * one service is recorded as its error snapshot and does not stop the
     * others.
     */
    public void refreshAllEnabled() {
        Map<String, ServiceConfig> services = runtimeConfigService.getEnabledServices();
        int refreshed = 0;
        for (Map.Entry<String, ServiceConfig> service : services.entrySet()) {
            String serviceId = service.getKey();
            if (!adapterRegistry.isKnown(serviceId)) {
                log.debug("{} Skipping enabled service without adapter: {}", LOG_PREFIX, serviceId);
                continue;
            }
            try {
                refresh(adapterRegistry.require(serviceId), service.getValue());
                refreshed++;
            } catch (RuntimeException e) {
                log.error("{} Refresh failed for {}: {}", LOG_PREFIX, serviceId, e.getMessage(), e);
                cacheService.put(serviceId,
                        UsageSnapshot.error(serviceId, serviceId, e.getMessage(), clock.instant()));
            }
        }
        log.debug("{} Refreshed {} of {} enabled services", LOG_PREFIX, refreshed, services.size());
    }

    /**
     * Returns the cached snapshot while it is fresh, otherwise fetches
     * synchronously.
     */
    public UsageSnapshot getCurrent(String serviceId) {
        adapterRegistry.require(serviceId);
        return cacheService.getFresh(serviceId).orElseGet(() -> refresh(serviceId));
    }

    /**
     * Last known snapshot of every enabled service, in configuration order,
     * regardless of freshness. Services never polled, including enabled ids
     * without an adapter, are reported as {@value #NOT_YET_POLLED} errors.
     */
    public List<UsageSnapshot> getAllEnabled() {
        List<UsageSnapshot> snapshots = new ArrayList<>();
        for (String serviceId : runtimeConfigService.getEnabledServices().keySet()) {
            UsageSnapshot snapshot = cacheService.get(serviceId)
                    .map(entry -> entry.snapshot())
                    .orElseGet(() -> UsageSnapshot.error(serviceId, serviceId, NOT_YET_POLLED, clock.instant()));
            snapshots.add(snapshot);
        }
        return snapshots;
    }

    private UsageSnapshot refresh(UsageAdapterPort adapter, ServiceConfig config) {
        String serviceId = adapter.getServiceId();
        UsageSnapshot snapshot = sanitize(serviceId, fetchWithTimeout(adapter, config));

        cacheService.put(serviceId, snapshot);
        if (snapshot.isSuccessful()) {
            historyService.append(serviceId, snapshot.getPercentage(), snapshot.getDetails());
            log.debug("{} {} at {}%", LOG_PREFIX, serviceId, snapshot.getPercentage());
        } else {
            log.warn("{} {} returned error: {}", LOG_PREFIX, serviceId, snapshot.getError());
        }
        return snapshot;
    }

    private UsageSnapshot fetchWithTimeout(UsageAdapterPort adapter, ServiceConfig config) {
        String serviceId = adapter.getServiceId();
        CompletableFuture<UsageSnapshot> future = CompletableFuture.supplyAsync(() -> adapter.fetch(config),
                fetchExecutor);
        try {
            UsageSnapshot snapshot = future.get(fetchTimeoutMillis, TimeUnit.MILLISECONDS);
            if (snapshot == null) {
                return UsageSnapshot.error(serviceId, serviceId, "Adapter returned no data", clock.instant());
            }
            return snapshot;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} Fetch for {} timed out after {}ms", LOG_PREFIX, serviceId, fetchTimeoutMillis);
            return UsageSnapshot.error(serviceId, serviceId,
                    "Connection failed: timed out after " + fetchTimeoutMillis + "ms", clock.instant());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("{} Adapter {} failed", LOG_PREFIX, serviceId, cause);
            return UsageSnapshot.error(serviceId, serviceId, String.valueOf(cause.getMessage()), clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return UsageSnapshot.error(serviceId, serviceId, "Interrupted", clock.instant());
        }
    }

    private UsageSnapshot sanitize(String serviceId, UsageSnapshot snapshot) {
        Instant now = clock.instant();
        String name = snapshot.getName() != null ? snapshot.getName() : serviceId;
        if (!snapshot.isSuccessful()) {
            return UsageSnapshot.error(serviceId, name, snapshot.getError(),
                    snapshot.getLastUpdated() != null ? snapshot.getLastUpdated() : now);
        }
        return snapshot.toBuilder()
                .serviceId(serviceId)
                .name(name)
                .percentage(UsageSnapshot.clampPercentage(snapshot.getPercentage()))
                .details(snapshot.getDetails() != null ? snapshot.getDetails() : new LinkedHashMap<>())
                .lastUpdated(snapshot.getLastUpdated() != null ? snapshot.getLastUpdated() : now)
                .build();
    }
}
