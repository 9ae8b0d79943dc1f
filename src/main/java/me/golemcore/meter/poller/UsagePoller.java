package me.golemcore.meter.poller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.service.RuntimeConfigService;
import me.golemcore.meter.domain.service.UsageService;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background poller that refreshes every enabled service on the configured
 * interval.
 *
 * <p>
 * This component runs a single scheduler thread that:
 * <ul>
 * <li>Runs a refresh cycle after the initial delay</li>
 * <li>Re-reads {@code refresh_interval} after each cycle, so interval changes
 * apply from the next cycle</li>
 * <li>Isolates failures: an error in one cycle never stops the poller</li>
 * </ul>
 *
 * <p>
 * On-demand refreshes ({@code POST /refresh}) run on a separate executor and
 * may overlap a scheduled cycle.
 *
 * @since 1.0
 * @see UsageService
 */
@Component
@Slf4j
public class UsagePoller {

    private static final int TERMINATION_TIMEOUT_SECONDS = 5;

    private final UsageService usageService;
    private final RuntimeConfigService runtimeConfigService;
    private final MeterProperties properties;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger refreshThreadCounter = new AtomicInteger();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "usage-poller");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService refreshExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "usage-refresh-" + refreshThreadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private ScheduledFuture<?> nextCycle;

    public UsagePoller(UsageService usageService, RuntimeConfigService runtimeConfigService,
            MeterProperties properties) {
        this.usageService = usageService;
        this.runtimeConfigService = runtimeConfigService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getPoller().isEnabled()) {
            log.info("[Poller] Background polling disabled");
            return;
        }
        start();
    }

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        int initialDelay = Math.max(0, properties.getPoller().getInitialDelaySeconds());
        scheduleNext(initialDelay);
        log.info("[Poller] Started (first cycle in {}s, interval {}s)", initialDelay,
                runtimeConfigService.getRefreshIntervalSeconds());
    }

    /**
     * Triggers an asynchronous refresh of all enabled services and returns
     * immediately.
     */
    public void requestRefresh() {
        if (stopped.get()) {
            log.debug("[Poller] Ignoring refresh request after shutdown");
            return;
        }
        try {
            refreshExecutor.execute(this::runCycle);
            log.debug("[Poller] On-demand refresh requested");
        } catch (RejectedExecutionException e) {
            log.debug("[Poller] Refresh rejected, executor is shut down");
        }
    }

    @PreDestroy
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (nextCycle != null) {
                nextCycle.cancel(false);
            }
        }
        shutdownAndAwait(scheduler);
        shutdownAndAwait(refreshExecutor);
        log.info("[Poller] Shut down");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    void runCycle() {
        try {
            usageService.refreshAllEnabled();
        } catch (RuntimeException e) {
            log.error("[Poller] Refresh cycle failed", e);
        }
    }

    private void tick() {
        if (stopped.get()) {
            return;
        }
        try {
            runCycle();
        } finally {
            scheduleNext(runtimeConfigService.getRefreshIntervalSeconds());
        }
    }

    private synchronized void scheduleNext(long delaySeconds) {
        if (stopped.get()) {
            return;
        }
        try {
            nextCycle = scheduler.schedule(this::tick, delaySeconds, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Poller] Scheduler is shut down, next cycle not scheduled");
        }
    }

    private static void shutdownAndAwait(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
