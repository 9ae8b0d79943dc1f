package me.golemcore.meter.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.HistoryEntry;
import me.golemcore.meter.domain.model.VelocityForecast;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Estimates usage growth per hour and time until a service reaches 100%.
 *
 * <p>
 * Uses the first and last point of the entries recorded within the last hour.
 * When that window holds fewer than two points, the last ten entries of the
 * series are used instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VelocityService {

    private static final int MIN_POINTS = 2;
    private static final int FALLBACK_POINTS = 10;
    private static final Duration RECENT_WINDOW = Duration.ofHours(1);
    private static final double LIMIT_PERCENTAGE = 100.0;
    private static final double MILLIS_PER_HOUR = 3_600_000.0;
    private static final double MINUTES_PER_HOUR = 60.0;

    private final UsageHistoryService historyService;
    private final Clock clock;

    /**
     * @return the forecast, or empty when there is not enough data (fewer than
     *         two points, or no time elapsed between the chosen points)
     */
    public Optional<VelocityForecast> estimate(String serviceId) {
        List<HistoryEntry> all = historyService.getAll(serviceId);
        if (all.size() < MIN_POINTS) {
            return Optional.empty();
        }

        Instant cutoff = clock.instant().minus(RECENT_WINDOW);
        List<HistoryEntry> window = all.stream()
                .filter(e -> e.getTimestamp().isAfter(cutoff))
                .toList();
        if (window.size() < MIN_POINTS) {
            window = all.subList(Math.max(0, all.size() - FALLBACK_POINTS), all.size());
        }

        HistoryEntry first = window.get(0);
        HistoryEntry last = window.get(window.size() - 1);
        double hours = Duration.between(first.getTimestamp(), last.getTimestamp()).toMillis() / MILLIS_PER_HOUR;
        if (hours <= 0) {
            log.debug("[Velocity] No elapsed time between points for {}", serviceId);
            return Optional.empty();
        }

        double current = last.getValue();
        double velocity = (current - first.getValue()) / hours;

        long minutesToLimit;
        if (velocity <= 0) {
            minutesToLimit = VelocityForecast.NO_FORECAST;
        } else if (current >= LIMIT_PERCENTAGE) {
            minutesToLimit = 0;
        } else {
            minutesToLimit = (long) Math.floor((LIMIT_PERCENTAGE - current) / velocity * MINUTES_PER_HOUR);
        }

        return Optional.of(VelocityForecast.builder()
                .current(current)
                .velocityPerHour(Math.round(velocity * 100.0) / 100.0)
                .minutesToLimit(minutesToLimit)
                .build());
    }
}
