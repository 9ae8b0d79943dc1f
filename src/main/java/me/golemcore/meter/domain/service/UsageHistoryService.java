package me.golemcore.meter.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.domain.model.HistoryEntry;
import me.golemcore.meter.domain.model.HistoryPeriod;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-service usage time series with a rolling retention window.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Append-only series with non-decreasing timestamps per service</li>
 * <li>Values rounded to one decimal; snapshot details flattened into the
 * entry</li>
 * <li>Pruning of the affected series on every append (28 days by
 * default)</li>
 * <li>Whole history persisted to {@code history/history.json} after each
 * append</li>
 * </ul>
 *
 * <p>
 * Persistence failures are logged and never fail an append; the in-memory
 * series remains authoritative.
 */
@Service
@Slf4j
public class UsageHistoryService {

    private static final String LOG_PREFIX = "[History]";
    private static final String HISTORY_FILE = "history.json";
    private static final TypeReference<Map<String, List<HistoryEntry>>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final SharedStateLock stateLock;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration retention;
    private final String historyDir;

    private final Map<String, List<HistoryEntry>> series = new LinkedHashMap<>();
    private final ReentrantLock persistLock = new ReentrantLock();

    public UsageHistoryService(SharedStateLock stateLock, StoragePort storagePort, ObjectMapper objectMapper,
            MeterProperties properties, Clock clock) {
        this.stateLock = stateLock;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retention = Duration.ofDays(properties.getHistory().getRetentionDays());
        this.historyDir = properties.getStorage().getDirectories().getHistory();
    }

    @PostConstruct
    public void init() {
        load();
    }

    /**
     * Loads persisted history, dropping entries already outside retention. A
     * missing or corrupt file yields an empty history.
     */
    public void load() {
        Map<String, List<HistoryEntry>> loaded;
        try {
            String json = storagePort.getText(historyDir, HISTORY_FILE).join();
            if (json == null || json.isBlank()) {
                log.info("{} No persisted history found, starting empty", LOG_PREFIX);
                return;
            }
            loaded = objectMapper.readValue(json, HISTORY_TYPE);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load history, starting empty: {}", LOG_PREFIX, e.getMessage());
            return;
        }

        if (loaded == null) {
            return;
        }
        Map<String, List<HistoryEntry>> persisted = loaded;
        Instant cutoff = clock.instant().minus(retention);
        int[] kept = { 0 };
        stateLock.runLocked(() -> {
            series.clear();
            persisted.forEach((serviceId, entries) -> {
                if (serviceId == null || entries == null) {
                    return;
                }
                List<HistoryEntry> retained = new ArrayList<>();
                for (HistoryEntry entry : entries) {
                    if (entry != null && entry.getTimestamp() != null && entry.getTimestamp().isAfter(cutoff)) {
                        retained.add(entry);
                    }
                }
                series.put(serviceId, retained);
                kept[0] += retained.size();
            });
        });
        log.info("{} Loaded {} history entries for {} services", LOG_PREFIX, kept[0], persisted.size());
    }

    /**
     * Records a successful measurement and persists the whole history.
     *
     * @param serviceId
     *            service the measurement belongs to
     * @param value
     *            usage percentage, rounded to one decimal before storing
     * @param extra
     *            snapshot details flattened into the entry
     * @return the stored entry
     */
    public HistoryEntry append(String serviceId, double value, Map<String, Object> extra) {
        HistoryEntry entry = stateLock.withLock(() -> {
            Instant now = clock.instant();
            List<HistoryEntry> entries = series.computeIfAbsent(serviceId, id -> new ArrayList<>());
            Instant timestamp = now;
            if (!entries.isEmpty()) {
                Instant last = entries.get(entries.size() - 1).getTimestamp();
                if (last != null && last.isAfter(now)) {
                    timestamp = last;
                }
            }

            HistoryEntry created = HistoryEntry.builder()
                    .timestamp(timestamp)
                    .value(roundToTenth(value))
                    .build();
            if (extra != null) {
                extra.forEach(created::putExtra);
            }
            entries.add(created);

            Instant cutoff = now.minus(retention);
            entries.removeIf(e -> !e.getTimestamp().isAfter(cutoff));
            return created;
        });
        persist();
        return entry;
    }

    /**
     * Returns the service's entries with {@code timestamp > now - window}, in
     * chronological order. Unknown services yield an empty list.
     */
    public List<HistoryEntry> query(String serviceId, HistoryPeriod period) {
        Instant cutoff = clock.instant().minus(period.getWindow());
        return stateLock.withLock(() -> {
            List<HistoryEntry> entries = series.get(serviceId);
            if (entries == null) {
                return List.<HistoryEntry>of();
            }
            return entries.stream()
                    .filter(e -> e.getTimestamp().isAfter(cutoff))
                    .toList();
        });
    }

    /**
     * Returns the full retained series for a service.
     */
    public List<HistoryEntry> getAll(String serviceId) {
        return stateLock.withLock(() -> {
            List<HistoryEntry> entries = series.get(serviceId);
            return entries != null ? List.copyOf(entries) : List.<HistoryEntry>of();
        });
    }

    /**
     * Writes the whole history. Writers are serialized and each one copies the
     * series after acquiring the write lock, so the file always ends up with
     * the newest state.
     */
    void persist() {
        persistLock.lock();
        try {
            Map<String, List<HistoryEntry>> copy = stateLock.withLock(() -> {
                Map<String, List<HistoryEntry>> snapshot = new LinkedHashMap<>();
                series.forEach((id, entries) -> snapshot.put(id, List.copyOf(entries)));
                return snapshot;
            });
            String json = objectMapper.writeValueAsString(copy);
            storagePort.putTextAtomic(historyDir, HISTORY_FILE, json, false).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("{} Failed to persist history: {}", LOG_PREFIX, e.getMessage());
        } finally {
            persistLock.unlock();
        }
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
