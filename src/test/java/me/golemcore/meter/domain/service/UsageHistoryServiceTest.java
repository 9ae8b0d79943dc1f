package me.golemcore.meter.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.meter.domain.model.HistoryEntry;
import me.golemcore.meter.domain.model.HistoryPeriod;
import me.golemcore.meter.infrastructure.config.AutoConfiguration;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import me.golemcore.meter.port.outbound.StoragePort;
import me.golemcore.meter.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UsageHistoryServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final TypeReference<Map<String, List<Map<String, Object>>>> RAW_TYPE = new TypeReference<>() {
    };

    private StoragePort storagePort;
    private Map<String, String> files;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private UsageHistoryService historyService;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        files = new ConcurrentHashMap<>();
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenAnswer(invocation -> {
                    files.put(invocation.getArgument(0) + "/" + invocation.getArgument(1),
                            invocation.getArgument(2));
                    return CompletableFuture.completedFuture(null);
                });
        when(storagePort.getText(anyString(), anyString()))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(
                        files.get(invocation.getArgument(0) + "/" + invocation.getArgument(1))));

        objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(START);
        historyService = newService();
    }

    @Test
    void shouldRoundValueAndFlattenDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("hourly", 7);

        HistoryEntry entry = historyService.append("serpapi", 12.345, details);

        assertEquals(12.3, entry.getValue());
        assertEquals(START, entry.getTimestamp());
        assertEquals(7, entry.getExtra().get("hourly"));
    }

    @Test
    void shouldPersistWholeHistoryAfterAppend() throws Exception {
        historyService.append("firecrawl", 10, Map.of());
        clock.advance(Duration.ofMinutes(5));
        historyService.append("serpapi", 20, Map.of("hourly", 3));

        String json = files.get("history/history.json");
        Map<String, List<Map<String, Object>>> raw = objectMapper.readValue(json, RAW_TYPE);

        assertEquals(1, raw.get("firecrawl").size());
        assertEquals("2026-03-01T12:00:00Z", raw.get("firecrawl").get(0).get("timestamp"));
        assertEquals(3, raw.get("serpapi").get(0).get("hourly"));
    }

    @Test
    void shouldKeepTimestampsNonDecreasingWhenClockStepsBack() {
        historyService.append("firecrawl", 10, Map.of());
        clock.advance(Duration.ofMinutes(-10));

        HistoryEntry second = historyService.append("firecrawl", 11, Map.of());

        assertEquals(START, second.getTimestamp());
        List<HistoryEntry> all = historyService.getAll("firecrawl");
        assertFalse(all.get(1).getTimestamp().isBefore(all.get(0).getTimestamp()));
    }

    @Test
    void shouldPruneEntriesOutsideRetentionOnAppend() {
        historyService.append("firecrawl", 10, Map.of());
        clock.advance(Duration.ofDays(28).plusMinutes(1));

        historyService.append("firecrawl", 50, Map.of());

        List<HistoryEntry> all = historyService.getAll("firecrawl");
        assertEquals(1, all.size());
        assertEquals(50.0, all.get(0).getValue());
    }

    @Test
    void shouldFilterQueryByPeriod() {
        historyService.append("claude_work", 5, Map.of());
        clock.advance(Duration.ofDays(3));
        historyService.append("claude_work", 15, Map.of());
        clock.advance(Duration.ofHours(23));
        historyService.append("claude_work", 25, Map.of());

        assertEquals(2, historyService.query("claude_work", HistoryPeriod.LAST_24_HOURS).size());
        assertEquals(3, historyService.query("claude_work", HistoryPeriod.LAST_7_DAYS).size());
        assertEquals(3, historyService.query("claude_work", HistoryPeriod.LAST_28_DAYS).size());
    }

    @Test
    void shouldReturnEmptyListForUnknownService() {
        assertTrue(historyService.query("nope", HistoryPeriod.LAST_24_HOURS).isEmpty());
        assertTrue(historyService.getAll("nope").isEmpty());
    }

    @Test
    void shouldReloadPersistedHistoryDroppingExpiredEntries() {
        historyService.append("firecrawl", 10, Map.of());
        clock.advance(Duration.ofDays(20));
        historyService.append("firecrawl", 20, Map.of());
        clock.advance(Duration.ofDays(10));

        UsageHistoryService reloaded = newService();
        reloaded.load();

        List<HistoryEntry> all = reloaded.getAll("firecrawl");
        assertEquals(1, all.size());
        assertEquals(20.0, all.get(0).getValue());
    }

    @Test
    void shouldStartEmptyWhenHistoryFileIsCorrupt() {
        files.put("history/history.json", "{not json");

        historyService.load();

        assertTrue(historyService.getAll("firecrawl").isEmpty());
    }

    @Test
    void shouldKeepInMemoryEntryWhenPersistenceFails() {
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        historyService.append("firecrawl", 33.3, Map.of());

        assertEquals(1, historyService.getAll("firecrawl").size());
    }

    private UsageHistoryService newService() {
        return new UsageHistoryService(new SharedStateLock(), storagePort, objectMapper, new MeterProperties(),
                clock);
    }
}
