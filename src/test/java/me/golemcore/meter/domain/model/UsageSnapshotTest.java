package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.meter.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageSnapshotTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @Test
    void shouldBuildErrorSnapshotWithFixedDefaults() {
        UsageSnapshot snapshot = UsageSnapshot.error("firecrawl", "Firecrawl", "Invalid API key", NOW);

        assertFalse(snapshot.isSuccessful());
        assertEquals(0.0, snapshot.getPercentage());
        assertEquals(0.0, snapshot.getUsed());
        assertEquals(1.0, snapshot.getTotal());
        assertEquals("", snapshot.getIcon());
        assertEquals("", snapshot.getUnit());
        assertEquals("", snapshot.getPlanName());
        assertEquals("", snapshot.getResetInfo());
        assertTrue(snapshot.getDetails().isEmpty());
        assertEquals(NOW, snapshot.getLastUpdated());
    }

    @Test
    void shouldNeverProduceErrorSnapshotWithEmptyError() {
        UsageSnapshot snapshot = UsageSnapshot.error("serpapi", "SerpAPI", "  ", NOW);

        assertFalse(snapshot.isSuccessful());
        assertEquals("Unknown error", snapshot.getError());
    }

    @Test
    void shouldClampPercentage() {
        assertEquals(0.0, UsageSnapshot.clampPercentage(-5));
        assertEquals(100.0, UsageSnapshot.clampPercentage(140));
        assertEquals(42.5, UsageSnapshot.clampPercentage(42.5));
        assertEquals(0.0, UsageSnapshot.clampPercentage(Double.NaN));
    }

    @Test
    void shouldSerializeWithSnakeCaseFields() throws Exception {
        UsageSnapshot snapshot = UsageSnapshot.builder()
                .serviceId("serpapi")
                .name("SerpAPI")
                .percentage(12.5)
                .used(125)
                .total(1000)
                .planName("Developer")
                .resetInfo("3d 4h")
                .lastUpdated(NOW)
                .build();

        Map<?, ?> json = objectMapper.readValue(objectMapper.writeValueAsString(snapshot), Map.class);

        assertEquals("serpapi", json.get("service_id"));
        assertEquals("Developer", json.get("plan_name"));
        assertEquals("3d 4h", json.get("reset_info"));
        assertEquals("2026-03-01T12:00:00Z", json.get("last_updated"));
        assertEquals("", json.get("error"));
        assertFalse(json.containsKey("successful"));
    }
}
