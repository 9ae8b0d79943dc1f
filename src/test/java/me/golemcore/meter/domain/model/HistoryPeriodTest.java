package me.golemcore.meter.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HistoryPeriodTest {

    @Test
    void shouldResolveKnownLabels() {
        assertEquals(HistoryPeriod.LAST_24_HOURS, HistoryPeriod.fromLabel("24h"));
        assertEquals(HistoryPeriod.LAST_7_DAYS, HistoryPeriod.fromLabel("7d"));
        assertEquals(HistoryPeriod.LAST_28_DAYS, HistoryPeriod.fromLabel("28d"));
        assertEquals(Duration.ofHours(672), HistoryPeriod.LAST_28_DAYS.getWindow());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "30d", "1w", "24H" })
    void shouldFallBackTo24HoursForUnknownLabels(String label) {
        assertEquals(HistoryPeriod.LAST_24_HOURS, HistoryPeriod.fromLabel(label));
    }
}
