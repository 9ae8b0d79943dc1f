package me.golemcore.meter.adapter.outbound.usage;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResetCountdownTest {

    private static final Instant NOW = Instant.parse("2026-03-10T06:00:00Z");

    @Test
    void shouldCountDownToResetLaterThisMonth() {
        assertEquals("6d 0h", ResetCountdown.untilDayOfMonth(16, NOW));
    }

    @Test
    void shouldRollOverToNextMonth() {
        assertEquals("26d 0h", ResetCountdown.untilDayOfMonth(5, NOW));
    }

    @Test
    void shouldRollOverWhenResetIsToday() {
        assertEquals("31d 0h", ResetCountdown.untilDayOfMonth(10, NOW));
    }

    @Test
    void shouldClampResetDay() {
        assertEquals(ResetCountdown.untilDayOfMonth(28, NOW), ResetCountdown.untilDayOfMonth(31, NOW));
        assertEquals(ResetCountdown.untilDayOfMonth(1, NOW), ResetCountdown.untilDayOfMonth(0, NOW));
    }

    @Test
    void shouldComputeMinutesUntilTimestamp() {
        assertEquals(90, ResetCountdown.minutesUntil("2026-03-10T07:30:00Z", NOW));
        assertEquals(60, ResetCountdown.minutesUntil("2026-03-10T07:00:00", NOW));
        assertEquals(0, ResetCountdown.minutesUntil("2026-03-10T05:00:00Z", NOW));
        assertEquals(0, ResetCountdown.minutesUntil("not a date", NOW));
        assertEquals(0, ResetCountdown.minutesUntil(null, NOW));
    }

    @Test
    void shouldFormatMinutes() {
        assertEquals("", ResetCountdown.formatMinutes(0));
        assertEquals("45m", ResetCountdown.formatMinutes(45));
        assertEquals("2h 5m", ResetCountdown.formatMinutes(125));
        assertEquals("1d 2h", ResetCountdown.formatMinutes(1560));
    }
}
