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

package me.golemcore.meter.adapter.outbound.usage;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Helpers for rendering time left until a quota resets.
 */
public final class ResetCountdown {

    private static final int MIN_RESET_DAY = 1;
    private static final int MAX_RESET_DAY = 28;
    private static final long MINUTES_PER_HOUR = 60;
    private static final long MINUTES_PER_DAY = 1440;

    private ResetCountdown() {
    }

    /**
     * Time until the next monthly reset on {@code resetDay} (clamped to
     * 1..28) at the current time of day, rendered as {@code "<d>d <h>h"}.
     */
    public static String untilDayOfMonth(int resetDay, Instant now) {
        ZonedDateTime current = now.atZone(ZoneOffset.UTC);
        int day = Math.max(MIN_RESET_DAY, Math.min(resetDay, MAX_RESET_DAY));
        ZonedDateTime reset = current.withDayOfMonth(day);
        if (!reset.isAfter(current)) {
            reset = reset.plusMonths(1);
        }
        Duration delta = Duration.between(current, reset);
        long days = delta.toDays();
        long hours = delta.minusDays(days).toHours();
        return days + "d " + hours + "h";
    }

    /**
     * Whole minutes from {@code now} until an ISO-8601 timestamp, floored at
     * zero. Timestamps without an offset are read as UTC; blank or
     * unparseable input yields zero.
     */
    public static long minutesUntil(String isoTimestamp, Instant now) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            return 0;
        }
        Instant reset;
        try {
            reset = OffsetDateTime.parse(isoTimestamp.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                reset = LocalDateTime.parse(isoTimestamp.trim()).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return 0;
            }
        }
        return Math.max(0, Duration.between(now, reset).toMinutes());
    }

    public static String formatMinutes(long minutes) {
        if (minutes <= 0) {
            return "";
        }
        if (minutes >= MINUTES_PER_DAY) {
            return minutes / MINUTES_PER_DAY + "d " + (minutes % MINUTES_PER_DAY) / MINUTES_PER_HOUR + "h";
        }
        if (minutes >= MINUTES_PER_HOUR) {
            return minutes / MINUTES_PER_HOUR + "h " + minutes % MINUTES_PER_HOUR + "m";
        }
        return minutes + "m";
    }
}
