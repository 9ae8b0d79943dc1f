package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Query windows supported by the history endpoint.
 */
public enum HistoryPeriod {

    LAST_24_HOURS("24h", Duration.ofHours(24)),

    LAST_7_DAYS("7d", Duration.ofHours(168)),

    LAST_28_DAYS("28d", Duration.ofHours(672));

    private final String label;
    private final Duration window;

    HistoryPeriod(String label, Duration window) {
        this.label = label;
        this.window = window;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Resolves a request parameter; unknown or missing values fall back to
     * {@link #LAST_24_HOURS}.
     */
    public static HistoryPeriod fromLabel(String label) {
        if (label != null) {
            for (HistoryPeriod period : values()) {
                if (period.label.equals(label.trim())) {
                    return period;
                }
            }
        }
        return LAST_24_HOURS;
    }
}
