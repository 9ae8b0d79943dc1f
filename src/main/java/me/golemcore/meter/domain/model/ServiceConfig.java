package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-service settings. Besides {@code enabled}, adapters read their own
 * keys ({@code reset_day}, {@code label}, ...) from the flattened settings
 * map; unknown keys are kept so they survive a config round-trip.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServiceConfig {

    public static final String RESET_DAY = "reset_day";
    public static final String LABEL = "label";
    public static final String BROWSER = "browser";
    public static final String PROFILE_PATH = "profile_path";

    private boolean enabled;

    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getSettings() {
        return settings;
    }

    @JsonAnySetter
    public void putSetting(String key, Object value) {
        if (settings == null) {
            settings = new LinkedHashMap<>();
        }
        settings.put(key, value);
    }

    public Optional<String> getString(String key) {
        Object value = settings != null ? settings.get(key) : null;
        if (value == null) {
            return Optional.empty();
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public int getInt(String key, int defaultValue) {
        Object value = settings != null ? settings.get(key) : null;
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
