package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One time-series point of a service's usage history. Adapter-specific
 * counters are flattened into the entry next to {@code timestamp} and
 * {@code value}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({ "timestamp", "value" })
public class HistoryEntry {

    private static final Set<String> RESERVED_KEYS = Set.of("timestamp", "value");

    private Instant timestamp;
    private double value;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object fieldValue) {
        if (key == null || RESERVED_KEYS.contains(key)) {
            return;
        }
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, fieldValue);
    }
}
