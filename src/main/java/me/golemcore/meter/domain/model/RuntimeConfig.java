package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted daemon configuration. Stored in {@code config/config.json} and
 * editable at runtime through the gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RuntimeConfig {

    public static final int DEFAULT_REFRESH_INTERVAL_SECONDS = 300;

    @Builder.Default
    private int refreshInterval = DEFAULT_REFRESH_INTERVAL_SECONDS;

    @Builder.Default
    private Map<String, ServiceConfig> services = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> additional = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return additional;
    }

    @JsonAnySetter
    public void putAdditional(String key, Object value) {
        if (additional == null) {
            additional = new LinkedHashMap<>();
        }
        additional.put(key, value);
    }
}
