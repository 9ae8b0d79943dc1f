package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time normalized usage reading for one metered service.
 *
 * <p>
 * A snapshot is either successful ({@code error} is empty) or an error
 * snapshot carrying the fixed defaults {@code percentage=0, used=0, total=1}
 * and a human-readable reason. {@code lastUpdated} is always set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UsageSnapshot {

    public static final double MIN_PERCENTAGE = 0.0;
    public static final double MAX_PERCENTAGE = 100.0;

    private String serviceId;
    private String name;
    @Builder.Default
    private String icon = "";
    private double percentage;
    private double used;
    @Builder.Default
    private double total = 1;
    @Builder.Default
    private String unit = "";
    @Builder.Default
    private String planName = "";
    @Builder.Default
    private String resetInfo = "";
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
    @Builder.Default
    private String error = "";
    private Instant lastUpdated;

    /**
     * Creates an error snapshot with the fixed error defaults.
     */
    public static UsageSnapshot error(String serviceId, String name, String error, Instant lastUpdated) {
        return UsageSnapshot.builder()
                .serviceId(serviceId)
                .name(name)
                .percentage(0)
                .used(0)
                .total(1)
                .error(error != null && !error.isBlank() ? error : "Unknown error")
                .lastUpdated(lastUpdated)
                .build();
    }

    public static double clampPercentage(double value) {
        if (Double.isNaN(value)) {
            return MIN_PERCENTAGE;
        }
        return Math.max(MIN_PERCENTAGE, Math.min(MAX_PERCENTAGE, value));
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null || error.isEmpty();
    }
}
