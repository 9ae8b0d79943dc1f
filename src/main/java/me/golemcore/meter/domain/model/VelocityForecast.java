package me.golemcore.meter.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two-point linear extrapolation of a service's usage percentage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VelocityForecast {

    /** Usage is flat or decreasing, no time-to-limit can be given. */
    public static final long NO_FORECAST = -1;

    private double current;
    private double velocityPerHour;
    private long minutesToLimit;

    @JsonIgnore
    public boolean hasForecast() {
        return minutesToLimit != NO_FORECAST;
    }
}
