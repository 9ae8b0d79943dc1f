package me.golemcore.meter.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body shared by all gateway endpoints: {@code {"error": "..."}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorResponse {
    private String error;

    public static ApiErrorResponse of(String error) {
        return new ApiErrorResponse(error);
    }
}
