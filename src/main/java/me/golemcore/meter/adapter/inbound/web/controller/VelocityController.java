package me.golemcore.meter.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.meter.adapter.inbound.web.dto.VelocityResponse;
import me.golemcore.meter.domain.service.VelocityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Usage velocity and time-to-limit forecast.
 */
@RestController
@RequestMapping("/velocity")
@RequiredArgsConstructor
public class VelocityController {

    private static final String INSUFFICIENT_DATA = "Insufficient data";

    private final VelocityService velocityService;

    @GetMapping("/{serviceId}")
    public Mono<ResponseEntity<VelocityResponse>> getVelocity(@PathVariable String serviceId) {
        VelocityResponse response = velocityService.estimate(serviceId)
                .map(forecast -> VelocityResponse.builder()
                        .serviceId(serviceId)
                        .current(forecast.getCurrent())
                        .velocityPerHour(forecast.getVelocityPerHour())
                        .minutesToLimit(forecast.getMinutesToLimit())
                        .build())
                .orElseGet(() -> VelocityResponse.builder()
                        .serviceId(serviceId)
                        .error(INSUFFICIENT_DATA)
                        .build());
        return Mono.just(ResponseEntity.ok(response));
    }
}
