package me.golemcore.meter.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.meter.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.meter.poller.UsagePoller;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Liveness and on-demand refresh endpoints.
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final UsagePoller usagePoller;

    @GetMapping("/health")
    public Mono<ResponseEntity<StatusResponse>> health() {
        return Mono.just(ResponseEntity.ok(new StatusResponse("ok")));
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<StatusResponse>> refresh() {
        usagePoller.requestRefresh();
        return Mono.just(ResponseEntity.ok(new StatusResponse("refreshing")));
    }
}
