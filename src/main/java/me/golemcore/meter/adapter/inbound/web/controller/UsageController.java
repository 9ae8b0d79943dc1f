package me.golemcore.meter.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.meter.adapter.inbound.web.dto.UsageListResponse;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.domain.service.UsageService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Current usage snapshots.
 */
@RestController
@RequestMapping("/usage")
@RequiredArgsConstructor
public class UsageController {

    private final UsageService usageService;

    @GetMapping
    public Mono<ResponseEntity<UsageListResponse>> getAll() {
        return Mono.just(ResponseEntity.ok(new UsageListResponse(usageService.getAllEnabled())));
    }

    /**
     * Serves the cached snapshot while fresh; otherwise fetches from the vendor
     * on a worker thread.
     */
    @GetMapping("/{serviceId}")
    public Mono<ResponseEntity<UsageSnapshot>> getOne(@PathVariable String serviceId) {
        return Mono.fromCallable(() -> usageService.getCurrent(serviceId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
