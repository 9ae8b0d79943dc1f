package me.golemcore.meter.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.meter.adapter.inbound.web.dto.HistoryResponse;
import me.golemcore.meter.domain.model.HistoryPeriod;
import me.golemcore.meter.domain.service.UsageHistoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Usage history endpoints.
 */
@RestController
@RequestMapping("/history")
@RequiredArgsConstructor
public class HistoryController {

    private final UsageHistoryService historyService;

    @GetMapping("/{serviceId}")
    public Mono<ResponseEntity<HistoryResponse>> getHistory(
            @PathVariable String serviceId,
            @RequestParam(required = false) String period) {
        HistoryPeriod resolved = HistoryPeriod.fromLabel(period);
        HistoryResponse response = HistoryResponse.builder()
                .serviceId(serviceId)
                .period(resolved.getLabel())
                .data(historyService.query(serviceId, resolved))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
