package me.golemcore.meter.adapter.inbound.web.controller;

import me.golemcore.meter.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.meter.domain.model.UnknownServiceException;
import me.golemcore.meter.domain.model.UsageSnapshot;
import me.golemcore.meter.domain.service.UsageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UsageControllerWebTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private UsageService usageService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        usageService = mock(UsageService.class);
        webTestClient = WebTestClient.bindToController(new UsageController(usageService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldListEnabledServices() {
        UsageSnapshot firecrawl = UsageSnapshot.builder()
                .serviceId("firecrawl")
                .name("Firecrawl")
                .percentage(25.0)
                .used(250)
                .total(1000)
                .unit("credits")
                .planName("1,000 credits/mo")
                .lastUpdated(NOW)
                .build();
        UsageSnapshot serpapi = UsageSnapshot.error("serpapi", "serpapi", "Not yet polled", NOW);
        when(usageService.getAllEnabled()).thenReturn(List.of(firecrawl, serpapi));

        webTestClient.get()
                .uri("/usage")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.services.length()").isEqualTo(2)
                .jsonPath("$.services[0].service_id").isEqualTo("firecrawl")
                .jsonPath("$.services[0].percentage").isEqualTo(25.0)
                .jsonPath("$.services[0].plan_name").isEqualTo("1,000 credits/mo")
                .jsonPath("$.services[0].error").isEqualTo("")
                .jsonPath("$.services[1].error").isEqualTo("Not yet polled");
    }

    @Test
    void shouldReturnSingleSnapshot() {
        when(usageService.getCurrent("firecrawl"))
                .thenReturn(UsageSnapshot.error("firecrawl", "Firecrawl", "Invalid API key", NOW));

        webTestClient.get()
                .uri("/usage/firecrawl")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("Firecrawl")
                .jsonPath("$.error").isEqualTo("Invalid API key")
                .jsonPath("$.percentage").isEqualTo(0.0);
    }

    @Test
    void shouldReturnNotFoundForUnknownService() {
        when(usageService.getCurrent("nope")).thenThrow(new UnknownServiceException("nope"));

        webTestClient.get()
                .uri("/usage/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Unknown service: nope");
    }
}
