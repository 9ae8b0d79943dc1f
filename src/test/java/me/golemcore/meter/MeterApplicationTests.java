package me.golemcore.meter;

import me.golemcore.meter.domain.service.ServiceAdapterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "meter.poller.enabled=false",
        "server.address=127.0.0.1"
})
@ActiveProfiles("test")
class MeterApplicationTests {

    @TempDir
    static Path storageDir;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("meter.storage.local.base-path", () -> storageDir.toString());
    }

    @Autowired
    private ServiceAdapterRegistry adapterRegistry;

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void shouldRegisterAllServiceAdapters() {
        assertEquals(List.of("claude_private", "claude_work", "firecrawl", "serpapi"),
                adapterRegistry.getServiceIds().stream().sorted().toList());
    }

    @Test
    void shouldServeHealthAndDefaultConfig() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.status").isEqualTo("ok");

        webTestClient.get().uri("/config")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.refresh_interval").isEqualTo(300);

        assertTrue(Files.exists(storageDir.resolve("config/config.json")));
    }

    @Test
    void shouldRenderUnknownRoutesAsNotFound() {
        webTestClient.get().uri("/does-not-exist")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("Not found");

        webTestClient.delete().uri("/health")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("Not found");
    }

    @Test
    void shouldReportUnknownServiceAsNotFound() {
        webTestClient.get().uri("/usage/unknown")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").isEqualTo("Unknown service: unknown");
    }

    @Test
    void shouldStripCredentialsFromConfigUpdates() {
        webTestClient.post().uri("/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"services\":{\"serpapi\":{\"enabled\":false,\"api_key\":\"secret\"}}}")
                .exchange()
                .expectStatus().isOk();

        webTestClient.get().uri("/config")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.services.serpapi.enabled").isEqualTo(false)
                .jsonPath("$.services.serpapi.api_key").doesNotExist();
    }
}
