package me.golemcore.meter.adapter.inbound.web.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.meter.domain.model.ConfigUpdateException;
import me.golemcore.meter.domain.service.RuntimeConfigService;
import me.golemcore.meter.infrastructure.config.MeterProperties;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime configuration endpoints. Updates are partial: top-level keys of the
 * posted object replace the stored ones.
 */
@RestController
@RequestMapping("/config")
@RequiredArgsConstructor
@Slf4j
public class ConfigController {

    private static final String PAYLOAD_TOO_LARGE = "Payload too large";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RuntimeConfigService runtimeConfigService;
    private final MeterProperties properties;
    private final ObjectMapper objectMapper;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> getConfig() {
        return Mono.just(ResponseEntity.ok(runtimeConfigService.getRuntimeConfigForApi()));
    }

    @PostMapping
    public Mono<ResponseEntity<StatusResponse>> updateConfig(ServerHttpRequest request) {
        int maxBytes = properties.getConfig().getMaxPayloadBytes();
        long declaredLength = request.getHeaders().getContentLength();
        if (declaredLength > maxBytes) {
            return Mono.error(new ConfigUpdateException(ConfigUpdateException.Reason.PAYLOAD_TOO_LARGE,
                    PAYLOAD_TOO_LARGE));
        }

        return DataBufferUtils.join(request.getBody(), maxBytes)
                .onErrorMap(DataBufferLimitException.class,
                        e -> new ConfigUpdateException(ConfigUpdateException.Reason.PAYLOAD_TOO_LARGE,
                                PAYLOAD_TOO_LARGE, e))
                .map(this::readBytes)
                .defaultIfEmpty(new byte[0])
                .map(this::parseObject)
                .publishOn(Schedulers.boundedElastic())
                .map(partial -> {
                    runtimeConfigService.merge(partial);
                    return ResponseEntity.ok(new StatusResponse("ok"));
                });
    }

    private byte[] readBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private Map<String, Object> parseObject(byte[] body) {
        Map<String, Object> partial;
        try {
            partial = objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException e) {
            log.debug("[Config] Rejected update: {}", e.getMessage());
            throw new ConfigUpdateException(ConfigUpdateException.Reason.MALFORMED,
                    "Invalid JSON: " + firstLine(e.getMessage()), e);
        }
        if (partial == null) {
            throw new ConfigUpdateException(ConfigUpdateException.Reason.MALFORMED,
                    "Invalid JSON: expected an object");
        }
        return partial;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unreadable body";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
