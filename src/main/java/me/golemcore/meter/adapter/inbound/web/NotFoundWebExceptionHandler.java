package me.golemcore.meter.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.adapter.inbound.web.dto.ApiErrorResponse;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Renders requests that match no route (unknown path or unsupported method) as
 * 404 {@code {"error": "Not found"}}. Runs before Spring Boot's default error
 * handler; all other errors are passed on.
 */
@Component
@Order(-2)
@RequiredArgsConstructor
@Slf4j
public class NotFoundWebExceptionHandler implements WebExceptionHandler {

    private static final String NOT_FOUND = "Not found";

    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (!(ex instanceof ResponseStatusException statusException)) {
            return Mono.error(ex);
        }
        int status = statusException.getStatusCode().value();
        if (status != HttpStatus.NOT_FOUND.value() && status != HttpStatus.METHOD_NOT_ALLOWED.value()) {
            return Mono.error(ex);
        }

        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(ex);
        }
        log.debug("[API] No route for {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath());

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ApiErrorResponse.of(NOT_FOUND));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        response.setStatusCode(HttpStatus.NOT_FOUND);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().remove("Allow");
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }
}
