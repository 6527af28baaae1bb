package me.golemcore.gateway.adapter.inbound.web;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.exception.GatewayException;
import me.golemcore.gateway.domain.exception.ModelNotConfiguredException;
import me.golemcore.gateway.domain.exception.UpstreamProtocolException;
import me.golemcore.gateway.domain.exception.UpstreamTransportException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps exceptions raised before a response is committed to
 * {@code {status, code, message}} bodies. Errors after a stream has started are
 * delivered in-band as {@code error} frames instead.
 */
@ControllerAdvice(basePackages = "me.golemcore.gateway.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ModelNotConfiguredException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleModelNotConfigured(ModelNotConfiguredException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(UpstreamProtocolException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUpstreamProtocol(UpstreamProtocolException ex) {
        log.warn("[API] Backend error (HTTP {}): {}", ex.getUpstreamStatus(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(UpstreamTransportException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUpstreamTransport(UpstreamTransportException ex) {
        log.warn("[API] Backend unreachable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGateway(GatewayException ex) {
        log.warn("[API] Gateway error {}: {}", ex.getCode(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, null, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "gateway.request.invalid", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
