package me.golemcore.gateway.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CanonicalChatRequest;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.port.outbound.BackendAdapter;
import me.golemcore.gateway.port.outbound.GatewayEventSink;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for backend adapters: endpoint URLs, request headers, JSON
 * parsing of wire lines and SSE framing.
 */
@Slf4j
abstract class AbstractBackendAdapter implements BackendAdapter {

    static final String HEADER_AUTHORIZATION = "Authorization";
    static final String HEADER_CORRELATION_ID = "X-Correlation-Id";
    static final String SSE_DATA_PREFIX = "data:";
    static final String SSE_DONE = "[DONE]";

    private static final int MAX_LOGGED_LINE_CHARS = 200;

    protected final ObjectMapper objectMapper;
    private final GatewayEventSink eventSink;

    protected AbstractBackendAdapter(ObjectMapper objectMapper, GatewayEventSink eventSink) {
        this.objectMapper = objectMapper;
        this.eventSink = eventSink;
    }

    static String endpoint(ModelBinding binding, String path) {
        String base = binding.getEndpointBaseUrl() != null ? binding.getEndpointBaseUrl() : "";
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    protected Map<String, String> headers(CanonicalChatRequest request) {
        return headers(request.getBinding(), request.getCorrelationId());
    }

    static Map<String, String> headers(ModelBinding binding, String correlationId) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (binding.hasCredential()) {
            headers.put(HEADER_AUTHORIZATION, "Bearer " + binding.getCredential());
        }
        if (binding.getHeaders() != null) {
            headers.putAll(binding.getHeaders());
        }
        if (correlationId != null) {
            headers.put(HEADER_CORRELATION_ID, correlationId);
        }
        return headers;
    }

    protected ArrayNode messagesNode(CanonicalChatRequest request) {
        ArrayNode messages = objectMapper.createArrayNode();
        for (ChatMessage message : request.getMessages()) {
            messages.add(objectMapper.valueToTree(message));
        }
        return messages;
    }

    protected ObjectNode baseBody(CanonicalChatRequest request, String messagesField) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getBinding().getModelName());
        body.set(messagesField, messagesNode(request));
        body.put("stream", request.isStream());
        return body;
    }

    /**
     * Strips SSE framing. Returns the payload of a {@code data:} line, or empty
     * for blank lines, comments and other SSE fields.
     */
    protected Optional<String> ssePayload(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return Optional.empty();
        }
        String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
        return payload.isEmpty() ? Optional.empty() : Optional.of(payload);
    }

    /**
     * Parses one wire payload. Malformed payloads are logged, reported to the
     * event sink and skipped.
     */
    protected Optional<JsonNode> parseLine(String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                reportMalformed(payload, "not a JSON object");
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            reportMalformed(payload, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void reportMalformed(String payload, String reason) {
        String sample = payload.length() > MAX_LOGGED_LINE_CHARS
                ? payload.substring(0, MAX_LOGGED_LINE_CHARS) + "..."
                : payload;
        log.warn("[Adapter] Skipping malformed {} line: {}", getKind().getWireName(), reason);
        try {
            eventSink.publish(GatewayEventType.MALFORMED_CHUNK, null,
                    Map.of("backend", getKind().getWireName(), "reason", String.valueOf(reason), "line", sample));
        } catch (RuntimeException e) { // NOSONAR
            log.debug("[Adapter] Failed to publish malformed chunk event: {}", e.getMessage());
        }
    }

    protected static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : null;
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * Message of an {@code error} member, which backends send either as an
     * object with {@code message} or as a plain string.
     */
    protected static String errorMessage(JsonNode error) {
        if (error == null || error.isNull() || error.isMissingNode()) {
            return null;
        }
        if (error.isTextual()) {
            return error.asText();
        }
        String message = text(error.path("message"));
        return hasText(message) ? message : error.toString();
    }
}
