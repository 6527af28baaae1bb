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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.CanonicalChatRequest;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.WireRequest;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * OpenAI-style responses protocol ({@code POST /v1/responses}).
 *
 * <p>
 * Stream events are discriminated by {@code type} (older servers use
 * {@code event}). Non-streaming replies come in several shapes and are decoded
 * by {@link ResponseShapeDecoders}; the raw payload is returned to callers
 * unchanged.
 */
@Component
public class ResponsesAdapter extends AbstractBackendAdapter {

    private static final String PATH = "/v1/responses";

    private static final String TYPE_OUTPUT_TEXT_DELTA = "response.output_text.delta";
    private static final String TYPE_OUTPUT_TEXT = "response.output_text";
    private static final String TYPE_COMPLETED = "response.completed";
    private static final String TYPE_FAILED = "response.failed";
    private static final String TYPE_ERROR = "error";

    public ResponsesAdapter(ObjectMapper objectMapper, GatewayEventSink eventSink) {
        super(objectMapper, eventSink);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.RESPONSES;
    }

    @Override
    public WireRequest encode(CanonicalChatRequest request) {
        ObjectNode body = baseBody(request, "input");
        if (!request.isReasoning()) {
            if (request.getTemperature() != null) {
                body.put("temperature", request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                body.put("max_output_tokens", request.getMaxTokens());
            }
        }
        return new WireRequest(endpoint(request.getBinding(), PATH), headers(request), body, request.isStream());
    }

    @Override
    public List<CanonicalEvent> normalize(String wireLine) {
        Optional<String> payload = ssePayload(wireLine);
        if (payload.isEmpty()) {
            return List.of();
        }
        if (SSE_DONE.equals(payload.get())) {
            return List.of(CanonicalEvent.done());
        }
        Optional<JsonNode> parsed = parseLine(payload.get());
        if (parsed.isEmpty()) {
            return List.of();
        }
        JsonNode event = parsed.get();
        String type = text(event.has("type") ? event.get("type") : event.path("event"));
        if (type == null) {
            type = "";
        }

        if (TYPE_OUTPUT_TEXT_DELTA.equals(type)) {
            return deltaOf(firstText(event.path("delta"), event.path("text"),
                    event.path("output_text").path(0).path("content")));
        }
        if (TYPE_OUTPUT_TEXT.equals(type)) {
            String joined = ResponseShapeDecoders.joinText(event.path("output_text"));
            return deltaOf(hasText(joined) ? joined : text(event.path("text")));
        }
        if (TYPE_COMPLETED.equals(type)) {
            return List.of(CanonicalEvent.done());
        }
        if (TYPE_FAILED.equals(type)) {
            return List.of(CanonicalEvent.error(errorMessage(event.path("response").get("error"))));
        }
        if (TYPE_ERROR.equals(type) || event.has("error")) {
            String message = errorMessage(event.get("error"));
            return List.of(CanonicalEvent.error(hasText(message) ? message : text(event.path("message"))));
        }
        if (type.startsWith("response.")) {
            // lifecycle events (created, in_progress, output_item.added, ...) carry no text
            return List.of();
        }
        return deltaOf(firstText(event.path("output_text").path(0).path("content"),
                event.path("delta").path("text"), event.path("message").path("content"), event.path("content")));
    }

    @Override
    public String extractText(JsonNode reply) {
        return ResponseShapeDecoders.decode(reply);
    }

    @Override
    public Optional<TokenUsage> extractUsage(JsonNode reply) {
        JsonNode usage = reply.path("usage");
        if (!usage.path("input_tokens").isNumber() || !usage.path("output_tokens").isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new TokenUsage(usage.get("input_tokens").asInt(), usage.get("output_tokens").asInt()));
    }

    @Override
    public boolean isRawReplyPassthrough() {
        return true;
    }

    private static List<CanonicalEvent> deltaOf(String text) {
        return hasText(text) ? List.of(CanonicalEvent.delta(text)) : List.of();
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            String value = text(candidate);
            if (hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
