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
 * OpenAI-style chat-completions protocol ({@code POST /v1/chat/completions}).
 *
 * <p>
 * Streaming replies are SSE: {@code data: <chunk>} lines terminated by
 * {@code data: [DONE]}. Reasoning-class requests send the token budget as
 * {@code max_completion_tokens} and omit {@code temperature}.
 */
@Component
public class ChatCompletionsAdapter extends AbstractBackendAdapter {

    private static final String PATH = "/v1/chat/completions";

    public ChatCompletionsAdapter(ObjectMapper objectMapper, GatewayEventSink eventSink) {
        super(objectMapper, eventSink);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.CHAT_COMPLETIONS;
    }

    @Override
    public WireRequest encode(CanonicalChatRequest request) {
        ObjectNode body = baseBody(request, "messages");
        if (request.isReasoning()) {
            if (request.getMaxTokens() != null) {
                body.put("max_completion_tokens", request.getMaxTokens());
            }
        } else {
            if (request.getTemperature() != null) {
                body.put("temperature", request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                body.put("max_tokens", request.getMaxTokens());
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
        Optional<JsonNode> chunk = parseLine(payload.get());
        if (chunk.isEmpty()) {
            return List.of();
        }
        JsonNode json = chunk.get();
        if (json.has("error")) {
            return List.of(CanonicalEvent.error(errorMessage(json.get("error"))));
        }
        String delta = text(json.path("choices").path(0).path("delta").path("content"));
        return hasText(delta) ? List.of(CanonicalEvent.delta(delta)) : List.of();
    }

    @Override
    public String extractText(JsonNode reply) {
        String content = text(reply.path("choices").path(0).path("message").path("content"));
        return content != null ? content : "";
    }

    @Override
    public Optional<TokenUsage> extractUsage(JsonNode reply) {
        JsonNode usage = reply.path("usage");
        if (!usage.path("prompt_tokens").isNumber() || !usage.path("completion_tokens").isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new TokenUsage(usage.get("prompt_tokens").asInt(), usage.get("completion_tokens").asInt()));
    }
}
