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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Local-model NDJSON protocol (Ollama {@code POST /api/chat}). One JSON object
 * per line; the final object carries {@code done: true} and the eval counts.
 */
@Component
public class LocalNdjsonAdapter extends AbstractBackendAdapter {

    private static final String PATH = "/api/chat";

    public LocalNdjsonAdapter(ObjectMapper objectMapper, GatewayEventSink eventSink) {
        super(objectMapper, eventSink);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.LOCAL_NDJSON;
    }

    @Override
    public WireRequest encode(CanonicalChatRequest request) {
        ObjectNode body = baseBody(request, "messages");
        if (request.getTemperature() != null || request.getMaxTokens() != null) {
            ObjectNode options = body.putObject("options");
            if (request.getTemperature() != null) {
                options.put("temperature", request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                options.put("num_predict", request.getMaxTokens());
            }
        }
        return new WireRequest(endpoint(request.getBinding(), PATH), headers(request), body, request.isStream());
    }

    @Override
    public List<CanonicalEvent> normalize(String wireLine) {
        if (wireLine == null || wireLine.isBlank()) {
            return List.of();
        }
        Optional<JsonNode> parsed = parseLine(wireLine.trim());
        if (parsed.isEmpty()) {
            return List.of();
        }
        JsonNode json = parsed.get();
        if (json.has("error")) {
            return List.of(CanonicalEvent.error(errorMessage(json.get("error"))));
        }
        List<CanonicalEvent> events = new ArrayList<>(2);
        String content = text(json.path("message").path("content"));
        if (hasText(content)) {
            events.add(CanonicalEvent.delta(content));
        }
        if (json.path("done").asBoolean(false)) {
            events.add(CanonicalEvent.done());
        }
        return events;
    }

    @Override
    public String extractText(JsonNode reply) {
        String content = text(reply.path("message").path("content"));
        return content != null ? content : "";
    }

    @Override
    public Optional<TokenUsage> extractUsage(JsonNode reply) {
        if (!reply.path("prompt_eval_count").isNumber() || !reply.path("eval_count").isNumber()) {
            return Optional.empty();
        }
        return Optional.of(new TokenUsage(reply.get("prompt_eval_count").asInt(), reply.get("eval_count").asInt()));
    }
}
