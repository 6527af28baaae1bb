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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.EmbeddingRequest;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.WireRequest;
import me.golemcore.gateway.port.outbound.EmbeddingAdapter;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * OpenAI-style embeddings ({@code POST /v1/embeddings}) for chat-completions
 * and responses bindings.
 */
@Component
public class OpenAiEmbeddingsAdapter implements EmbeddingAdapter {

    private static final String PATH = "/v1/embeddings";
    private static final String DEFAULT_ENCODING_FORMAT = "float";

    private final ObjectMapper objectMapper;

    public OpenAiEmbeddingsAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(BackendKind kind) {
        return kind == BackendKind.CHAT_COMPLETIONS || kind == BackendKind.RESPONSES;
    }

    @Override
    public WireRequest encode(EmbeddingRequest request, ModelBinding binding, String correlationId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", binding.getModelName());
        if (request.isBatch()) {
            ArrayNode input = body.putArray("input");
            request.getInputs().forEach(input::add);
        } else {
            body.put("input", request.getInputs().get(0));
        }
        body.put("encoding_format", request.getEncodingFormat() != null
                ? request.getEncodingFormat()
                : DEFAULT_ENCODING_FORMAT);
        if (request.getDimensions() != null) {
            body.put("dimensions", request.getDimensions());
        }
        return new WireRequest(AbstractBackendAdapter.endpoint(binding, PATH),
                AbstractBackendAdapter.headers(binding, correlationId), body, false);
    }

    @Override
    public ObjectNode toReply(JsonNode reply, ModelBinding binding) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("object", "list");
        JsonNode data = reply.path("data");
        result.set("data", data.isArray() ? data : objectMapper.createArrayNode());
        JsonNode model = reply.path("model");
        result.put("model", model.isTextual() ? model.asText() : binding.getModelName());
        if (reply.path("usage").isObject()) {
            result.set("usage", reply.get("usage"));
        }
        return result;
    }

    @Override
    public OptionalInt reportedTokens(JsonNode reply) {
        JsonNode usage = reply.path("usage");
        if (usage.path("total_tokens").canConvertToInt()) {
            return OptionalInt.of(usage.get("total_tokens").asInt());
        }
        if (usage.path("prompt_tokens").canConvertToInt()) {
            return OptionalInt.of(usage.get("prompt_tokens").asInt());
        }
        return OptionalInt.empty();
    }
}
