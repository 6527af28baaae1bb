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
 * Local-model embeddings ({@code POST /api/embed}). The reply's
 * {@code embeddings} matrix is rewritten into OpenAI list entries; vectors are
 * always floats.
 */
@Component
public class OllamaEmbeddingsAdapter implements EmbeddingAdapter {

    private static final String PATH = "/api/embed";

    private final ObjectMapper objectMapper;

    public OllamaEmbeddingsAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(BackendKind kind) {
        return kind == BackendKind.LOCAL_NDJSON;
    }

    @Override
    public WireRequest encode(EmbeddingRequest request, ModelBinding binding, String correlationId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", binding.getModelName());
        ArrayNode input = body.putArray("input");
        request.getInputs().forEach(input::add);
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
        ArrayNode data = result.putArray("data");
        JsonNode embeddings = reply.path("embeddings");
        for (int i = 0; i < embeddings.size(); i++) {
            ObjectNode entry = data.addObject();
            entry.put("object", "embedding");
            entry.put("index", i);
            entry.set("embedding", embeddings.get(i));
        }
        JsonNode model = reply.path("model");
        result.put("model", model.isTextual() ? model.asText() : binding.getModelName());
        OptionalInt tokens = reportedTokens(reply);
        if (tokens.isPresent()) {
            ObjectNode usage = result.putObject("usage");
            usage.put("prompt_tokens", tokens.getAsInt());
            usage.put("total_tokens", tokens.getAsInt());
        }
        return result;
    }

    @Override
    public OptionalInt reportedTokens(JsonNode reply) {
        JsonNode count = reply.path("prompt_eval_count");
        return count.canConvertToInt() ? OptionalInt.of(count.asInt()) : OptionalInt.empty();
    }
}
