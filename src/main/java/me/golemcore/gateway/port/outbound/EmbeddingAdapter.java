package me.golemcore.gateway.port.outbound;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.EmbeddingRequest;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.WireRequest;

import java.util.OptionalInt;

/**
 * Translates embedding calls to one backend's embeddings endpoint.
 */
public interface EmbeddingAdapter {

    boolean supports(BackendKind kind);

    WireRequest encode(EmbeddingRequest request, ModelBinding binding, String correlationId);

    /**
     * Rewrites a backend reply into the OpenAI list shape.
     */
    ObjectNode toReply(JsonNode reply, ModelBinding binding);

    /**
     * Input tokens reported by the backend, if any.
     */
    OptionalInt reportedTokens(JsonNode reply);
}
