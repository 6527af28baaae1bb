package me.golemcore.gateway.adapter.inbound.web.controller;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.EmbeddingApiRequest;
import me.golemcore.gateway.domain.model.EmbeddingRequest;
import me.golemcore.gateway.domain.model.ModelRef;
import me.golemcore.gateway.domain.service.EmbeddingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * OpenAI-compatible embeddings. {@code /embeddings} accepts a string or an
 * array of strings; {@code /embeddings/batch} requires an array.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class EmbeddingsController {

    private static final Set<String> ENCODING_FORMATS = Set.of("float", "base64");

    private final EmbeddingService embeddingService;

    @PostMapping("/embeddings")
    public Mono<ResponseEntity<ObjectNode>> embed(@RequestBody EmbeddingApiRequest body,
            @RequestHeader(value = ChatResponses.CORRELATION_HEADER, required = false) String correlationHeader) {
        return dispatch(body, correlationHeader);
    }

    @PostMapping("/embeddings/batch")
    public Mono<ResponseEntity<ObjectNode>> embedBatch(@RequestBody EmbeddingApiRequest body,
            @RequestHeader(value = ChatResponses.CORRELATION_HEADER, required = false) String correlationHeader) {
        if (body.getInput() == null || !body.getInput().isArray()) {
            throw new IllegalArgumentException("Batch endpoint requires input to be an array of strings");
        }
        return dispatch(body, correlationHeader);
    }

    private Mono<ResponseEntity<ObjectNode>> dispatch(EmbeddingApiRequest body, String correlationHeader) {
        String correlationId = ChatResponses.correlationId(correlationHeader);
        EmbeddingRequest request = toRequest(body, correlationId);
        log.debug("[Embeddings] {} {} input(s), batch={}", correlationId, request.getInputs().size(),
                request.isBatch());
        return embeddingService.embed(request)
                .map(reply -> ResponseEntity.ok()
                        .header(ChatResponses.CORRELATION_HEADER, correlationId)
                        .body(reply.payload()));
    }

    private EmbeddingRequest toRequest(EmbeddingApiRequest body, String correlationId) {
        if (body.getEncodingFormat() != null && !ENCODING_FORMATS.contains(body.getEncodingFormat())) {
            throw new IllegalArgumentException("encoding_format must be one of " + ENCODING_FORMATS);
        }
        EmbeddingRequest.EmbeddingRequestBuilder builder = EmbeddingRequest.builder()
                .modelRef(new ModelRef(body.getModelId(), body.getModelKey(), body.getModel()))
                .encodingFormat(body.getEncodingFormat())
                .dimensions(body.getDimensions())
                .correlationId(correlationId);

        JsonNode input = body.getInput();
        if (input != null && input.isTextual()) {
            builder.input(input.asText());
        } else if (input != null && input.isArray()) {
            builder.batch(true);
            for (JsonNode item : input) {
                if (!item.isTextual()) {
                    throw new IllegalArgumentException("input must be a string or array of strings");
                }
                builder.input(item.asText());
            }
        } else {
            throw new IllegalArgumentException("input must be a string or array of strings");
        }

        if (body.getMetadata() != null) {
            builder.metadata(body.getMetadata());
        }
        if (body.getConversationId() != null) {
            builder.metadataEntry("conversation_id", body.getConversationId());
        }
        return builder.build();
    }
}
