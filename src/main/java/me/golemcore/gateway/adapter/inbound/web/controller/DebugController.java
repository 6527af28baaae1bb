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
import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.ChatRequestValidator;
import me.golemcore.gateway.adapter.inbound.web.dto.ChatApiRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.DryRunResponse;
import me.golemcore.gateway.adapter.inbound.web.dto.ValidationResponse;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.GatewayEvent;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.ModelRef;
import me.golemcore.gateway.domain.model.TokenEstimate;
import me.golemcore.gateway.domain.service.GatewayEventJournal;
import me.golemcore.gateway.domain.service.ModelResolver;
import me.golemcore.gateway.domain.service.TokenCostEstimator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Diagnostics: the gateway event journal, request cost previews and request
 * shape validation.
 */
@RestController
@RequestMapping("/api/debug")
@RequiredArgsConstructor
public class DebugController {

    private static final int DEFAULT_EVENT_LIMIT = 100;
    private static final int MAX_EVENT_LIMIT = 1000;
    private static final int DEFAULT_OUTPUT_ESTIMATE_CAP = 1000;

    private final GatewayEventJournal eventJournal;
    private final ModelResolver modelResolver;
    private final TokenCostEstimator costEstimator;
    private final ChatRequestValidator requestValidator;

    @GetMapping("/events")
    public Mono<ResponseEntity<List<GatewayEvent>>> getEvents(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String correlationId) {
        int requested = limit != null ? limit : DEFAULT_EVENT_LIMIT;
        int clamped = Math.max(1, Math.min(requested, MAX_EVENT_LIMIT));
        return Mono.just(ResponseEntity.ok(eventJournal.recent(clamped, correlationId)));
    }

    /**
     * Resolves the model and estimates cost without calling the backend. The
     * output estimate is {@code max_tokens} when given, otherwise twice the
     * input capped at 1000.
     */
    @PostMapping("/dry-run")
    public Mono<ResponseEntity<DryRunResponse>> dryRun(@RequestBody ChatApiRequest body) {
        ModelBinding binding = modelResolver.resolve(new ModelRef(body.getModelId(), body.getModelKey(),
                body.getModel()));
        List<ChatMessage> messages = body.getMessages() != null ? body.getMessages() : List.of();

        TokenEstimate input = costEstimator.estimate(messages, "", binding, Optional.empty());
        int estimatedOutput = body.getMaxTokens() != null
                ? body.getMaxTokens()
                : Math.min(input.inputTokens() * 2, DEFAULT_OUTPUT_ESTIMATE_CAP);

        DryRunResponse response = DryRunResponse.builder()
                .dryRun(true)
                .model(DryRunResponse.ModelInfo.builder()
                        .id(binding.getId())
                        .key(binding.getKey())
                        .name(binding.getModelName())
                        .displayName(binding.getDisplayName())
                        .backend(binding.getBackendKind().getWireName())
                        .build())
                .messageCount(messages.size())
                .encoding(input.encoding())
                .inputTokens(input.inputTokens())
                .estimatedOutputTokens(estimatedOutput)
                .estimatedCost(costEstimator.cost(input.inputTokens(), estimatedOutput, binding))
                .currency(binding.getCurrency())
                .note("Dry run. No backend call was made.")
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping("/validate")
    public Mono<ResponseEntity<ValidationResponse>> validate(@RequestBody(required = false) JsonNode body) {
        ValidationResponse result = requestValidator.validate(body);
        HttpStatus status = result.getStructure() != null ? HttpStatus.OK : HttpStatus.BAD_REQUEST;
        return Mono.just(ResponseEntity.status(status).body(result));
    }
}
