package me.golemcore.gateway.domain.service;

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
import com.knuddels.jtokkit.api.EncodingType;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.UpstreamProtocolException;
import me.golemcore.gateway.domain.model.EmbeddingReply;
import me.golemcore.gateway.domain.model.EmbeddingRequest;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.TokenEstimate;
import me.golemcore.gateway.domain.model.UsageOutcome;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.domain.model.WireRequest;
import me.golemcore.gateway.domain.support.CorrelationMdc;
import me.golemcore.gateway.port.outbound.EmbeddingAdapter;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import me.golemcore.gateway.port.outbound.UpstreamPort;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Runs embedding calls through the same resolver, upstream client and usage
 * accounting as chat dispatch.
 *
 * <p>
 * Embedding usage is input-only: the backend's reported token count is used
 * when present, otherwise the inputs are counted locally. Backend error
 * envelopes are recorded as failed usage; resolver misses and transport
 * failures are not.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class EmbeddingService {

    static final String META_TYPE = "type";
    static final String TYPE_EMBEDDING = "embedding";

    private final ModelResolver modelResolver;
    private final List<EmbeddingAdapter> adapters;
    private final UpstreamPort upstreamPort;
    private final TokenCounter tokenCounter;
    private final TokenCostEstimator costEstimator;
    private final UsageRecorder usageRecorder;
    private final GatewayEventSink eventSink;
    private final Clock clock;

    public EmbeddingService(ModelResolver modelResolver, List<EmbeddingAdapter> adapters, UpstreamPort upstreamPort,
            TokenCounter tokenCounter, TokenCostEstimator costEstimator, UsageRecorder usageRecorder,
            GatewayEventSink eventSink, Clock clock) {
        this.modelResolver = modelResolver;
        this.adapters = adapters;
        this.upstreamPort = upstreamPort;
        this.tokenCounter = tokenCounter;
        this.costEstimator = costEstimator;
        this.usageRecorder = usageRecorder;
        this.eventSink = eventSink;
        this.clock = clock;
    }

    public Mono<EmbeddingReply> embed(EmbeddingRequest request) {
        return Mono.defer(() -> {
            Call call = prepare(request);
            return upstreamPort.exchange(call.wireRequest())
                    .onErrorResume(UpstreamProtocolException.class,
                            e -> record(call, 0, TokenEstimate.SOURCE_ESTIMATED, UsageOutcome.FAILED,
                                    Map.of("error", String.valueOf(e.getMessage()),
                                            "upstream_status", e.getUpstreamStatus()))
                                    .then(Mono.error(e)))
                    .doOnError(e -> publishFailed(call, e))
                    .flatMap(reply -> complete(call, reply));
        });
    }

    private Call prepare(EmbeddingRequest request) {
        List<String> inputs = request.getInputs();
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("input must be a non-empty string or array of strings");
        }
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i) == null || inputs.get(i).isEmpty()) {
                throw new IllegalArgumentException("input[" + i + "] must be a non-empty string");
            }
        }
        if (request.getDimensions() != null && request.getDimensions() < 1) {
            throw new IllegalArgumentException("dimensions must be a positive number");
        }

        String correlationId = request.getCorrelationId() != null && !request.getCorrelationId().isBlank()
                ? request.getCorrelationId()
                : UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = CorrelationMdc.put(correlationId)) {
            return prepare(request, correlationId);
        }
    }

    private Call prepare(EmbeddingRequest request, String correlationId) {
        List<String> inputs = request.getInputs();
        ModelBinding binding = modelResolver.resolve(request.getModelRef());
        EmbeddingAdapter adapter = adapters.stream()
                .filter(candidate -> candidate.supports(binding.getBackendKind()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Model " + binding.getAccountingKey() + " does not support embeddings"));
        WireRequest wireRequest = adapter.encode(request, binding, correlationId);

        log.info("[Embeddings] {} model={} inputs={}", correlationId, binding.getAccountingKey(), inputs.size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", binding.getAccountingKey());
        payload.put(META_TYPE, TYPE_EMBEDDING);
        payload.put("inputs", inputs.size());
        eventSink.publish(GatewayEventType.DISPATCH_STARTED, correlationId, payload);

        return new Call(correlationId, request, binding, adapter, wireRequest, clock.instant());
    }

    private Mono<EmbeddingReply> complete(Call call, JsonNode reply) {
        OptionalInt reported = call.adapter().reportedTokens(reply);
        int tokens;
        String source;
        if (reported.isPresent()) {
            tokens = reported.getAsInt();
            source = TokenEstimate.SOURCE_BACKEND;
        } else {
            EncodingType encoding = tokenCounter.encodingFor(call.binding().getModelName());
            tokens = call.request().getInputs().stream()
                    .mapToInt(input -> tokenCounter.countText(input, encoding))
                    .sum();
            source = TokenEstimate.SOURCE_ESTIMATED;
        }
        ObjectNode payload = call.adapter().toReply(reply, call.binding());
        Map<String, Object> extra = Map.of("vector_count", payload.path("data").size());
        return record(call, tokens, source, UsageOutcome.COMPLETED, extra)
                .thenReturn(new EmbeddingReply(payload, tokens));
    }

    private Mono<Void> record(Call call, int tokens, String source, UsageOutcome outcome,
            Map<String, Object> extra) {
        EmbeddingRequest request = call.request();
        ModelBinding binding = call.binding();

        Map<String, Object> metadata = new LinkedHashMap<>(request.getMetadata());
        metadata.put(META_TYPE, TYPE_EMBEDDING);
        metadata.put("input_type", request.isBatch() ? "batch" : "single");
        metadata.put("input_count", request.getInputs().size());
        metadata.put("encoding_format", request.getEncodingFormat() != null ? request.getEncodingFormat() : "float");
        if (request.getDimensions() != null) {
            metadata.put("dimensions", request.getDimensions());
        }
        metadata.put("latency_ms", clock.millis() - call.startedAt().toEpochMilli());
        metadata.putAll(extra);

        Object conversationId = request.getMetadata().get("conversation_id");
        return usageRecorder.record(UsageRecord.builder()
                .timestamp(clock.instant())
                .bindingKey(binding.getAccountingKey())
                .bindingId(binding.getId())
                .modelName(binding.getModelName())
                .providerName(binding.getProviderName())
                .inputTokens(tokens)
                .outputTokens(0)
                .promptChars(request.getInputs().stream().mapToInt(String::length).sum())
                .completionChars(0)
                .cost(costEstimator.cost(tokens, 0, binding))
                .currency(binding.getCurrency())
                .tokenSource(source)
                .outcome(outcome)
                .correlationId(call.correlationId())
                .conversationId(conversationId != null ? String.valueOf(conversationId) : null)
                .metadata(metadata)
                .build());
    }

    private void publishFailed(Call call, Throwable error) {
        try (MDC.MDCCloseable ignored = CorrelationMdc.put(call.correlationId())) {
            log.warn("[Embeddings] {} upstream failed: {}", call.correlationId(), error.getMessage());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", call.wireRequest().url());
        payload.put("error", String.valueOf(error.getMessage()));
        eventSink.publish(GatewayEventType.UPSTREAM_FAILED, call.correlationId(), payload);
    }

    private record Call(String correlationId, EmbeddingRequest request, ModelBinding binding,
            EmbeddingAdapter adapter, WireRequest wireRequest, Instant startedAt) {
    }
}
