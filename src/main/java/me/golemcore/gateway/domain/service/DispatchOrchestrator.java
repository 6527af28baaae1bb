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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.ModelNotConfiguredException;
import me.golemcore.gateway.domain.exception.UpstreamProtocolException;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.CanonicalChatRequest;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.ChatReply;
import me.golemcore.gateway.domain.model.DispatchRequest;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.RelayOutcome;
import me.golemcore.gateway.domain.model.TokenEstimate;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.UsageOutcome;
import me.golemcore.gateway.domain.model.UsageRecord;
import me.golemcore.gateway.domain.model.WireMode;
import me.golemcore.gateway.domain.model.WireRequest;
import me.golemcore.gateway.domain.support.CorrelationMdc;
import me.golemcore.gateway.port.outbound.BackendAdapter;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import me.golemcore.gateway.port.outbound.UpstreamPort;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one chat request end to end: resolve the model, encode for the chosen
 * backend, call it, normalize the reply and account for usage.
 *
 * <p>
 * Streaming calls open the upstream connection before anything is sent to the
 * client, so resolver misses and backend connect or HTTP errors surface as
 * errors of the returned {@link Mono}. Once the stream is open every failure
 * becomes a terminal {@code ERROR} event.
 *
 * <p>
 * A usage record is written for every request the backend answered, including
 * failed and client-closed streams. Resolver misses and requests that never
 * reached the backend are not recorded.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchOrchestrator {

    static final String META_BACKEND = "backend";
    static final String META_GATEWAY = "gateway";
    static final String META_TOKEN_SOURCE = "token_source";
    static final String META_ENCODING = "encoding";
    static final String META_DELTAS = "delta_count";
    static final String META_ERROR = "error";
    static final String GATEWAY_NAME = "golemcore-gateway";

    private final ModelResolver modelResolver;
    private final BackendAdapterRegistry adapterRegistry;
    private final UpstreamPort upstreamPort;
    private final TokenCostEstimator costEstimator;
    private final UsageRecorder usageRecorder;
    private final GatewayEventSink eventSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Opens a streaming dispatch. The returned {@link Mono} emits the canonical
     * event stream once the backend accepted the request.
     */
    public Mono<Flux<CanonicalEvent>> stream(DispatchRequest request) {
        return Mono.defer(() -> {
            Dispatch dispatch = prepare(request, true);
            return upstreamPort.open(dispatch.wireRequest())
                    .doOnNext(opened -> publishOpened(dispatch))
                    .onErrorResume(UpstreamProtocolException.class,
                            e -> recordRejected(dispatch, e).then(Mono.error(e)))
                    .doOnError(e -> publishFailed(dispatch, e))
                    .map(upstream -> {
                        StreamRelay relay = new StreamRelay(dispatch.correlationId(), eventSink,
                                outcome -> accountStream(dispatch, outcome));
                        Flux<CanonicalEvent> events = upstream.lines()
                                .concatMapIterable(dispatch.adapter()::normalize);
                        return relay.relay(events);
                    });
        });
    }

    /**
     * Runs a non-streaming dispatch and returns the extracted completion.
     */
    public Mono<ChatReply> complete(DispatchRequest request) {
        return Mono.defer(() -> {
            Dispatch dispatch = prepare(request, false);
            return upstreamPort.exchange(dispatch.wireRequest())
                    .doOnNext(opened -> publishOpened(dispatch))
                    .onErrorResume(UpstreamProtocolException.class,
                            e -> recordRejected(dispatch, e).then(Mono.error(e)))
                    .doOnError(e -> publishFailed(dispatch, e))
                    .flatMap(reply -> {
                        BackendAdapter adapter = dispatch.adapter();
                        String content = adapter.extractText(reply);
                        Optional<TokenUsage> reported = adapter.extractUsage(reply);
                        TokenEstimate estimate = costEstimator.estimate(dispatch.canonical().getMessages(), content,
                                dispatch.binding(), reported);
                        UsageRecord usageRecord = buildRecord(dispatch, estimate, content, UsageOutcome.COMPLETED,
                                Map.of());
                        return usageRecorder.record(usageRecord)
                                .thenReturn(new ChatReply(content, reply, adapter.isRawReplyPassthrough()));
                    });
        });
    }

    /**
     * Picks the backend kind for a binding. Chat-completions bindings in
     * {@link WireMode#AUTO} move to the responses API when the caller asks for
     * it or the model is reasoning-class.
     */
    BackendKind chooseBackend(ModelBinding binding, boolean useResponses) {
        BackendKind kind = binding.getBackendKind() != null ? binding.getBackendKind() : BackendKind.CHAT_COMPLETIONS;
        if (binding.getWireMode() == WireMode.FORCED || kind != BackendKind.CHAT_COMPLETIONS) {
            return kind;
        }
        if (useResponses || ReasoningModels.isReasoningClass(binding.getModelName())) {
            return BackendKind.RESPONSES;
        }
        return kind;
    }

    private Dispatch prepare(DispatchRequest request, boolean stream) {
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        String correlationId = request.getCorrelationId() != null && !request.getCorrelationId().isBlank()
                ? request.getCorrelationId()
                : UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = CorrelationMdc.put(correlationId)) {
            return prepare(request, stream, correlationId);
        }
    }

    private Dispatch prepare(DispatchRequest request, boolean stream, String correlationId) {
        ModelBinding binding;
        try {
            binding = modelResolver.resolve(request.getModelRef());
        } catch (ModelNotConfiguredException e) {
            log.warn("[Dispatch] Rejected {}: {}", correlationId, e.getMessage());
            eventSink.publish(GatewayEventType.DISPATCH_REJECTED, correlationId,
                    Map.of("ref", request.getModelRef() != null ? request.getModelRef().describe() : "<none>"));
            throw e;
        }

        boolean reasoning = request.isReasoning()
                || binding.isSupportsReasoning()
                || ReasoningModels.isReasoningClass(binding.getModelName());

        CanonicalChatRequest canonical = CanonicalChatRequest.builder()
                .binding(binding)
                .messages(request.getMessages())
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .stream(stream)
                .reasoning(reasoning)
                .correlationId(correlationId)
                .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
                .build();

        BackendKind kind = chooseBackend(binding, request.isUseResponses());
        BackendAdapter adapter = adapterRegistry.getAdapter(kind);
        WireRequest wireRequest = adapter.encode(canonical);

        log.info("[Dispatch] {} model={} backend={} stream={} reasoning={}", correlationId,
                binding.getAccountingKey(), kind.getWireName(), stream, reasoning);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", binding.getAccountingKey());
        payload.put(META_BACKEND, kind.getWireName());
        payload.put("stream", stream);
        payload.put("reasoning", reasoning);
        eventSink.publish(GatewayEventType.DISPATCH_STARTED, correlationId, payload);

        return new Dispatch(correlationId, binding, canonical, adapter, wireRequest, clock.instant());
    }

    private Mono<Void> accountStream(Dispatch dispatch, RelayOutcome outcome) {
        TokenEstimate estimate = costEstimator.estimate(dispatch.canonical().getMessages(),
                outcome.completionText(), dispatch.binding(), Optional.empty());
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put(META_DELTAS, outcome.deltaCount());
        if (outcome.errorMessage() != null) {
            extra.put(META_ERROR, outcome.errorMessage());
        }
        UsageRecord usageRecord = buildRecord(dispatch, estimate, outcome.completionText(),
                UsageOutcome.fromRelayState(outcome.state()), extra);
        return usageRecorder.record(usageRecord);
    }

    private Mono<Void> recordRejected(Dispatch dispatch, UpstreamProtocolException e) {
        TokenEstimate estimate = costEstimator.estimate(dispatch.canonical().getMessages(), "",
                dispatch.binding(), Optional.empty());
        UsageRecord usageRecord = buildRecord(dispatch, estimate, "", UsageOutcome.FAILED,
                Map.of(META_ERROR, e.getMessage(), "upstream_status", e.getUpstreamStatus()));
        return usageRecorder.record(usageRecord);
    }

    private UsageRecord buildRecord(Dispatch dispatch, TokenEstimate estimate, String completionText,
            UsageOutcome outcome, Map<String, Object> extra) {
        ModelBinding binding = dispatch.binding();
        Map<String, Object> requestMetadata = dispatch.canonical().getMetadata();

        Map<String, Object> metadata = new LinkedHashMap<>(requestMetadata);
        metadata.put(META_BACKEND, dispatch.adapter().getKind().getWireName());
        metadata.put(META_GATEWAY, GATEWAY_NAME);
        metadata.put(META_TOKEN_SOURCE, estimate.source());
        metadata.put(META_ENCODING, estimate.encoding());
        metadata.put("latency_ms", clock.millis() - dispatch.startedAt().toEpochMilli());
        metadata.putAll(extra);

        return UsageRecord.builder()
                .timestamp(clock.instant())
                .bindingKey(binding.getAccountingKey())
                .bindingId(binding.getId())
                .modelName(binding.getModelName())
                .providerName(binding.getProviderName())
                .inputTokens(estimate.inputTokens())
                .outputTokens(estimate.outputTokens())
                .promptChars(promptChars(dispatch.canonical().getMessages()))
                .completionChars(completionText != null ? completionText.length() : 0)
                .cost(estimate.cost())
                .currency(binding.getCurrency())
                .tokenSource(estimate.source())
                .outcome(outcome)
                .correlationId(dispatch.correlationId())
                .conversationId(conversationId(requestMetadata))
                .metadata(metadata)
                .build();
    }

    private int promptChars(List<ChatMessage> messages) {
        try {
            return objectMapper.writeValueAsString(messages).length();
        } catch (JsonProcessingException e) {
            return messages.stream()
                    .mapToInt(message -> message.getContent() != null ? message.getContent().length() : 0)
                    .sum();
        }
    }

    private static String conversationId(Map<String, Object> metadata) {
        Object value = metadata.get("conversation_id");
        if (value == null) {
            value = metadata.get("conversationId");
        }
        return value != null ? String.valueOf(value) : null;
    }

    private void publishOpened(Dispatch dispatch) {
        eventSink.publish(GatewayEventType.UPSTREAM_OPENED, dispatch.correlationId(),
                Map.of("url", dispatch.wireRequest().url()));
    }

    private void publishFailed(Dispatch dispatch, Throwable error) {
        try (MDC.MDCCloseable ignored = CorrelationMdc.put(dispatch.correlationId())) {
            log.warn("[Dispatch] {} upstream failed: {}", dispatch.correlationId(), error.getMessage());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("url", dispatch.wireRequest().url());
        payload.put("error", String.valueOf(error.getMessage()));
        eventSink.publish(GatewayEventType.UPSTREAM_FAILED, dispatch.correlationId(), payload);
    }

    private record Dispatch(String correlationId, ModelBinding binding, CanonicalChatRequest canonical,
            BackendAdapter adapter, WireRequest wireRequest, Instant startedAt) {
    }
}
