package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.dto.ChatApiRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.StreamFrame;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.ChatReply;
import me.golemcore.gateway.domain.model.DispatchRequest;
import me.golemcore.gateway.domain.model.ModelRef;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Request mapping and response shaping shared by the chat controllers.
 */
final class ChatResponses {

    static final String CORRELATION_HEADER = "X-Correlation-Id";

    private ChatResponses() {
    }

    static String correlationId(String header) {
        return header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
    }

    static DispatchRequest toDispatch(ChatApiRequest body, ModelRef ref, String correlationId) {
        return DispatchRequest.builder()
                .modelRef(ref)
                .messages(body.getMessages() != null ? body.getMessages() : List.of())
                .temperature(body.getTemperature())
                .maxTokens(body.getMaxTokens())
                .stream(body.isStreaming())
                .useResponses(Boolean.TRUE.equals(body.getUseResponses()))
                .reasoning(Boolean.TRUE.equals(body.getReasoning()))
                .correlationId(correlationId)
                .metadata(body.getMetadata() != null ? body.getMetadata() : Map.of())
                .build();
    }

    static ResponseEntity<Object> sse(Flux<CanonicalEvent> events, Function<CanonicalEvent, StreamFrame> framing,
            String correlationId) {
        Flux<ServerSentEvent<StreamFrame>> frames = events
                .map(event -> ServerSentEvent.builder(framing.apply(event)).build());
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache().noTransform())
                .header(CORRELATION_HEADER, correlationId)
                .header("X-Accel-Buffering", "no")
                .body(frames);
    }

    static ResponseEntity<Object> reply(ChatReply reply, String correlationId) {
        Object body = reply.passthrough() && reply.raw() != null
                ? reply.raw()
                : Map.of("content", reply.content() != null ? reply.content() : "");
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(CORRELATION_HEADER, correlationId)
                .body(body);
    }
}
