package me.golemcore.gateway.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.gateway.adapter.inbound.web.dto.ChatApiRequest;
import me.golemcore.gateway.domain.exception.ModelNotConfiguredException;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.ChatReply;
import me.golemcore.gateway.domain.model.DispatchRequest;
import me.golemcore.gateway.domain.model.ModelRef;
import me.golemcore.gateway.domain.service.DispatchOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private DispatchOrchestrator dispatchOrchestrator;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        dispatchOrchestrator = mock(DispatchOrchestrator.class);
        controller = new ChatController(dispatchOrchestrator);
    }

    @Test
    void shouldStreamByDefaultWithSseHeaders() {
        when(dispatchOrchestrator.stream(any())).thenReturn(Mono.just(Flux.just(CanonicalEvent.delta("Hi"),
                CanonicalEvent.done())));

        StepVerifier.create(controller.chat(body(null), "cid-7"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(MediaType.TEXT_EVENT_STREAM, response.getHeaders().getContentType());
                    assertEquals("cid-7", response.getHeaders().getFirst("X-Correlation-Id"));
                    assertEquals("no", response.getHeaders().getFirst("X-Accel-Buffering"));
                    assertTrue(response.getHeaders().getCacheControl().contains("no-cache"));
                    assertInstanceOf(Flux.class, response.getBody());
                })
                .verifyComplete();

        ArgumentCaptor<DispatchRequest> captor = ArgumentCaptor.forClass(DispatchRequest.class);
        verify(dispatchOrchestrator).stream(captor.capture());
        DispatchRequest request = captor.getValue();
        assertEquals(new ModelRef(3L, "default", "gpt-4o-mini"), request.getModelRef());
        assertEquals("cid-7", request.getCorrelationId());
        assertTrue(request.isStream());
        assertEquals("conv-9", request.getMetadata().get("conversation_id"));
    }

    @Test
    void shouldReturnContentForNonStreamingReply() {
        when(dispatchOrchestrator.complete(any())).thenReturn(Mono.just(new ChatReply("Paris.", null, false)));

        StepVerifier.create(controller.chat(body(false), null))
                .assertNext(response -> {
                    assertEquals(Map.of("content", "Paris."), response.getBody());
                    assertNotNull(response.getHeaders().getFirst("X-Correlation-Id"));
                })
                .verifyComplete();
        verify(dispatchOrchestrator, never()).stream(any());
    }

    @Test
    void shouldPassRawPayloadThroughForResponsesReplies() throws Exception {
        var raw = new ObjectMapper().readTree("{\"output_text\":\"hi\",\"id\":\"resp_1\"}");
        when(dispatchOrchestrator.complete(any())).thenReturn(Mono.just(new ChatReply("hi", raw, true)));

        StepVerifier.create(controller.chat(body(false), "cid"))
                .assertNext(response -> assertSame(raw, response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldWriteSseFramesOverHttp() {
        when(dispatchOrchestrator.stream(any())).thenReturn(Mono.just(Flux.just(CanonicalEvent.delta("Hi"),
                CanonicalEvent.error("quota exceeded"))));
        WebTestClient client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();

        Flux<String> frames = client.post().uri("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body(true))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .returnResult(String.class)
                .getResponseBody();

        List<String> collected = frames.collectList().block(Duration.ofSeconds(5));
        assertNotNull(collected);
        assertEquals(2, collected.size());
        assertTrue(collected.get(0).contains("\"type\":\"delta\""));
        assertTrue(collected.get(0).contains("\"content\":\"Hi\""));
        assertTrue(collected.get(1).contains("\"message\":\"quota exceeded\""));
    }

    @Test
    void shouldMapUnknownModelToBadRequestBeforeStreaming() {
        when(dispatchOrchestrator.stream(any()))
                .thenReturn(Mono.error(new ModelNotConfiguredException(ModelRef.ofName("ghost-model"))));
        WebTestClient client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();

        client.post().uri("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("model", "ghost-model",
                        "messages", List.of(Map.of("role", "user", "content", "hi"))))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("gateway.model.not_configured")
                .jsonPath("$.message").isEqualTo("Model not configured in gateway: name=ghost-model");
    }

    private static ChatApiRequest body(Boolean stream) {
        return ChatApiRequest.builder()
                .model("gpt-4o-mini")
                .modelKey("default")
                .modelId(3L)
                .messages(List.of(ChatMessage.of("user", "What is the capital of France?")))
                .stream(stream)
                .metadata(Map.of("conversation_id", "conv-9"))
                .build();
    }
}
