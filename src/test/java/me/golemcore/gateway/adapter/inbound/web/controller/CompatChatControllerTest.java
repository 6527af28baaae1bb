package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.dto.ChatApiRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.StreamFrame;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.DispatchRequest;
import me.golemcore.gateway.domain.model.ModelRef;
import me.golemcore.gateway.domain.service.DispatchOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CompatChatControllerTest {

    private DispatchOrchestrator dispatchOrchestrator;
    private CompatChatController controller;

    @BeforeEach
    void setUp() {
        dispatchOrchestrator = mock(DispatchOrchestrator.class);
        controller = new CompatChatController(dispatchOrchestrator);
        when(dispatchOrchestrator.stream(any())).thenReturn(Mono.just(Flux.just(CanonicalEvent.delta("x"),
                CanonicalEvent.done())));
    }

    @Test
    void llmChatShouldResolveByBackendNameOnly() {
        StepVerifier.create(controller.llmChat(body(), null))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<DispatchRequest> captor = ArgumentCaptor.forClass(DispatchRequest.class);
        verify(dispatchOrchestrator).stream(captor.capture());
        assertEquals(ModelRef.ofName("llama3.1"), captor.getValue().getModelRef());
    }

    @Test
    @SuppressWarnings("unchecked")
    void llmWorkflowsShouldUseWorkflowDeltaFraming() {
        StepVerifier.create(controller.llmWorkflows(body(), "cid"))
                .assertNext(response -> {
                    Flux<ServerSentEvent<StreamFrame>> frames = (Flux<ServerSentEvent<StreamFrame>>) response
                            .getBody();
                    assertNotNull(frames);
                    List<ServerSentEvent<StreamFrame>> sent = frames.collectList().block();
                    assertNotNull(sent);
                    assertEquals("llm.delta", sent.get(0).data().getType());
                    assertEquals("x", sent.get(0).data().getData());
                    assertNull(sent.get(0).data().getContent());
                    assertEquals("done", sent.get(1).data().getType());
                })
                .verifyComplete();

        ArgumentCaptor<DispatchRequest> captor = ArgumentCaptor.forClass(DispatchRequest.class);
        verify(dispatchOrchestrator).stream(captor.capture());
        assertEquals(new ModelRef(null, "local", "llama3.1"), captor.getValue().getModelRef());
    }

    private static ChatApiRequest body() {
        return ChatApiRequest.builder()
                .model("llama3.1")
                .modelKey("local")
                .messages(List.of(ChatMessage.of("user", "hi")))
                .build();
    }
}
