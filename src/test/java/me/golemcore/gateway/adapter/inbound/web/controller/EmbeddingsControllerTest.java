package me.golemcore.gateway.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.gateway.adapter.inbound.web.dto.EmbeddingApiRequest;
import me.golemcore.gateway.domain.model.EmbeddingReply;
import me.golemcore.gateway.domain.model.EmbeddingRequest;
import me.golemcore.gateway.domain.service.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EmbeddingsControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EmbeddingService embeddingService;
    private EmbeddingsController controller;

    @BeforeEach
    void setUp() {
        embeddingService = mock(EmbeddingService.class);
        controller = new EmbeddingsController(embeddingService);
        ObjectNode payload = MAPPER.createObjectNode().put("object", "list");
        payload.putArray("data");
        when(embeddingService.embed(any())).thenReturn(Mono.just(new EmbeddingReply(payload, 5)));
    }

    @Test
    void shouldMapStringInputToSingleRequest() {
        EmbeddingApiRequest body = EmbeddingApiRequest.builder()
                .input(MAPPER.getNodeFactory().textNode("hello"))
                .modelKey("embed")
                .conversationId("conv-1")
                .metadata(Map.of("user", "u-1"))
                .build();

        StepVerifier.create(controller.embed(body, "cid-1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("cid-1", response.getHeaders().getFirst(ChatResponses.CORRELATION_HEADER));
                    assertEquals("list", response.getBody().get("object").asText());
                })
                .verifyComplete();

        EmbeddingRequest request = captured();
        assertFalse(request.isBatch());
        assertEquals(List.of("hello"), request.getInputs());
        assertEquals("embed", request.getModelRef().key());
        assertEquals("cid-1", request.getCorrelationId());
        assertEquals("conv-1", request.getMetadata().get("conversation_id"));
        assertEquals("u-1", request.getMetadata().get("user"));
    }

    @Test
    void shouldMapArrayInputToBatchRequest() {
        EmbeddingApiRequest body = EmbeddingApiRequest.builder()
                .input(MAPPER.createArrayNode().add("a").add("b"))
                .modelId(3L)
                .encodingFormat("base64")
                .build();

        StepVerifier.create(controller.embedBatch(body, null))
                .assertNext(response -> assertNotNull(
                        response.getHeaders().getFirst(ChatResponses.CORRELATION_HEADER)))
                .verifyComplete();

        EmbeddingRequest request = captured();
        assertTrue(request.isBatch());
        assertEquals(List.of("a", "b"), request.getInputs());
        assertEquals(Long.valueOf(3), request.getModelRef().id());
        assertEquals("base64", request.getEncodingFormat());
    }

    @Test
    void shouldRejectStringInputOnBatchEndpoint() {
        EmbeddingApiRequest body = EmbeddingApiRequest.builder()
                .input(MAPPER.getNodeFactory().textNode("hello"))
                .model("text-embedding-3-small")
                .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> controller.embedBatch(body, null));
        assertTrue(error.getMessage().contains("array"));
        verifyNoInteractions(embeddingService);
    }

    @Test
    void shouldRejectNonStringArrayElements() {
        EmbeddingApiRequest body = EmbeddingApiRequest.builder()
                .input(MAPPER.createArrayNode().add("a").add(42))
                .model("text-embedding-3-small")
                .build();

        assertThrows(IllegalArgumentException.class, () -> controller.embed(body, null));
        verifyNoInteractions(embeddingService);
    }

    @Test
    void shouldRejectUnknownEncodingFormat() {
        EmbeddingApiRequest body = EmbeddingApiRequest.builder()
                .input(MAPPER.getNodeFactory().textNode("hello"))
                .model("text-embedding-3-small")
                .encodingFormat("int8")
                .build();

        assertThrows(IllegalArgumentException.class, () -> controller.embed(body, null));
        verifyNoInteractions(embeddingService);
    }

    private EmbeddingRequest captured() {
        ArgumentCaptor<EmbeddingRequest> captor = ArgumentCaptor.forClass(EmbeddingRequest.class);
        verify(embeddingService).embed(captor.capture());
        return captor.getValue();
    }
}
