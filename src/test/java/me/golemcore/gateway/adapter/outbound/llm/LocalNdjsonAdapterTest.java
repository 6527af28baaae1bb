package me.golemcore.gateway.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.CanonicalChatRequest;
import me.golemcore.gateway.domain.model.CanonicalEvent;
import me.golemcore.gateway.domain.model.CanonicalEventType;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.WireRequest;
import me.golemcore.gateway.port.outbound.GatewayEventSink;
import me.golemcore.gateway.testsupport.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LocalNdjsonAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GatewayEventSink eventSink;
    private LocalNdjsonAdapter adapter;

    @BeforeEach
    void setUp() {
        eventSink = mock(GatewayEventSink.class);
        adapter = new LocalNdjsonAdapter(objectMapper, eventSink);
    }

    @Test
    void shouldEncodeOptionsAndNoCredentialHeader() {
        ModelBinding binding = ModelBinding.builder()
                .key("local")
                .modelName("llama3.1")
                .backendKind(BackendKind.LOCAL_NDJSON)
                .endpointBaseUrl("http://localhost:11434")
                .build();
        CanonicalChatRequest request = CanonicalChatRequest.builder()
                .binding(binding)
                .message(ChatMessage.of("user", "hi"))
                .temperature(0.5)
                .maxTokens(32)
                .stream(true)
                .build();

        WireRequest wire = adapter.encode(request);

        assertEquals("http://localhost:11434/api/chat", wire.url());
        assertFalse(wire.headers().containsKey("Authorization"));
        assertEquals(0.5, wire.body().get("options").get("temperature").asDouble(), 1e-9);
        assertEquals(32, wire.body().get("options").get("num_predict").asInt());
    }

    @Test
    void shouldSkipCorruptLineAndKeepTheRest() {
        List<CanonicalEvent> events = Fixtures.lines("local-ndjson-corrupt.ndjson").stream()
                .flatMap(line -> adapter.normalize(line).stream())
                .toList();

        assertEquals(5, events.size());
        assertEquals(4, events.stream().filter(CanonicalEvent::isDelta).count());
        assertEquals(CanonicalEventType.DONE, events.get(4).type());
        assertEquals("One two three four", events.stream()
                .filter(CanonicalEvent::isDelta)
                .map(CanonicalEvent::text)
                .reduce("", String::concat));
        verify(eventSink, times(1)).publish(eq(GatewayEventType.MALFORMED_CHUNK), any(), anyMap());
    }

    @Test
    void shouldEmitDeltaAndDoneFromSingleFinalLine() {
        List<CanonicalEvent> events = adapter.normalize(
                "{\"message\":{\"role\":\"assistant\",\"content\":\"end\"},\"done\":true}");

        assertEquals(List.of(CanonicalEvent.delta("end"), CanonicalEvent.done()), events);
    }

    @Test
    void shouldMapErrorLine() {
        List<CanonicalEvent> events = adapter.normalize("{\"error\":\"model 'x' not found\"}");

        assertEquals(List.of(CanonicalEvent.error("model 'x' not found")), events);
    }

    @Test
    void shouldIgnoreBlankLines() {
        assertTrue(adapter.normalize("   ").isEmpty());
        verifyNoInteractions(eventSink);
    }

    @Test
    void shouldExtractEvalCountsAsUsage() throws Exception {
        JsonNode reply = objectMapper.readTree("""
                {"message":{"role":"assistant","content":"pong"},"done":true,
                 "prompt_eval_count":12,"eval_count":4}
                """);

        assertEquals("pong", adapter.extractText(reply));
        assertEquals(Optional.of(new TokenUsage(12, 4)), adapter.extractUsage(reply));
    }
}
