package me.golemcore.gateway.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.inbound.web.ChatRequestValidator;
import me.golemcore.gateway.adapter.inbound.web.dto.ChatApiRequest;
import me.golemcore.gateway.domain.exception.ModelNotConfiguredException;
import me.golemcore.gateway.domain.model.BackendKind;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.model.GatewayEventType;
import me.golemcore.gateway.domain.model.ModelBinding;
import me.golemcore.gateway.domain.service.GatewayEventJournal;
import me.golemcore.gateway.domain.service.ModelResolver;
import me.golemcore.gateway.domain.service.TokenCostEstimator;
import me.golemcore.gateway.domain.service.TokenCounter;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.BindingStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DebugControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BindingStorePort bindingStore;
    private GatewayEventJournal journal;
    private DebugController controller;

    @BeforeEach
    void setUp() {
        bindingStore = mock(BindingStorePort.class);
        journal = new GatewayEventJournal(Clock.systemUTC(), new GatewayProperties());
        controller = new DebugController(journal, new ModelResolver(bindingStore),
                new TokenCostEstimator(new TokenCounter()), new ChatRequestValidator());
    }

    @Test
    void shouldEstimateCostWithoutCallingBackend() {
        when(bindingStore.findByKey("default")).thenReturn(Optional.of(ModelBinding.builder()
                .id(1L)
                .key("default")
                .modelName("gpt-4o-mini")
                .backendKind(BackendKind.CHAT_COMPLETIONS)
                .priceInputPerMillion(new BigDecimal("1000000"))
                .priceOutputPerMillion(new BigDecimal("2000000"))
                .build()));
        ChatApiRequest body = ChatApiRequest.builder()
                .modelKey("default")
                .messages(List.of(ChatMessage.of("user", "hello world")))
                .build();

        StepVerifier.create(controller.dryRun(body))
                .assertNext(response -> {
                    var dryRun = response.getBody();
                    assertTrue(dryRun.isDryRun());
                    assertEquals("default", dryRun.getModel().getKey());
                    assertEquals("chat_completions", dryRun.getModel().getBackend());
                    assertEquals(1, dryRun.getMessageCount());
                    assertEquals(9, dryRun.getInputTokens());
                    assertEquals(18, dryRun.getEstimatedOutputTokens());
                    // 9 * 1 + 18 * 2
                    assertEquals(new BigDecimal("45.000000"), dryRun.getEstimatedCost());
                    assertEquals("USD", dryRun.getCurrency());
                })
                .verifyComplete();
    }

    @Test
    void shouldUseMaxTokensAsOutputEstimateAndOmitCostWithoutPricing() {
        when(bindingStore.findByName("llama3.1")).thenReturn(Optional.of(ModelBinding.builder()
                .modelName("llama3.1")
                .backendKind(BackendKind.LOCAL_NDJSON)
                .build()));
        ChatApiRequest body = ChatApiRequest.builder()
                .model("llama3.1")
                .maxTokens(256)
                .messages(List.of(ChatMessage.of("user", "hi")))
                .build();

        StepVerifier.create(controller.dryRun(body))
                .assertNext(response -> {
                    assertEquals(256, response.getBody().getEstimatedOutputTokens());
                    assertNull(response.getBody().getEstimatedCost());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownModel() {
        when(bindingStore.findByName("ghost-model")).thenReturn(Optional.empty());
        ChatApiRequest body = ChatApiRequest.builder().model("ghost-model").build();

        assertThrows(ModelNotConfiguredException.class, () -> controller.dryRun(body));
    }

    @Test
    void shouldReturnJournalEventsFilteredByCorrelationId() {
        journal.publish(GatewayEventType.DISPATCH_STARTED, "a", Map.of());
        journal.publish(GatewayEventType.DISPATCH_STARTED, "b", Map.of());

        StepVerifier.create(controller.getEvents(null, "b"))
                .assertNext(response -> {
                    assertEquals(1, response.getBody().size());
                    assertEquals("b", response.getBody().get(0).correlationId());
                })
                .verifyComplete();
        StepVerifier.create(controller.getEvents(0, null))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldAcceptWellFormedChatRequest() throws Exception {
        String body = "{\"model_key\":\"default\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}],"
                + "\"temperature\":0.7,\"max_tokens\":64,\"stream\":false}";

        StepVerifier.create(controller.validate(MAPPER.readTree(body)))
                .assertNext(response -> {
                    assertEquals(200, response.getStatusCode().value());
                    var result = response.getBody();
                    assertTrue(result.isValid());
                    assertTrue(result.getErrors().isEmpty());
                    assertTrue(result.getWarnings().isEmpty());
                    assertTrue(result.getStructure().isHasModel());
                    assertEquals(1, result.getStructure().getMessageCount());
                    assertTrue(result.getStructure().isHasMaxTokens());
                    assertFalse(result.getStructure().isStream());
                })
                .verifyComplete();
    }

    @Test
    void shouldReportErrorsAndWarningsForMalformedRequest() throws Exception {
        String body = "{\"messages\":[{\"content\":\"no role\"},{\"role\":\"user\"}],"
                + "\"temperature\":3,\"max_tokens\":0}";

        StepVerifier.create(controller.validate(MAPPER.readTree(body)))
                .assertNext(response -> {
                    assertEquals(200, response.getStatusCode().value());
                    var result = response.getBody();
                    assertFalse(result.isValid());
                    assertEquals(List.of("No model specified. Use model_id, model_key or model",
                            "Message 0: missing role",
                            "max_tokens must be a positive integer"), result.getErrors());
                    assertEquals(List.of("Message 1: missing content",
                            "temperature should be between 0 and 2"), result.getWarnings());
                    assertTrue(result.getStructure().isStream());
                })
                .verifyComplete();
    }

    @Test
    void shouldTreatEmptyMessagesAsError() throws Exception {
        StepVerifier.create(controller.validate(MAPPER.readTree("{\"model\":\"gpt-4o-mini\",\"messages\":[]}")))
                .assertNext(response -> {
                    assertFalse(response.getBody().isValid());
                    assertEquals(List.of("messages array is empty"), response.getBody().getErrors());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectEmptyBodyWithBadRequest() {
        StepVerifier.create(controller.validate(null))
                .assertNext(response -> {
                    assertEquals(400, response.getStatusCode().value());
                    assertFalse(response.getBody().isValid());
                    assertEquals(List.of("Request body is empty"), response.getBody().getErrors());
                    assertNull(response.getBody().getStructure());
                })
                .verifyComplete();
    }
}
