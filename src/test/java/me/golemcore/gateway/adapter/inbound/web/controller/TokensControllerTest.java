package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.dto.TokenCountRequest;
import me.golemcore.gateway.domain.model.ChatMessage;
import me.golemcore.gateway.domain.service.TokenCounter;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokensControllerTest {

    private final TokensController controller = new TokensController(new TokenCounter());

    @Test
    void shouldCountTextAndMessagesWithModelEncoding() {
        TokenCountRequest request = TokenCountRequest.builder()
                .model("gpt-4o-mini")
                .text("hello world")
                .messages(List.of(ChatMessage.of("user", "hello world")))
                .build();

        StepVerifier.create(controller.countTokens(request))
                .assertNext(response -> {
                    assertEquals("cl100k_base", response.getBody().getEncoding());
                    assertEquals(2, response.getBody().getTextTokens());
                    assertEquals(9, response.getBody().getMessageTokens());
                    assertEquals(11, response.getBody().getTotalTokens());
                    assertEquals(TokensController.NOTE, response.getBody().getNote());
                })
                .verifyComplete();
    }

    @Test
    void shouldHonorExplicitEncoding() {
        TokenCountRequest request = TokenCountRequest.builder()
                .model("gpt-4o-mini")
                .encoding("o200k_base")
                .text("hello")
                .build();

        StepVerifier.create(controller.countTokens(request))
                .assertNext(response -> {
                    assertEquals("o200k_base", response.getBody().getEncoding());
                    assertNull(response.getBody().getMessageTokens());
                    assertEquals(response.getBody().getTextTokens(), response.getBody().getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownEncoding() {
        TokenCountRequest request = TokenCountRequest.builder().encoding("p50k_nope").text("x").build();

        assertThrows(IllegalArgumentException.class, () -> controller.countTokens(request));
    }
}
