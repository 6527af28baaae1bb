package me.golemcore.gateway.domain.service;

import com.knuddels.jtokkit.api.EncodingType;
import me.golemcore.gateway.domain.model.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenCounterTest {

    private final TokenCounter tokenCounter = new TokenCounter();

    @Test
    void shouldPickEncodingByModelName() {
        assertEquals(EncodingType.O200K_BASE, tokenCounter.encodingFor("gpt-5-mini"));
        assertEquals(EncodingType.O200K_BASE, tokenCounter.encodingFor("o3-mini"));
        assertEquals(EncodingType.O200K_BASE, tokenCounter.encodingFor("O4"));
        assertEquals(EncodingType.CL100K_BASE, tokenCounter.encodingFor("gpt-4o-mini"));
        assertEquals(EncodingType.CL100K_BASE, tokenCounter.encodingFor("llama3.1"));
        assertEquals(EncodingType.CL100K_BASE, tokenCounter.encodingFor(null));
    }

    @Test
    void shouldParseKnownEncodingNames() {
        assertEquals(EncodingType.CL100K_BASE, tokenCounter.parseEncoding("cl100k_base"));
        assertEquals(EncodingType.O200K_BASE, tokenCounter.parseEncoding(" O200K_BASE "));
        assertThrows(IllegalArgumentException.class, () -> tokenCounter.parseEncoding("nope"));
    }

    @Test
    void shouldCountPlainText() {
        assertEquals(2, tokenCounter.countText("hello world", EncodingType.CL100K_BASE));
        assertEquals(0, tokenCounter.countText("", EncodingType.CL100K_BASE));
        assertEquals(0, tokenCounter.countText(null, EncodingType.O200K_BASE));
    }

    @Test
    void shouldAddChatFramingOverhead() {
        List<ChatMessage> messages = List.of(ChatMessage.of("user", "hello world"));

        // priming 2 + per message 4 + "user" 1 + content 2
        assertEquals(9, tokenCounter.countChat(messages, EncodingType.CL100K_BASE));
    }

    @Test
    void shouldCountNamedMessages() {
        ChatMessage anonymous = ChatMessage.of("user", "hello world");
        ChatMessage named = new ChatMessage("user", "hello world", "alice");

        int withoutName = tokenCounter.countChat(List.of(anonymous), EncodingType.O200K_BASE);
        int withName = tokenCounter.countChat(List.of(named), EncodingType.O200K_BASE);

        int nameTokens = tokenCounter.countText("alice", EncodingType.O200K_BASE);
        assertEquals(withoutName + 1 + nameTokens, withName);
    }

    @Test
    void shouldReturnZeroForEmptyConversation() {
        assertEquals(0, tokenCounter.countChat(List.of(), EncodingType.CL100K_BASE));
        assertEquals(0, tokenCounter.countChat(null, EncodingType.CL100K_BASE));
    }

    @Test
    void shouldBeDeterministic() {
        List<ChatMessage> messages = List.of(
                ChatMessage.of("system", "You are terse."),
                ChatMessage.of("user", "Summarize the plot of Hamlet in one line."));

        int first = tokenCounter.countChat(messages, EncodingType.CL100K_BASE);
        int second = tokenCounter.countChat(messages, EncodingType.CL100K_BASE);

        assertEquals(first, second);
        assertTrue(first > 10);
    }
}
