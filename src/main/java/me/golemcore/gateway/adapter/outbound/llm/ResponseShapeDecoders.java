package me.golemcore.gateway.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Function;

/**
 * Ordered decoders for the non-streaming reply shapes of the responses API.
 * The first decoder that yields non-empty text wins.
 *
 * <ol>
 * <li>flat {@code output_text}, a string or an array of strings</li>
 * <li>nested {@code output[].content[]} (or {@code output[].message.content[]})
 * items of type {@code text} or {@code output_text}</li>
 * <li>bare {@code message.content}, {@code content} or {@code text}</li>
 * </ol>
 */
final class ResponseShapeDecoders {

    private static final List<Function<JsonNode, String>> DECODERS = List.of(
            ResponseShapeDecoders::flatOutputText,
            ResponseShapeDecoders::nestedOutputContent,
            ResponseShapeDecoders::bareContent);

    private ResponseShapeDecoders() {
    }

    static String decode(JsonNode reply) {
        if (reply == null) {
            return "";
        }
        for (Function<JsonNode, String> decoder : DECODERS) {
            String text = decoder.apply(reply);
            if (text != null && !text.isEmpty()) {
                return text;
            }
        }
        return "";
    }

    static String flatOutputText(JsonNode reply) {
        return joinText(reply.path("output_text"));
    }

    static String nestedOutputContent(JsonNode reply) {
        JsonNode output = reply.path("output");
        if (!output.isArray()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode item : output) {
            JsonNode content = item.path("content");
            if (!content.isArray()) {
                content = item.path("message").path("content");
            }
            if (!content.isArray()) {
                continue;
            }
            for (JsonNode part : content) {
                String type = part.path("type").asText("");
                if (("text".equals(type) || "output_text".equals(type)) && part.path("text").isTextual()) {
                    text.append(part.get("text").asText());
                }
            }
        }
        return text.toString();
    }

    static String bareContent(JsonNode reply) {
        JsonNode messageContent = reply.path("message").path("content");
        if (messageContent.isTextual() && !messageContent.asText().isEmpty()) {
            return messageContent.asText();
        }
        if (reply.path("content").isTextual() && !reply.get("content").asText().isEmpty()) {
            return reply.get("content").asText();
        }
        return reply.path("text").isTextual() ? reply.get("text").asText() : null;
    }

    /**
     * Joins a string or an array of strings. Returns null for any other shape.
     */
    static String joinText(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (!node.isArray()) {
            return null;
        }
        StringBuilder joined = new StringBuilder();
        for (JsonNode element : node) {
            if (element.isTextual()) {
                joined.append(element.asText());
            }
        }
        return joined.toString();
    }
}
