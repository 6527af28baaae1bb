package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * OpenAI-shaped embedding list ({@code object}, {@code data}, {@code model},
 * {@code usage}) returned to the caller, plus the token count accounted for it.
 */
public record EmbeddingReply(ObjectNode payload, int tokens) {
}
