package me.golemcore.gateway.domain.model;

/**
 * Authoritative token figures reported by a backend in a non-streaming reply.
 */
public record TokenUsage(int inputTokens, int outputTokens) {
}
