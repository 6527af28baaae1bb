package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Non-streaming dispatch result.
 *
 * @param content
 *            completion text extracted with the adapter's rules
 * @param raw
 *            backend payload as received
 * @param passthrough
 *            whether the raw payload is returned to the caller instead of
 *            {@code {content}}
 */
public record ChatReply(String content, JsonNode raw, boolean passthrough) {
}
