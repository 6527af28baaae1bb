package me.golemcore.gateway.domain.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Backend-native HTTP request produced by an adapter's encode step.
 */
public record WireRequest(String url, Map<String, String> headers, ObjectNode body, boolean stream) {

    public WireRequest {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }
}
