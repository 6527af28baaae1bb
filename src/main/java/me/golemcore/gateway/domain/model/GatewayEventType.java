package me.golemcore.gateway.domain.model;

/**
 * Structured event types published to the observability sink.
 */
public enum GatewayEventType {
    DISPATCH_STARTED, DISPATCH_REJECTED, UPSTREAM_OPENED, UPSTREAM_FAILED, MALFORMED_CHUNK, RELAY_TRANSITION, USAGE_RECORDED, USAGE_PERSIST_FAILED
}
