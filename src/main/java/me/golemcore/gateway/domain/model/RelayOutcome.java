package me.golemcore.gateway.domain.model;

/**
 * Final state of a streaming session as seen by accounting.
 */
public record RelayOutcome(RelayState state, String completionText, int deltaCount, String errorMessage) {
}
