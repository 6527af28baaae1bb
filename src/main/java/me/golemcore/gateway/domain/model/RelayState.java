package me.golemcore.gateway.domain.model;

/**
 * Lifecycle of one client-facing streaming session.
 */
public enum RelayState {

    IDLE, STREAMING, COMPLETED, FAILED, CLIENT_CLOSED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CLIENT_CLOSED;
    }
}
