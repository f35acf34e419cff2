package com.realmgate.gateway.transport;

/**
 * Lifecycle of a {@link TransportConnection}. Transitions only move forward;
 * {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
