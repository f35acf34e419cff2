package com.realmgate.gateway.transport;

/**
 * Receives transport events from the server's dispatcher thread.
 * <p>
 * Events of one connection arrive in order: CONNECTED, then its messages, then
 * DISCONNECTED. By the time {@link #onDisconnected} runs the connection is already
 * gone from the server registry.
 * </p>
 */
public interface TransportListener {

    default void onConnected(String connectionId, String remoteAddress) {
    }

    default void onMessage(String connectionId, String text) {
    }

    default void onDisconnected(String connectionId, CloseReason reason) {
    }
}
