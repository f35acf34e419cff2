package com.realmgate.gateway.transport;

/**
 * Event published by a connection onto the server's event queue.
 *
 * @param type         event kind
 * @param connectionId connection the event belongs to
 * @param payload      text frame for {@link Type#MESSAGE}, remote address for {@link Type#CONNECTED}
 * @param closeReason  set for {@link Type#DISCONNECTED} only
 */
public record TransportEvent(Type type, String connectionId, String payload, CloseReason closeReason) {

    public enum Type {
        CONNECTED,
        MESSAGE,
        DISCONNECTED
    }

    public static TransportEvent connected(String connectionId, String remoteAddress) {
        return new TransportEvent(Type.CONNECTED, connectionId, remoteAddress, null);
    }

    public static TransportEvent message(String connectionId, String text) {
        return new TransportEvent(Type.MESSAGE, connectionId, text, null);
    }

    public static TransportEvent disconnected(String connectionId, CloseReason reason) {
        return new TransportEvent(Type.DISCONNECTED, connectionId, null, reason);
    }
}
