package com.realmgate.gateway.transport;

import java.util.Locale;

/**
 * Why a connection left the OPEN state.
 */
public enum CloseReason {
    // closed by this node (closeConnection, sweep eviction, shutdown)
    LOCAL,
    // peer closed the socket or the channel went away
    PEER,
    // handshake, read or write failure
    ERROR,
    // outbound queue full
    OVERFLOW;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
