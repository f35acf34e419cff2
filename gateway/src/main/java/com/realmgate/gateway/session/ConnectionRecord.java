package com.realmgate.gateway.session;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable snapshot of one admitted client connection.
 * <p>
 * The registry replaces the stored record on every change, so a record handed out by
 * {@link ConnectionManager#get(String)} never changes under the caller.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ConnectionRecord {
    String connectionId;
    String userId;
    String clientIp;
    Instant connectedAt;
    Instant lastActivity;
    boolean authenticated;
    long bytesSent;
    long bytesReceived;
}
