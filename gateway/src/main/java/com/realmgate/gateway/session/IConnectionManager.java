package com.realmgate.gateway.session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Registry and admission controller for client connections.
 */
public interface IConnectionManager {

    /**
     * Admits a connection if capacity allows and the id is not already live.
     *
     * @param connectionId id assigned by the transport layer
     * @param clientIp     source address
     * @return admission outcome; rejections leave the registry untouched
     */
    AdmissionResult admit(String connectionId, String clientIp);

    /**
     * @return true if the connection was registered
     */
    boolean remove(String connectionId);

    boolean authenticate(String connectionId, String userId);

    /**
     * Refreshes the activity timestamp. Never moves it backwards.
     */
    void touch(String connectionId);

    void recordReceived(String connectionId, long bytes);

    void recordSent(String connectionId, long bytes);

    Optional<ConnectionRecord> get(String connectionId);

    ConnectionStats stats();

    /**
     * Evicts every connection idle for longer than {@code timeout}.
     *
     * @return ids of the evicted connections
     */
    List<String> sweep(Duration timeout);
}
