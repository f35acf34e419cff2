package com.realmgate.gateway.session;

import com.realmgate.core.lifecycle.AgentRuntime;
import com.realmgate.core.lifecycle.Lifecycle;
import com.realmgate.core.metrics.MeterRegistryMetricSink;
import com.realmgate.core.metrics.MetricSink;
import com.realmgate.core.metrics.MetricsNames;
import com.realmgate.gateway.config.GatewayConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks admitted client connections and enforces the connection limit.
 * <p>
 * The record map and the admitted counter change together under {@code lock}, so
 * {@code admittedCount == connections.size()} holds at every release of the lock.
 * Every operation is synchronous and lock-bounded.
 * </p>
 */
public class ConnectionManager implements IConnectionManager, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final String AGENT_ID = "ConnectionManager";

    private final int maxConnections;
    private final Clock clock;
    private final AgentRuntime runtime;

    private final ReentrantLock lock = new ReentrantLock();
    // connectionId -> record; guarded by lock
    private final Map<String, ConnectionRecord> connections = new HashMap<>();
    // written under lock, read lock-free by stats
    private final AtomicInteger admittedCount = new AtomicInteger();
    private final AtomicInteger authenticatedCount = new AtomicInteger();

    public ConnectionManager(GatewayConfig config, MeterRegistry meterRegistry) {
        this(config, meterRegistry, Clock.systemUTC());
    }

    public ConnectionManager(GatewayConfig config, MeterRegistry meterRegistry, Clock clock) {
        this.maxConnections = config.getMaxConnections();
        this.clock = clock;
        this.runtime = new AgentRuntime(
            AGENT_ID,
            new MeterRegistryMetricSink(meterRegistry, MetricsNames.CONNECTION_MANAGER_PREFIX, AGENT_ID),
            clock
        );
    }

    // ==================== Lifecycle ====================

    @Override
    public void start() {
        if (!runtime.markStarted()) {
            log.warn("ConnectionManager already running");
            return;
        }
        publishGauges();
        log.info("ConnectionManager started (max connections: {})", maxConnections);
    }

    @Override
    public void stop() {
        if (!runtime.markStopped()) {
            return;
        }
        int dropped;
        lock.lock();
        try {
            dropped = connections.size();
            connections.clear();
            admittedCount.set(0);
            authenticatedCount.set(0);
            publishGauges();
        } finally {
            lock.unlock();
        }
        log.info("ConnectionManager stopped ({} connections dropped)", dropped);
    }

    @Override
    public boolean isRunning() {
        return runtime.isRunning();
    }

    public Map<String, String> healthSnapshot() {
        return runtime.healthSnapshot();
    }

    public MetricSink metrics() {
        return runtime.getMetrics();
    }

    // ==================== Admission ====================

    @Override
    public AdmissionResult admit(String connectionId, String clientIp) {
        Instant now = clock.instant();
        AdmissionResult result;

        lock.lock();
        try {
            if (admittedCount.get() >= maxConnections) {
                result = AdmissionResult.CAPACITY_EXCEEDED;
            } else if (connections.containsKey(connectionId)) {
                result = AdmissionResult.DUPLICATE;
            } else {
                connections.put(connectionId, ConnectionRecord.builder()
                    .connectionId(connectionId)
                    .clientIp(clientIp)
                    .connectedAt(now)
                    .lastActivity(now)
                    .build());
                admittedCount.incrementAndGet();
                publishGauges();
                result = AdmissionResult.ADMITTED;
            }
        } finally {
            lock.unlock();
        }

        switch (result) {
            case ADMITTED -> {
                runtime.getMetrics().increment("connection_accepted");
                log.info("Connection added: {} from {}", connectionId, clientIp);
            }
            case CAPACITY_EXCEEDED -> {
                runtime.getMetrics().increment("connection_rejected");
                log.warn("Connection limit reached ({}), rejecting {} from {}", maxConnections, connectionId, clientIp);
            }
            case DUPLICATE -> {
                runtime.getMetrics().increment("connection_rejected");
                log.warn("Connection id {} is already live, rejecting duplicate from {}", connectionId, clientIp);
            }
        }
        return result;
    }

    @Override
    public boolean remove(String connectionId) {
        ConnectionRecord removed;
        lock.lock();
        try {
            removed = connections.remove(connectionId);
            if (removed == null) {
                return false;
            }
            admittedCount.decrementAndGet();
            if (removed.isAuthenticated()) {
                authenticatedCount.decrementAndGet();
            }
            publishGauges();
        } finally {
            lock.unlock();
        }

        runtime.getMetrics().increment("connection_disconnected");
        log.info("Connection removed: {} (user={})", connectionId, removed.getUserId());
        return true;
    }

    @Override
    public boolean authenticate(String connectionId, String userId) {
        lock.lock();
        try {
            ConnectionRecord current = connections.get(connectionId);
            if (current == null) {
                return false;
            }
            if (!current.isAuthenticated()) {
                authenticatedCount.incrementAndGet();
            }
            connections.put(connectionId, current.toBuilder()
                .userId(userId)
                .authenticated(true)
                .build());
            publishGauges();
        } finally {
            lock.unlock();
        }

        log.info("Connection authenticated: {} -> user {}", connectionId, userId);
        return true;
    }

    // ==================== Activity ====================

    @Override
    public void touch(String connectionId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            connections.computeIfPresent(connectionId, (id, record) -> refreshed(record, now));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordReceived(String connectionId, long bytes) {
        Instant now = clock.instant();
        lock.lock();
        try {
            connections.computeIfPresent(connectionId, (id, record) ->
                refreshed(record, now).withBytesReceived(record.getBytesReceived() + Math.max(0, bytes)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSent(String connectionId, long bytes) {
        lock.lock();
        try {
            connections.computeIfPresent(connectionId, (id, record) ->
                record.withBytesSent(record.getBytesSent() + Math.max(0, bytes)));
        } finally {
            lock.unlock();
        }
    }

    private static ConnectionRecord refreshed(ConnectionRecord record, Instant now) {
        return now.isAfter(record.getLastActivity()) ? record.withLastActivity(now) : record;
    }

    // ==================== Queries ====================

    @Override
    public Optional<ConnectionRecord> get(String connectionId) {
        lock.lock();
        try {
            return Optional.ofNullable(connections.get(connectionId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConnectionStats stats() {
        int total;
        int authenticated;
        lock.lock();
        try {
            total = admittedCount.get();
            authenticated = authenticatedCount.get();
        } finally {
            lock.unlock();
        }
        double utilization = maxConnections > 0 ? (double) total / maxConnections : 0.0;
        return new ConnectionStats(total, authenticated, maxConnections, utilization);
    }

    // ==================== Sweep ====================

    @Override
    public List<String> sweep(Duration timeout) {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();

        lock.lock();
        try {
            for (ConnectionRecord record : connections.values()) {
                if (Duration.between(record.getLastActivity(), now).compareTo(timeout) > 0) {
                    expired.add(record.getConnectionId());
                }
            }
        } finally {
            lock.unlock();
        }

        // A connection that disconnected in between is skipped by remove
        List<String> evicted = new ArrayList<>(expired.size());
        for (String connectionId : expired) {
            if (remove(connectionId)) {
                evicted.add(connectionId);
            }
        }

        if (!evicted.isEmpty()) {
            runtime.getMetrics().increment("connections_cleaned", evicted.size());
            log.info("Cleaned up {} inactive connections", evicted.size());
        }
        return evicted;
    }

    private void publishGauges() {
        runtime.getMetrics().update("connections_total", admittedCount.get());
        runtime.getMetrics().update("authenticated_connections", authenticatedCount.get());
    }
}
