package com.realmgate.loadbalancer.balancer;

import com.realmgate.core.lifecycle.AgentRuntime;
import com.realmgate.core.lifecycle.Lifecycle;
import com.realmgate.core.metrics.MeterRegistryMetricSink;
import com.realmgate.core.metrics.MetricSink;
import com.realmgate.core.metrics.MetricsNames;
import com.realmgate.core.metrics.MetricsTags;
import com.realmgate.loadbalancer.config.LBConfig;
import com.realmgate.loadbalancer.node.AssignmentResult;
import com.realmgate.loadbalancer.node.ServerNode;
import com.realmgate.loadbalancer.strategy.BalancingStrategy;
import com.realmgate.loadbalancer.strategy.SelectionStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory backend registry with five selection strategies and a staleness sweep.
 * <p>
 * {@code lock} guards the server registry and the assignment map together: assign and
 * release change a node's counter and the mapping in the same critical section, never
 * as two separate steps. Selection, assignment and status updates are synchronous and
 * never suspend.
 * </p>
 * <p>
 * Selection and assignment are separate calls, so a node recommended by {@link #select}
 * may be full by the time {@link #assign} runs; {@code assign} re-validates capacity.
 * </p>
 */
public class LoadBalancer implements ILoadBalancer, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private static final String AGENT_ID = "LoadBalancer";

    private final LBConfig config;
    private final Clock clock;
    private final AgentRuntime runtime;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock lock = new ReentrantLock();
    // serverId -> node, insertion ordered; guarded by lock
    private final Map<String, ServerNode> servers = new LinkedHashMap<>();
    // connectionId -> serverId; guarded by lock
    private final Map<String, String> connectionToServer = new HashMap<>();

    // One instance per strategy so the round-robin cursor survives strategy switches
    private final Map<BalancingStrategy, SelectionStrategy> selections = new EnumMap<>(BalancingStrategy.class);
    private volatile BalancingStrategy strategy;

    private final AtomicReference<Disposable> healthSweep = new AtomicReference<>();

    public LoadBalancer(LBConfig config, MeterRegistry meterRegistry) {
        this(config, meterRegistry, Clock.systemUTC());
    }

    public LoadBalancer(LBConfig config, MeterRegistry meterRegistry, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.runtime = new AgentRuntime(
            AGENT_ID,
            new MeterRegistryMetricSink(meterRegistry, MetricsNames.LOAD_BALANCER_PREFIX, AGENT_ID),
            clock
        );
        for (BalancingStrategy value : BalancingStrategy.values()) {
            selections.put(value, value.newSelection());
        }
        this.strategy = config.getStrategy();
    }

    // ==================== Lifecycle ====================

    @Override
    public void start() {
        if (!runtime.markStarted()) {
            log.warn("LoadBalancer already running");
            return;
        }
        log.info("LoadBalancer started with strategy: {}", strategy);
    }

    @Override
    public void stop() {
        if (!runtime.markStopped()) {
            return;
        }
        Disposable sweep = healthSweep.getAndSet(null);
        if (sweep != null) {
            sweep.dispose();
        }
        log.info("LoadBalancer stopped");
    }

    @Override
    public boolean isRunning() {
        return runtime.isRunning();
    }

    @Override
    public Map<String, String> healthSnapshot() {
        return runtime.healthSnapshot();
    }

    public MetricSink metrics() {
        return runtime.getMetrics();
    }

    // ==================== Registry ====================

    @Override
    public boolean addServer(String serverId, String host, int port) {
        return addServer(serverId, host, port, config.getDefaultMaxConnections());
    }

    @Override
    public boolean addServer(String serverId, String host, int port, int maxConnections) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive, got " + maxConnections);
        }

        ServerNode node = ServerNode.builder()
            .id(serverId)
            .host(host)
            .port(port)
            .maxConnections(maxConnections)
            .lastHealthCheck(clock.instant())
            .build();

        lock.lock();
        try {
            if (servers.putIfAbsent(serverId, node) != null) {
                log.warn("Server {} already registered, ignoring add", serverId);
                return false;
            }
            publishRegistryGauges();
        } finally {
            lock.unlock();
        }

        log.info("Added server: {} ({}:{}, max={})", serverId, host, port, maxConnections);
        return true;
    }

    @Override
    public boolean removeServer(String serverId) {
        int dropped;
        lock.lock();
        try {
            if (servers.remove(serverId) == null) {
                return false;
            }
            int before = connectionToServer.size();
            connectionToServer.values().removeIf(serverId::equals);
            dropped = before - connectionToServer.size();
            publishRegistryGauges();
        } finally {
            lock.unlock();
        }

        log.info("Removed server: {} ({} assignments dropped)", serverId, dropped);
        return true;
    }

    @Override
    public Optional<ServerNode> getServer(String serverId) {
        lock.lock();
        try {
            return Optional.ofNullable(servers.get(serverId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ServerNode> listServers() {
        lock.lock();
        try {
            return List.copyOf(servers.values());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Selection ====================

    @Override
    public void setStrategy(BalancingStrategy strategy) {
        this.strategy = strategy;
        log.info("Load balancing strategy changed to: {}", strategy);
    }

    @Override
    public BalancingStrategy getStrategy() {
        return strategy;
    }

    @Override
    public Optional<String> select(String clientIp) {
        BalancingStrategy active = strategy;
        Optional<ServerNode> chosen;

        lock.lock();
        try {
            List<ServerNode> healthy = new ArrayList<>(servers.size());
            for (ServerNode node : servers.values()) {
                if (node.isHealthy()) {
                    healthy.add(node);
                }
            }
            chosen = healthy.isEmpty()
                ? Optional.empty()
                : selections.get(active).select(healthy, clientIp);
        } finally {
            lock.unlock();
        }

        if (chosen.isEmpty()) {
            log.warn("No healthy servers available (strategy={}, client={})", active, clientIp);
            runtime.getMetrics().increment("selection_failed");
            selectionCounter(active, "no_healthy_server").increment();
            return Optional.empty();
        }

        selectionCounter(active, "selected").increment();
        log.debug("Selected server {} for client {} using {}", chosen.get().getId(), clientIp, active);
        return chosen.map(ServerNode::getId);
    }

    // ==================== Assignment ====================

    @Override
    public AssignmentResult assign(String serverId, String connectionId) {
        AssignmentResult result;
        lock.lock();
        try {
            result = tryAssign(serverId, connectionId);
        } finally {
            lock.unlock();
        }

        assignmentCounter(result).increment();
        switch (result) {
            case ASSIGNED -> {
                runtime.getMetrics().increment("assignments_total");
                log.debug("Assigned connection {} to server {}", connectionId, serverId);
            }
            case UNKNOWN_SERVER -> log.error("Server not found: {}", serverId);
            case CAPACITY_EXCEEDED -> {
                runtime.getMetrics().increment("assignment_rejected");
                log.warn("Server {} cannot accept more connections", serverId);
            }
            case ALREADY_ASSIGNED -> log.warn("Connection {} is already assigned, refusing {}", connectionId, serverId);
        }
        return result;
    }

    private AssignmentResult tryAssign(String serverId, String connectionId) {
        ServerNode node = servers.get(serverId);
        if (node == null) {
            return AssignmentResult.UNKNOWN_SERVER;
        }
        if (connectionToServer.containsKey(connectionId)) {
            return AssignmentResult.ALREADY_ASSIGNED;
        }
        if (!node.canAcceptConnection(config.getLoadScoreCeiling())) {
            return AssignmentResult.CAPACITY_EXCEEDED;
        }
        servers.put(serverId, node.withCurrentConnections(node.getCurrentConnections() + 1));
        connectionToServer.put(connectionId, serverId);
        return AssignmentResult.ASSIGNED;
    }

    @Override
    public boolean release(String serverId, String connectionId) {
        lock.lock();
        try {
            if (!serverId.equals(connectionToServer.get(connectionId))) {
                return false;
            }
            releaseLocked(serverId, connectionId);
        } finally {
            lock.unlock();
        }

        log.debug("Released connection {} from server {}", connectionId, serverId);
        return true;
    }

    @Override
    public Optional<String> releaseConnection(String connectionId) {
        String serverId;
        lock.lock();
        try {
            serverId = connectionToServer.get(connectionId);
            if (serverId == null) {
                return Optional.empty();
            }
            releaseLocked(serverId, connectionId);
        } finally {
            lock.unlock();
        }

        log.debug("Released connection {} from server {}", connectionId, serverId);
        return Optional.of(serverId);
    }

    private void releaseLocked(String serverId, String connectionId) {
        connectionToServer.remove(connectionId);
        ServerNode node = servers.get(serverId);
        if (node != null) {
            servers.put(serverId, node.withCurrentConnections(Math.max(0, node.getCurrentConnections() - 1)));
        }
    }

    @Override
    public Optional<String> assignedServer(String connectionId) {
        lock.lock();
        try {
            return Optional.ofNullable(connectionToServer.get(connectionId));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Health ====================

    @Override
    public boolean updateStatus(String serverId, double cpuUsage, double memoryUsage, boolean healthy) {
        lock.lock();
        try {
            ServerNode node = servers.get(serverId);
            if (node == null) {
                return false;
            }
            servers.put(serverId, node.toBuilder()
                .cpuUsage(cpuUsage)
                .memoryUsage(memoryUsage)
                .healthy(healthy)
                .lastHealthCheck(clock.instant())
                .build());
            publishRegistryGauges();
        } finally {
            lock.unlock();
        }

        log.debug("Updated server {} status: CPU={}, Memory={}, Healthy={}",
            serverId, String.format("%.2f", cpuUsage), String.format("%.2f", memoryUsage), healthy);
        return true;
    }

    @Override
    public void startHealthSweep(Duration interval) {
        if (!isRunning()) {
            log.warn("Load balancer not running, health sweep not started");
            return;
        }
        Disposable sweep = Flux.interval(Duration.ZERO, interval, Schedulers.parallel())
            .doOnNext(tick -> performHealthSweep())
            .onErrorContinue((err, tick) -> log.error("Health sweep pass failed", err))
            .subscribe();

        Disposable previous = healthSweep.getAndSet(sweep);
        if (previous != null) {
            previous.dispose();
        }
        log.info("Health check started with interval: {} seconds", interval.toSeconds());
    }

    @Override
    public List<String> performHealthSweep() {
        Instant now = clock.instant();
        Duration staleAfter = config.getHealthStaleAfter();
        List<String> markedUnhealthy = new ArrayList<>();

        lock.lock();
        try {
            for (Map.Entry<String, ServerNode> entry : servers.entrySet()) {
                ServerNode node = entry.getValue();
                Duration sinceCheck = Duration.between(node.getLastHealthCheck(), now);
                if (node.isHealthy() && sinceCheck.compareTo(staleAfter) > 0) {
                    entry.setValue(node.withHealthy(false));
                    markedUnhealthy.add(node.getId());
                }
            }
            publishRegistryGauges();
        } finally {
            lock.unlock();
        }

        for (String serverId : markedUnhealthy) {
            log.warn("Server {} marked as unhealthy due to no recent health check", serverId);
        }
        if (!markedUnhealthy.isEmpty()) {
            runtime.getMetrics().increment("servers_marked_unhealthy", markedUnhealthy.size());
        }
        return markedUnhealthy;
    }

    // ==================== Metrics ====================

    // Caller holds lock
    private void publishRegistryGauges() {
        long healthy = servers.values().stream().filter(ServerNode::isHealthy).count();
        runtime.getMetrics().update("servers_total", servers.size());
        runtime.getMetrics().update("servers_healthy", healthy);
    }

    private Counter selectionCounter(BalancingStrategy strategy, String result) {
        return Counter.builder(MetricsNames.LB_SELECTIONS_TOTAL)
            .tag(MetricsTags.STRATEGY, strategy.tagValue())
            .tag(MetricsTags.RESULT, result)
            .description("Server selections by strategy and outcome")
            .register(meterRegistry);
    }

    private Counter assignmentCounter(AssignmentResult result) {
        return Counter.builder(MetricsNames.LB_ASSIGNMENTS_TOTAL)
            .tag(MetricsTags.RESULT, result.tagValue())
            .description("Connection assignment attempts by outcome")
            .register(meterRegistry);
    }
}
