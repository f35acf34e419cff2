package com.realmgate.gateway;

import com.realmgate.core.error.InitializationException;
import com.realmgate.core.lifecycle.AgentRuntime;
import com.realmgate.core.lifecycle.Lifecycle;
import com.realmgate.core.metrics.MeterRegistryMetricSink;
import com.realmgate.core.metrics.MetricsNames;
import com.realmgate.core.util.BytesUtils;
import com.realmgate.gateway.config.GatewayConfig;
import com.realmgate.gateway.metrics.TransportMetrics;
import com.realmgate.gateway.protocol.GatewayMessageHandler;
import com.realmgate.gateway.session.ConnectionManager;
import com.realmgate.gateway.transport.CloseReason;
import com.realmgate.gateway.transport.TransportListener;
import com.realmgate.gateway.transport.TransportServer;
import com.realmgate.loadbalancer.balancer.LoadBalancer;
import com.realmgate.loadbalancer.config.LBConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Gateway node: WebSocket transport, connection admission and backend routing.
 * <p>
 * Wiring:
 * <ul>
 *   <li>upgrade requests pass {@link ConnectionManager#admit} before the handshake</li>
 *   <li>client frames are accounted, then answered by {@link GatewayMessageHandler}</li>
 *   <li>disconnects remove the record and release the backend assignment</li>
 *   <li>a periodic sweep evicts idle connections and closes their sockets</li>
 * </ul>
 * </p>
 */
public class Gateway implements Lifecycle, TransportListener {
    private static final Logger log = LoggerFactory.getLogger(Gateway.class);

    private static final String AGENT_ID = "Gateway";

    private final GatewayConfig config;
    private final LBConfig lbConfig;
    private final AgentRuntime runtime;

    @Getter
    private final ConnectionManager connectionManager;
    @Getter
    private final LoadBalancer loadBalancer;
    @Getter
    private final TransportServer transportServer;
    private final GatewayMessageHandler messageHandler;

    private Disposable inactivitySweep;

    public Gateway(GatewayConfig config, LBConfig lbConfig, MeterRegistry meterRegistry) {
        this(config, lbConfig, meterRegistry, Clock.systemUTC());
    }

    public Gateway(GatewayConfig config, LBConfig lbConfig, MeterRegistry meterRegistry, Clock clock) {
        this.config = config;
        this.lbConfig = lbConfig;
        this.runtime = new AgentRuntime(
            AGENT_ID,
            new MeterRegistryMetricSink(meterRegistry, MetricsNames.GATEWAY_PREFIX, AGENT_ID),
            clock
        );
        this.connectionManager = new ConnectionManager(config, meterRegistry, clock);
        this.loadBalancer = new LoadBalancer(lbConfig, meterRegistry, clock);
        this.transportServer = new TransportServer(
            config,
            new TransportMetrics(meterRegistry, config.getNodeId()),
            (connectionId, clientIp) -> connectionManager.admit(connectionId, clientIp).isAdmitted()
        );
        this.messageHandler = new GatewayMessageHandler(connectionManager, loadBalancer);
        transportServer.addListener(this);
    }

    // ==================== Lifecycle ====================

    /**
     * @throws InitializationException if the WebSocket port cannot be bound
     */
    @Override
    public synchronized void start() {
        if (!runtime.markStarted()) {
            log.warn("Gateway {} already running", config.getNodeId());
            return;
        }

        connectionManager.start();
        loadBalancer.start();
        loadBalancer.startHealthSweep(lbConfig.getHealthCheckInterval());
        try {
            transportServer.start();
        } catch (InitializationException e) {
            loadBalancer.stop();
            connectionManager.stop();
            runtime.markStopped();
            throw e;
        }

        inactivitySweep = Flux.interval(config.getSweepInterval(), config.getSweepInterval(), Schedulers.parallel())
            .doOnNext(tick -> sweepInactive())
            .onErrorContinue((err, tick) -> log.error("Inactivity sweep pass failed", err))
            .subscribe();

        log.info("Gateway {} started (ws port {}, max connections {})",
            config.getNodeId(), transportServer.port(), config.getMaxConnections());
    }

    @Override
    public synchronized void stop() {
        if (!runtime.markStopped()) {
            return;
        }
        log.info("Stopping gateway {}", config.getNodeId());

        if (inactivitySweep != null) {
            inactivitySweep.dispose();
            inactivitySweep = null;
        }
        transportServer.stop();
        loadBalancer.stop();
        connectionManager.stop();

        log.info("Gateway {} stopped", config.getNodeId());
    }

    @Override
    public boolean isRunning() {
        return runtime.isRunning();
    }

    public Map<String, String> healthSnapshot() {
        runtime.getMetrics().update("live_transports", transportServer.connectionCount());
        return runtime.healthSnapshot();
    }

    // ==================== Sweep ====================

    /**
     * Evicts connections idle past the inactivity timeout and closes their sockets.
     *
     * @return evicted connection ids
     */
    public List<String> sweepInactive() {
        List<String> evicted = connectionManager.sweep(config.getInactivityTimeout());
        for (String connectionId : evicted) {
            loadBalancer.releaseConnection(connectionId);
            transportServer.closeConnection(connectionId);
        }
        if (!evicted.isEmpty()) {
            runtime.getMetrics().increment("connections_evicted", evicted.size());
        }
        return evicted;
    }

    // ==================== Transport events ====================

    @Override
    public void onConnected(String connectionId, String remoteAddress) {
        runtime.getMetrics().increment("connections_opened");
        log.debug("Client connected: {} from {}", connectionId, remoteAddress);
    }

    @Override
    public void onMessage(String connectionId, String text) {
        MDC.put("connectionId", connectionId);
        try {
            connectionManager.recordReceived(connectionId, BytesUtils.utf8Length(text));
            runtime.getMetrics().increment("messages_received");

            String reply = messageHandler.handle(connectionId, text);
            if (transportServer.sendTo(connectionId, reply)) {
                connectionManager.recordSent(connectionId, BytesUtils.utf8Length(reply));
            }
        } finally {
            MDC.remove("connectionId");
        }
    }

    @Override
    public void onDisconnected(String connectionId, CloseReason reason) {
        connectionManager.remove(connectionId);
        loadBalancer.releaseConnection(connectionId)
            .ifPresent(serverId -> log.debug("Released {} from server {}", connectionId, serverId));
        log.debug("Client disconnected: {} ({})", connectionId, reason.tagValue());
    }
}
