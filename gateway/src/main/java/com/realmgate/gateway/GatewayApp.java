package com.realmgate.gateway;

import com.realmgate.core.error.InitializationException;
import com.realmgate.gateway.config.GatewayConfig;
import com.realmgate.gateway.http.AdminHttpServer;
import com.realmgate.gateway.metrics.PrometheusMetricsExporter;
import com.realmgate.loadbalancer.config.LBConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main entry point for a gateway node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve client WebSockets at {@code WS_PATH} on {@code WS_PORT}</li>
 *   <li>Admit, authenticate and route sessions to backend servers</li>
 *   <li>Expose /healthz, /metrics and the backend registry API on {@code ADMIN_PORT}</li>
 * </ul>
 * </p>
 */
public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromEnv();
        LBConfig lbConfig = LBConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting gateway node: {}", config.getNodeId());
        log.info("  WebSocket: port {} path {}", config.getWsPort(), config.getWsPath());
        log.info("  Admin: port {}", config.getAdminPort());
        log.info("  Balancing strategy: {}", lbConfig.getStrategy());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        Gateway gateway = new Gateway(config, lbConfig, metricsExporter.getRegistry());
        AdminHttpServer adminServer = new AdminHttpServer(config, gateway, metricsExporter);

        try {
            gateway.start();
            adminServer.start();
        } catch (InitializationException e) {
            log.error("Gateway node {} failed to start", config.getNodeId(), e);
            adminServer.stop();
            gateway.stop();
            System.exit(1);
        }

        log.info("Gateway node {} is ready", config.getNodeId());

        handleShutdown(config, gateway, adminServer);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(GatewayConfig config, Gateway gateway, AdminHttpServer adminServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            gateway.stop();
            adminServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
