package com.realmgate.gateway.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realmgate.core.error.InitializationException;
import com.realmgate.core.util.JsonUtils;
import com.realmgate.gateway.Gateway;
import com.realmgate.gateway.config.GatewayConfig;
import com.realmgate.gateway.metrics.PrometheusMetricsExporter;
import com.realmgate.loadbalancer.balancer.ILoadBalancer;
import com.realmgate.loadbalancer.node.ServerNode;
import com.realmgate.loadbalancer.strategy.BalancingStrategy;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.NettyOutbound;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Admin HTTP server: health, Prometheus scrape, connection stats and backend registry API.
 */
public class AdminHttpServer {
    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private final GatewayConfig config;
    private final Gateway gateway;
    private final ILoadBalancer loadBalancer;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public AdminHttpServer(GatewayConfig config, Gateway gateway, PrometheusMetricsExporter metricsExporter) {
        this(config, gateway, gateway.getLoadBalancer(), metricsExporter);
    }

    AdminHttpServer(GatewayConfig config, Gateway gateway, ILoadBalancer loadBalancer,
                    PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.gateway = gateway;
        this.loadBalancer = loadBalancer;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @throws InitializationException if the admin port cannot be bound
     */
    public DisposableServer start() {
        try {
            server = reactor.netty.http.server.HttpServer.create()
                .port(config.getAdminPort())
                .route(this::configureRoutes)
                .bind()
                .doOnNext(bound -> log.info("Admin HTTP server started on port {}", bound.port()))
                .doOnError(err -> log.error("Failed to start admin HTTP server", err))
                .block(Duration.ofSeconds(45));
        } catch (RuntimeException e) {
            throw new InitializationException("Failed to bind admin HTTP server on port " + config.getAdminPort(), e);
        }
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
            server = null;
        }
    }

    public int port() {
        return server.port();
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health snapshots of every agent
            .get("/healthz", (req, res) -> {
                Map<String, Object> health = new LinkedHashMap<>();
                health.put("gateway", gateway.healthSnapshot());
                health.put("connectionManager", gateway.getConnectionManager().healthSnapshot());
                health.put("loadBalancer", loadBalancer.healthSnapshot());
                HttpResponseStatus status = gateway.isRunning()
                    ? HttpResponseStatus.OK
                    : HttpResponseStatus.SERVICE_UNAVAILABLE;
                return json(res, status, health);
            })
            // Prometheus scrape
            .get("/metrics", (req, res) ->
                res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
            )
            .get("/api/v1/connections/stats", (req, res) ->
                json(res, HttpResponseStatus.OK, gateway.getConnectionManager().stats().toMap())
            )
            .get("/api/v1/servers", (req, res) ->
                json(res, HttpResponseStatus.OK, loadBalancer.listServers().stream().map(AdminHttpServer::describe).toList())
            )
            .post("/api/v1/servers", (req, res) -> withBody(req, res, ServerRegistration.class, body -> {
                if (body.getId() == null || body.getHost() == null || body.getPort() <= 0) {
                    return json(res, HttpResponseStatus.BAD_REQUEST, Map.of("error", "id, host and port are required"));
                }
                try {
                    boolean added = body.getMaxConnections() != null
                        ? loadBalancer.addServer(body.getId(), body.getHost(), body.getPort(), body.getMaxConnections())
                        : loadBalancer.addServer(body.getId(), body.getHost(), body.getPort());
                    if (!added) {
                        return json(res, HttpResponseStatus.CONFLICT, Map.of("error", "server already registered"));
                    }
                } catch (IllegalArgumentException e) {
                    return json(res, HttpResponseStatus.BAD_REQUEST, Map.of("error", e.getMessage()));
                }
                return describeOrNotFound(res, HttpResponseStatus.CREATED, body.getId());
            }))
            .delete("/api/v1/servers/{id}", (req, res) -> {
                String serverId = req.param("id");
                if (!loadBalancer.removeServer(serverId)) {
                    return json(res, HttpResponseStatus.NOT_FOUND, Map.of("error", "unknown server"));
                }
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })
            .post("/api/v1/servers/{id}/status", (req, res) -> withBody(req, res, StatusReport.class, body -> {
                String serverId = req.param("id");
                if (!loadBalancer.updateStatus(serverId, body.getCpu(), body.getMem(), body.isHealthy())) {
                    return json(res, HttpResponseStatus.NOT_FOUND, Map.of("error", "unknown server"));
                }
                return describeOrNotFound(res, HttpResponseStatus.OK, serverId);
            }))
            // Where would a client from this address be routed
            .get("/api/v1/select", (req, res) -> {
                String clientIp = queryParam(req, "clientIp").orElse(null);
                return loadBalancer.select(clientIp)
                    .map(serverId -> json(res, HttpResponseStatus.OK, Map.of("serverId", serverId)))
                    .orElseGet(() -> json(res, HttpResponseStatus.SERVICE_UNAVAILABLE,
                        Map.of("error", "No healthy servers available")));
            })
            .put("/api/v1/strategy", (req, res) -> {
                Optional<String> name = queryParam(req, "name");
                if (name.isEmpty()) {
                    return json(res, HttpResponseStatus.BAD_REQUEST, Map.of("error", "Missing name parameter"));
                }
                try {
                    loadBalancer.setStrategy(BalancingStrategy.fromName(name.get()));
                } catch (IllegalArgumentException e) {
                    return json(res, HttpResponseStatus.BAD_REQUEST, Map.of("error", e.getMessage()));
                }
                return json(res, HttpResponseStatus.OK, Map.of("strategy", loadBalancer.getStrategy().tagValue()));
            });
    }

    // The server may have been removed by a concurrent DELETE since it was added or updated
    private NettyOutbound describeOrNotFound(HttpServerResponse res, HttpResponseStatus status, String serverId) {
        return loadBalancer.getServer(serverId)
            .map(node -> json(res, status, describe(node)))
            .orElseGet(() -> json(res, HttpResponseStatus.NOT_FOUND, Map.of("error", "unknown server")));
    }

    private static Optional<String> queryParam(HttpServerRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() || values.get(0).isEmpty()
            ? Optional.empty()
            : Optional.of(values.get(0));
    }

    private static <T> Mono<Void> withBody(HttpServerRequest req, HttpServerResponse res, Class<T> type,
                                           Function<T, NettyOutbound> handler) {
        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .flatMap(text -> {
                T body;
                try {
                    body = JsonUtils.readValue(text, type);
                } catch (IllegalArgumentException e) {
                    log.warn("Rejected admin request body: {}", e.getMessage());
                    return Mono.from(json(res, HttpResponseStatus.BAD_REQUEST, Map.of("error", "malformed JSON body")));
                }
                return Mono.from(handler.apply(body));
            });
    }

    private static NettyOutbound json(HttpServerResponse res, HttpResponseStatus status, Object body) {
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(body)));
    }

    private static Map<String, Object> describe(ServerNode node) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", node.getId());
        view.put("host", node.getHost());
        view.put("port", node.getPort());
        view.put("currentConnections", node.getCurrentConnections());
        view.put("maxConnections", node.getMaxConnections());
        view.put("cpuUsage", node.getCpuUsage());
        view.put("memoryUsage", node.getMemoryUsage());
        view.put("loadScore", node.getLoadScore());
        view.put("healthy", node.isHealthy());
        view.put("lastHealthCheck", node.getLastHealthCheck());
        return view;
    }

    /**
     * Body of {@code POST /api/v1/servers}; {@code maxConnections} falls back to the balancer default.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    static class ServerRegistration {
        @JsonProperty("id")
        String id;
        @JsonProperty("host")
        String host;
        @JsonProperty("port")
        int port;
        @JsonProperty("maxConnections")
        Integer maxConnections;
    }

    /**
     * Body of {@code POST /api/v1/servers/{id}/status}.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    static class StatusReport {
        @JsonProperty("cpu")
        double cpu;
        @JsonProperty("mem")
        double mem;
        @JsonProperty("healthy")
        boolean healthy;
    }
}
