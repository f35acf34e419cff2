package com.realmgate.gateway.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.realmgate.core.util.JsonUtils;
import com.realmgate.gateway.Gateway;
import com.realmgate.gateway.config.GatewayConfig;
import com.realmgate.gateway.metrics.PrometheusMetricsExporter;
import com.realmgate.loadbalancer.balancer.LoadBalancer;
import com.realmgate.loadbalancer.config.LBConfig;
import com.realmgate.loadbalancer.strategy.BalancingStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.ByteBufMono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdminHttpServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private Gateway gateway;
    private AdminHttpServer adminServer;
    private HttpClient http;

    private record Response(int status, String body) {
        JsonNode json() {
            return JsonUtils.readValue(body, JsonNode.class);
        }
    }

    @BeforeEach
    void setUp() {
        GatewayConfig config = GatewayConfig.builder()
            .wsPort(0)
            .adminPort(0)
            .workerThreads(1)
            .maxConnections(10)
            .build();
        PrometheusMetricsExporter exporter =
            new PrometheusMetricsExporter(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
        gateway = new Gateway(config, LBConfig.builder().build(), exporter.getRegistry());
        gateway.start();
        adminServer = new AdminHttpServer(config, gateway, exporter);
        adminServer.start();
        http = HttpClient.create().port(adminServer.port());
    }

    @AfterEach
    void tearDown() {
        adminServer.stop();
        gateway.stop();
    }

    private static Mono<Response> toResponse(HttpClientResponse res, ByteBufMono body) {
        return body.asString().defaultIfEmpty("").map(text -> new Response(res.status().code(), text));
    }

    private Response get(String uri) {
        return http.get().uri(uri).responseSingle(AdminHttpServerTest::toResponse).block(TIMEOUT);
    }

    private Response post(String uri, String json) {
        return http.post().uri(uri)
            .send(ByteBufFlux.fromString(Mono.just(json)))
            .responseSingle(AdminHttpServerTest::toResponse)
            .block(TIMEOUT);
    }

    private Response put(String uri) {
        return http.put().uri(uri).responseSingle(AdminHttpServerTest::toResponse).block(TIMEOUT);
    }

    private Response delete(String uri) {
        return http.delete().uri(uri).responseSingle(AdminHttpServerTest::toResponse).block(TIMEOUT);
    }

    @Test
    @DisplayName("Health lists every agent's snapshot")
    void health() {
        Response response = get("/healthz");

        assertEquals(200, response.status());
        JsonNode health = response.json();
        assertEquals("true", health.get("gateway").get("running").asText());
        assertEquals("ConnectionManager", health.get("connectionManager").get("agent_id").asText());
        assertEquals("LoadBalancer", health.get("loadBalancer").get("agent_id").asText());
    }

    @Test
    @DisplayName("Servers can be registered, reported on, selected and removed")
    void serverRegistry() {
        Response created = post("/api/v1/servers",
            "{\"id\":\"game-1\",\"host\":\"10.0.0.1\",\"port\":9001,\"maxConnections\":50}");
        assertEquals(201, created.status());
        assertEquals(50, created.json().get("maxConnections").asInt());
        assertTrue(created.json().get("healthy").asBoolean());

        assertEquals(409, post("/api/v1/servers", "{\"id\":\"game-1\",\"host\":\"10.0.0.9\",\"port\":1}").status());
        assertEquals(400, post("/api/v1/servers", "{\"id\":\"game-2\"}").status());
        assertEquals(400, post("/api/v1/servers", "not json").status());

        Response listed = get("/api/v1/servers");
        assertEquals(200, listed.status());
        assertEquals(1, listed.json().size());
        assertEquals("game-1", listed.json().get(0).get("id").asText());

        Response selected = get("/api/v1/select?clientIp=203.0.113.7");
        assertEquals(200, selected.status());
        assertEquals("game-1", selected.json().get("serverId").asText());

        Response reported = post("/api/v1/servers/game-1/status", "{\"cpu\":0.5,\"mem\":0.25,\"healthy\":false}");
        assertEquals(200, reported.status());
        assertFalse(reported.json().get("healthy").asBoolean());
        assertEquals(503, get("/api/v1/select?clientIp=203.0.113.7").status());

        assertEquals(404, post("/api/v1/servers/ghost/status", "{\"cpu\":0.1,\"mem\":0.1,\"healthy\":true}").status());

        assertEquals(204, delete("/api/v1/servers/game-1").status());
        assertEquals(404, delete("/api/v1/servers/game-1").status());
        assertEquals(0, get("/api/v1/servers").json().size());
    }

    @Test
    @DisplayName("A server removed between the write and the reply answers 404, not 500")
    void serverRemovedConcurrently() {
        LoadBalancer vanishing = new LoadBalancer(LBConfig.builder().build(), new SimpleMeterRegistry()) {
            @Override
            public boolean addServer(String serverId, String host, int port, int maxConnections) {
                boolean added = super.addServer(serverId, host, port, maxConnections);
                if (serverId.equals("game-1")) {
                    removeServer(serverId);
                }
                return added;
            }

            @Override
            public boolean updateStatus(String serverId, double cpuUsage, double memoryUsage, boolean healthy) {
                boolean updated = super.updateStatus(serverId, cpuUsage, memoryUsage, healthy);
                removeServer(serverId);
                return updated;
            }
        };
        GatewayConfig config = GatewayConfig.builder().adminPort(0).build();
        AdminHttpServer racing = new AdminHttpServer(config, gateway, vanishing,
            new PrometheusMetricsExporter(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT)));
        racing.start();
        try {
            HttpClient client = HttpClient.create().port(racing.port());

            Response created = client.post().uri("/api/v1/servers")
                .send(ByteBufFlux.fromString(Mono.just(
                    "{\"id\":\"game-1\",\"host\":\"10.0.0.1\",\"port\":9001,\"maxConnections\":50}")))
                .responseSingle(AdminHttpServerTest::toResponse)
                .block(TIMEOUT);
            assertEquals(404, created.status());

            vanishing.addServer("game-2", "10.0.0.2", 9002);
            Response reported = client.post().uri("/api/v1/servers/game-2/status")
                .send(ByteBufFlux.fromString(Mono.just("{\"cpu\":0.1,\"mem\":0.1,\"healthy\":true}")))
                .responseSingle(AdminHttpServerTest::toResponse)
                .block(TIMEOUT);
            assertEquals(404, reported.status());
        } finally {
            racing.stop();
        }
    }

    @Test
    @DisplayName("Strategy can be switched by name; unknown names are rejected")
    void strategy() {
        Response ok = put("/api/v1/strategy?name=ip-hash");
        assertEquals(200, ok.status());
        assertEquals("ip_hash", ok.json().get("strategy").asText());
        assertEquals(BalancingStrategy.IP_HASH, gateway.getLoadBalancer().getStrategy());

        assertEquals(400, put("/api/v1/strategy?name=fastest").status());
        assertEquals(400, put("/api/v1/strategy").status());
        assertEquals(BalancingStrategy.IP_HASH, gateway.getLoadBalancer().getStrategy());
    }

    @Test
    @DisplayName("Connection stats use the legacy key names")
    void connectionStats() {
        JsonNode stats = get("/api/v1/connections/stats").json();

        assertEquals(0, stats.get("total_connections").asInt());
        assertEquals(0, stats.get("authenticated_connections").asInt());
        assertEquals(10, stats.get("max_connections").asInt());
        assertEquals(0.0, stats.get("connection_utilization").asDouble());
    }

    @Test
    @DisplayName("Metrics endpoint serves the Prometheus scrape")
    void metrics() {
        Response response = get("/metrics");

        assertEquals(200, response.status());
        assertTrue(response.body().contains("realmgate_transport_accepted_total"), response.body());
    }
}
