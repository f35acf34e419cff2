package com.realmgate.loadbalancer.strategy;

import com.realmgate.loadbalancer.node.ServerNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the individual selection algorithms, independent of the registry.
 */
class SelectionStrategiesTest {

    private static ServerNode node(String id, int current, int max, double cpu, double mem) {
        return ServerNode.builder()
            .id(id)
            .host("10.0.0." + id.length())
            .port(9000)
            .currentConnections(current)
            .maxConnections(max)
            .cpuUsage(cpu)
            .memoryUsage(mem)
            .lastHealthCheck(Instant.EPOCH)
            .build();
    }

    private static String pick(SelectionStrategy strategy, List<ServerNode> candidates, String clientIp) {
        return strategy.select(candidates, clientIp).map(ServerNode::getId).orElseThrow();
    }

    @Test
    @DisplayName("Every strategy returns empty for an empty candidate list")
    void emptyCandidates() {
        for (BalancingStrategy strategy : BalancingStrategy.values()) {
            assertEquals(Optional.empty(), strategy.newSelection().select(List.of(), "1.2.3.4"), strategy.name());
        }
    }

    @Test
    @DisplayName("Round robin cycles through candidates in order")
    void roundRobinCycles() {
        List<ServerNode> nodes = List.of(node("a", 0, 10, 0, 0), node("b", 0, 10, 0, 0), node("c", 0, 10, 0, 0));
        RoundRobinSelection selection = new RoundRobinSelection();

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picks.add(pick(selection, nodes, null));
        }

        assertEquals(List.of("a", "b", "c", "a", "b", "c"), picks);
    }

    @Test
    @DisplayName("Least connections picks the minimum and breaks ties by order")
    void leastConnections() {
        LeastConnectionsSelection selection = new LeastConnectionsSelection();

        assertEquals("b", pick(selection, List.of(node("a", 5, 10, 0, 0), node("b", 2, 10, 0, 0), node("c", 3, 10, 0, 0)), null));
        assertEquals("a", pick(selection, List.of(node("a", 2, 10, 0, 0), node("b", 2, 10, 0, 0)), null));
    }

    @Test
    @DisplayName("Least load picks the lowest weighted score, not the fewest connections")
    void leastLoad() {
        ServerNode busyCpu = node("busy-cpu", 0, 100, 0.9, 0.1);
        ServerNode manyConnections = node("many-conn", 60, 100, 0.1, 0.1);

        // busy-cpu: 0.36 + 0.03 + 0 = 0.39 ; many-conn: 0.04 + 0.03 + 0.18 = 0.25
        assertEquals("many-conn", pick(new LeastLoadSelection(), List.of(busyCpu, manyConnections), null));
    }

    @Test
    @DisplayName("Weighted draw uses 1/maxConnections as each node's weight")
    void weightedDrawBoundaries() {
        // weights: a = 1/100 = 0.01, b = 1/300 ~ 0.00333 ; a owns 75% of the range
        List<ServerNode> nodes = List.of(node("a", 0, 100, 0, 0), node("b", 0, 300, 0, 0));

        assertEquals("a", pick(new WeightedRandomSelection(() -> 0.0), nodes, null));
        assertEquals("a", pick(new WeightedRandomSelection(() -> 0.74), nodes, null));
        assertEquals("b", pick(new WeightedRandomSelection(() -> 0.76), nodes, null));
        assertEquals("b", pick(new WeightedRandomSelection(() -> 0.999999), nodes, null));
    }

    @Test
    @DisplayName("IP hash is deterministic for a fixed candidate set")
    void ipHashIsDeterministic() {
        List<ServerNode> nodes = List.of(node("a", 0, 10, 0, 0), node("b", 0, 10, 0, 0), node("c", 0, 10, 0, 0));
        IpHashSelection selection = new IpHashSelection();

        String first = pick(selection, nodes, "192.168.1.20");
        for (int i = 0; i < 20; i++) {
            assertEquals(first, pick(selection, nodes, "192.168.1.20"));
        }
        assertNotNull(pick(selection, nodes, null));
    }

    @Test
    @DisplayName("Strategy names parse in snake, kebab and mixed case")
    void parseNames() {
        assertEquals(BalancingStrategy.ROUND_ROBIN, BalancingStrategy.fromName("round_robin"));
        assertEquals(BalancingStrategy.WEIGHTED_ROUND_ROBIN, BalancingStrategy.fromName("Weighted-Round-Robin"));
        assertEquals(BalancingStrategy.IP_HASH, BalancingStrategy.fromName(" IP_HASH "));
        assertThrows(IllegalArgumentException.class, () -> BalancingStrategy.fromName("random"));
        assertThrows(IllegalArgumentException.class, () -> BalancingStrategy.fromName(""));
    }
}
