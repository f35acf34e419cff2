package com.realmgate.loadbalancer.node;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable snapshot of a backend compute node.
 * <p>
 * The load balancer owns the live entry and replaces it on every mutation; callers
 * only ever see copies, so a snapshot never changes under them.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ServerNode {

    /**
     * Weight of CPU usage in the load score.
     */
    public static final double CPU_WEIGHT = 0.4;

    /**
     * Weight of memory usage in the load score.
     */
    public static final double MEMORY_WEIGHT = 0.3;

    /**
     * Weight of the connection ratio (current / max) in the load score.
     */
    public static final double CONNECTION_WEIGHT = 0.3;

    String id;
    String host;
    int port;

    int currentConnections;
    int maxConnections;

    /**
     * CPU utilization as a fraction (0.0 to 1.0).
     */
    double cpuUsage;

    /**
     * Memory utilization as a fraction (0.0 to 1.0).
     */
    double memoryUsage;

    @Builder.Default
    boolean healthy = true;

    /**
     * When status was last pushed (or when the node was added).
     */
    Instant lastHealthCheck;

    /**
     * Weighted composite of CPU, memory and connection ratio.
     *
     * @return {@code 0.4 * cpu + 0.3 * mem + 0.3 * current / max}
     */
    public double getLoadScore() {
        double connectionRatio = (double) currentConnections / maxConnections;
        return cpuUsage * CPU_WEIGHT + memoryUsage * MEMORY_WEIGHT + connectionRatio * CONNECTION_WEIGHT;
    }

    /**
     * Admission ceiling, stricter than selection eligibility.
     *
     * @param loadScoreCeiling exclusive upper bound for {@link #getLoadScore()}
     * @return true if healthy, below capacity and below the load ceiling
     */
    public boolean canAcceptConnection(double loadScoreCeiling) {
        return healthy
            && currentConnections < maxConnections
            && getLoadScore() < loadScoreCeiling;
    }
}
