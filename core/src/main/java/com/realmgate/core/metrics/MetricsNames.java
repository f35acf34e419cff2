package com.realmgate.core.metrics;

/**
 * Micrometer metric names used across the gateway.
 * <p>
 * <b>Naming convention:</b> {@code realmgate.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Distribution summaries: {@code .size} / {@code .bytes}</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Prefix for gauges published by the connection manager's metric sink.
     */
    public static final String CONNECTION_MANAGER_PREFIX = "realmgate.connections";

    /**
     * Prefix for gauges published by the load balancer's metric sink.
     */
    public static final String LOAD_BALANCER_PREFIX = "realmgate.lb";

    /**
     * Prefix for gauges published by the gateway agent's metric sink.
     */
    public static final String GATEWAY_PREFIX = "realmgate.gateway";

    /**
     * Counter: WebSocket upgrades accepted by the transport.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String TRANSPORT_ACCEPTED_TOTAL = "realmgate.transport.accepted.total";

    /**
     * Counter: WebSocket upgrades refused by the admission gate.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String TRANSPORT_REJECTED_TOTAL = "realmgate.transport.rejected.total";

    /**
     * Counter: Connections that reached CLOSED.
     * <p>
     * Tags: nodeId, reason (local/peer/error)
     * </p>
     */
    public static final String TRANSPORT_CLOSED_TOTAL = "realmgate.transport.closed.total";

    /**
     * Gauge: Connections currently held in the transport registry.
     */
    public static final String TRANSPORT_CONNECTIONS = "realmgate.transport.connections";

    /**
     * Counter: Bytes received from clients.
     */
    public static final String NETWORK_INBOUND_BYTES = "realmgate.transport.network.inbound.bytes";

    /**
     * Counter: Bytes sent to clients.
     */
    public static final String NETWORK_OUTBOUND_BYTES = "realmgate.transport.network.outbound.bytes";

    /**
     * Distribution Summary: Inbound message size.
     */
    public static final String MESSAGE_SIZE_INBOUND = "realmgate.transport.message.size.inbound";

    /**
     * Distribution Summary: Outbound message size.
     */
    public static final String MESSAGE_SIZE_OUTBOUND = "realmgate.transport.message.size.outbound";

    /**
     * Counter: Server selections per strategy.
     * <p>
     * Tags: strategy, result (selected/no_healthy_server)
     * </p>
     */
    public static final String LB_SELECTIONS_TOTAL = "realmgate.balancer.selections.total";

    /**
     * Counter: Assignment attempts.
     * <p>
     * Tags: result (assigned/unknown_server/capacity_exceeded/already_assigned)
     * </p>
     */
    public static final String LB_ASSIGNMENTS_TOTAL = "realmgate.balancer.assignments.total";
}
