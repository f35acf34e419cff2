package com.realmgate.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the gateway node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the agent owning a sink-backed gauge.
     */
    public static final String AGENT_ID = "agent_id";

    /**
     * Tag key for close/rejection reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for the balancing strategy.
     */
    public static final String STRATEGY = "strategy";

    /**
     * Tag key for an operation outcome.
     */
    public static final String RESULT = "result";
}
