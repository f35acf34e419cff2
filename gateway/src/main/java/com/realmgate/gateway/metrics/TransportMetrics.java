package com.realmgate.gateway.metrics;

import com.realmgate.core.metrics.MetricsNames;
import com.realmgate.core.metrics.MetricsTags;
import com.realmgate.gateway.transport.CloseReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Micrometer meters for the WebSocket transport of one gateway node.
 */
public class TransportMetrics {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter accepted;
    private final Counter rejected;
    private final Map<CloseReason, Counter> closed = new EnumMap<>(CloseReason.class);

    // Network traffic counters (bytes)
    private final Counter networkInbound;
    private final Counter networkOutbound;

    // Message size distribution summaries
    private final DistributionSummary messageSizeInbound;
    private final DistributionSummary messageSizeOutbound;

    public TransportMetrics(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        accepted = Counter.builder(MetricsNames.TRANSPORT_ACCEPTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("WebSocket upgrades accepted by the admission gate")
            .register(registry);

        rejected = Counter.builder(MetricsNames.TRANSPORT_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("WebSocket upgrades refused by the admission gate")
            .register(registry);

        for (CloseReason reason : CloseReason.values()) {
            closed.put(reason, Counter.builder(MetricsNames.TRANSPORT_CLOSED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.REASON, reason.tagValue())
                .description("Connections closed, by reason")
                .register(registry));
        }

        networkInbound = Counter.builder(MetricsNames.NETWORK_INBOUND_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutbound = Counter.builder(MetricsNames.NETWORK_OUTBOUND_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_INBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound message size distribution")
            .baseUnit("bytes")
            .register(registry);

        messageSizeOutbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_OUTBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Outbound message size distribution")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Registers the live-connection gauge; the supplier is sampled on every scrape.
     */
    public void bindConnectionCount(Supplier<Number> connectionCount) {
        Gauge.builder(MetricsNames.TRANSPORT_CONNECTIONS, connectionCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections held in the transport registry")
            .register(registry);
    }

    public void recordAccepted() {
        accepted.increment();
    }

    public void recordRejected() {
        rejected.increment();
    }

    public void recordClosed(CloseReason reason) {
        closed.get(reason).increment();
    }

    /**
     * Records bytes received from a WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordInbound(long bytes) {
        networkInbound.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    /**
     * Records bytes sent to a WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordOutbound(long bytes) {
        networkOutbound.increment(bytes);
        messageSizeOutbound.record(bytes);
    }
}
