package com.realmgate.gateway.metrics;

import com.realmgate.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Prometheus exporter backing the admin {@code /metrics} endpoint.
 * <p>
 * The default constructor attaches a Prometheus registry to Reactor Netty's global
 * composite, so the server's own channel metrics are scraped alongside the gateway's.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized with global registry + Prometheus");
    }

    /**
     * Standalone exporter over a dedicated registry, detached from the global one.
     */
    public PrometheusMetricsExporter(PrometheusMeterRegistry prometheusRegistry) {
        this.registry = prometheusRegistry;
        this.prometheusRegistry = prometheusRegistry;
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
