package com.realmgate.core.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link MetricSink} that keeps the last value per key and publishes each key
 * as a Micrometer gauge named {@code <prefix>.<key>}.
 * <p>
 * Gauges are registered lazily, once per key, and tagged with the agent id.
 * </p>
 */
public class MeterRegistryMetricSink implements MetricSink {

    private final MeterRegistry registry;
    private final String prefix;
    private final String agentId;
    private final Map<String, AtomicDouble> values = new ConcurrentHashMap<>();

    public MeterRegistryMetricSink(MeterRegistry registry, String prefix, String agentId) {
        this.registry = registry;
        this.prefix = prefix;
        this.agentId = agentId;
    }

    @Override
    public void update(String key, double value) {
        holder(key).set(value);
    }

    @Override
    public void increment(String key, double delta) {
        holder(key).addAndGet(delta);
    }

    @Override
    public double get(String key, double defaultValue) {
        AtomicDouble value = values.get(key);
        return value != null ? value.get() : defaultValue;
    }

    @Override
    public Map<String, Double> snapshot() {
        return values.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get()));
    }

    private AtomicDouble holder(String key) {
        return values.computeIfAbsent(key, k -> {
            AtomicDouble value = new AtomicDouble();
            Gauge.builder(prefix + "." + k, value, AtomicDouble::get)
                .tag(MetricsTags.AGENT_ID, agentId)
                .register(registry);
            return value;
        });
    }
}
