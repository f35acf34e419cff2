package com.realmgate.core.metrics;

import java.util.Map;

/**
 * Key to numeric metric sink handed to each agent at construction.
 */
public interface MetricSink {

    /**
     * Sets the current value of a metric, creating it on first use.
     */
    void update(String key, double value);

    /**
     * Adds {@code delta} to a metric, starting from zero.
     */
    void increment(String key, double delta);

    default void increment(String key) {
        increment(key, 1.0);
    }

    double get(String key, double defaultValue);

    /**
     * @return point-in-time copy of every metric
     */
    Map<String, Double> snapshot();
}
