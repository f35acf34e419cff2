package com.realmgate.loadbalancer.strategy;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Selection algorithms the load balancer can switch between at runtime.
 */
public enum BalancingStrategy {
    ROUND_ROBIN(RoundRobinSelection::new),
    LEAST_CONNECTIONS(LeastConnectionsSelection::new),
    LEAST_LOAD(LeastLoadSelection::new),
    WEIGHTED_ROUND_ROBIN(WeightedRandomSelection::new),
    IP_HASH(IpHashSelection::new);

    private final Supplier<SelectionStrategy> factory;

    BalancingStrategy(Supplier<SelectionStrategy> factory) {
        this.factory = factory;
    }

    public SelectionStrategy newSelection() {
        return factory.get();
    }

    /**
     * Parses {@code round_robin}, {@code ROUND-ROBIN}, {@code Round_Robin} and the like.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static BalancingStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Balancing strategy name is empty");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return BalancingStrategy.valueOf(normalized);
    }

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
