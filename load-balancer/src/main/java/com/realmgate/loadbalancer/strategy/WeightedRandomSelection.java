package com.realmgate.loadbalancer.strategy;

import com.realmgate.loadbalancer.node.ServerNode;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Probabilistic weighted draw backing {@link BalancingStrategy#WEIGHTED_ROUND_ROBIN}.
 * <p>
 * Each node's weight is {@code 1 / maxConnections}. The draw is random, not a rotating
 * schedule, so two consecutive selections may return the same node.
 * </p>
 */
public class WeightedRandomSelection implements SelectionStrategy {

    private final DoubleSupplier unitRandom;

    public WeightedRandomSelection() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param unitRandom source of uniform values in {@code [0, 1)}
     */
    public WeightedRandomSelection(DoubleSupplier unitRandom) {
        this.unitRandom = unitRandom;
    }

    @Override
    public Optional<ServerNode> select(List<ServerNode> candidates, String clientIp) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        double[] weights = new double[candidates.size()];
        double totalWeight = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            weights[i] = 1.0 / candidates.get(i).getMaxConnections();
            totalWeight += weights[i];
        }

        double draw = unitRandom.getAsDouble() * totalWeight;
        double cumulative = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            cumulative += weights[i];
            if (draw < cumulative) {
                return Optional.of(candidates.get(i));
            }
        }
        // Rounding can leave the draw just past the last boundary
        return Optional.of(candidates.get(candidates.size() - 1));
    }
}
