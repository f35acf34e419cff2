package com.realmgate.loadbalancer.strategy;

import com.realmgate.loadbalancer.node.ServerNode;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through the healthy nodes with a monotonic counter. Ignores load.
 */
public class RoundRobinSelection implements SelectionStrategy {

    private final AtomicLong index = new AtomicLong();

    @Override
    public Optional<ServerNode> select(List<ServerNode> candidates, String clientIp) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int position = (int) Math.floorMod(index.getAndIncrement(), (long) candidates.size());
        return Optional.of(candidates.get(position));
    }
}
