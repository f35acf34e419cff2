package com.realmgate.loadbalancer.strategy;

import com.realmgate.loadbalancer.node.ServerNode;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Node with the fewest current connections; the earliest registered wins ties.
 */
public class LeastConnectionsSelection implements SelectionStrategy {

    @Override
    public Optional<ServerNode> select(List<ServerNode> candidates, String clientIp) {
        return candidates.stream().min(Comparator.comparingInt(ServerNode::getCurrentConnections));
    }
}
