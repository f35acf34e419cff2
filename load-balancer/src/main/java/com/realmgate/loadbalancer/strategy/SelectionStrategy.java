package com.realmgate.loadbalancer.strategy;

import com.realmgate.loadbalancer.node.ServerNode;

import java.util.List;
import java.util.Optional;

/**
 * Picks one node out of the currently healthy candidates.
 * <p>
 * Candidates arrive in registry insertion order. Implementations are called under the
 * balancer's lock, so they must be fast and must not block.
 * </p>
 */
public interface SelectionStrategy {

    /**
     * @param candidates healthy nodes, possibly empty
     * @param clientIp   client address, may be null
     * @return the chosen node, or empty when there are no candidates
     */
    Optional<ServerNode> select(List<ServerNode> candidates, String clientIp);
}
