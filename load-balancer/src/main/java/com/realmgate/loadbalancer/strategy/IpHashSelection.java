package com.realmgate.loadbalancer.strategy;

import com.realmgate.core.hash.Hashers;
import com.realmgate.loadbalancer.node.ServerNode;

import java.util.List;
import java.util.Optional;

/**
 * Session affinity: Murmur3 of the client IP modulo the healthy node count.
 * <p>
 * The mapping is stable for as long as the set of healthy nodes does not change.
 * </p>
 */
public class IpHashSelection implements SelectionStrategy {

    @Override
    public Optional<ServerNode> select(List<ServerNode> candidates, String clientIp) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        long hash = Hashers.murmur3Hash(clientIp != null ? clientIp : "");
        int position = (int) Math.floorMod(hash, (long) candidates.size());
        return Optional.of(candidates.get(position));
    }
}
