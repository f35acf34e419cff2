package com.realmgate.loadbalancer.balancer;

import com.realmgate.loadbalancer.node.AssignmentResult;
import com.realmgate.loadbalancer.node.ServerNode;
import com.realmgate.loadbalancer.strategy.BalancingStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend node registry with strategy-based selection and assignment bookkeeping.
 */
public interface ILoadBalancer {

    /**
     * Registers a backend node, healthy and with a fresh status timestamp.
     *
     * @return false if a node with this id is already registered
     */
    boolean addServer(String serverId, String host, int port, int maxConnections);

    /**
     * Registers a backend node with the configured default capacity.
     */
    boolean addServer(String serverId, String host, int port);

    /**
     * Removes a node together with every assignment that points at it.
     *
     * @return false if the node was unknown
     */
    boolean removeServer(String serverId);

    /**
     * Picks a backend among the healthy nodes using the active strategy.
     *
     * @param clientIp client address, used by {@link BalancingStrategy#IP_HASH}
     * @return chosen server id, or empty when no node is healthy
     */
    Optional<String> select(String clientIp);

    /**
     * Binds a connection to a node after re-checking that the node can accept it.
     */
    AssignmentResult assign(String serverId, String connectionId);

    /**
     * Unbinds a connection from the given node.
     *
     * @return false (and nothing changes) unless the connection is assigned to that node
     */
    boolean release(String serverId, String connectionId);

    /**
     * Unbinds a connection from whatever node it is assigned to.
     *
     * @return the node it was released from, or empty if it had no assignment
     */
    Optional<String> releaseConnection(String connectionId);

    Optional<String> assignedServer(String connectionId);

    /**
     * Pushes fresh gauges and health for a node and refreshes its staleness timestamp.
     *
     * @return false if the node is unknown
     */
    boolean updateStatus(String serverId, double cpuUsage, double memoryUsage, boolean healthy);

    Optional<ServerNode> getServer(String serverId);

    List<ServerNode> listServers();

    void setStrategy(BalancingStrategy strategy);

    BalancingStrategy getStrategy();

    /**
     * Starts (or restarts) the periodic staleness sweep. Ignored while the balancer is
     * stopped; stopping the balancer cancels it.
     */
    void startHealthSweep(Duration interval);

    /**
     * Marks unhealthy every node whose status is older than the staleness threshold.
     *
     * @return ids of the nodes that went from healthy to unhealthy in this pass
     */
    List<String> performHealthSweep();

    Map<String, String> healthSnapshot();
}
