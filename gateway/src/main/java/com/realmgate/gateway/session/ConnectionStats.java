package com.realmgate.gateway.session;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time connection statistics.
 *
 * @param totalConnections         admitted connections
 * @param authenticatedConnections admitted connections that completed auth
 * @param maxConnections           admission capacity
 * @param utilization              {@code totalConnections / maxConnections}
 */
public record ConnectionStats(
    int totalConnections,
    int authenticatedConnections,
    int maxConnections,
    double utilization
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_connections", totalConnections);
        map.put("authenticated_connections", authenticatedConnections);
        map.put("max_connections", maxConnections);
        map.put("connection_utilization", utilization);
        return map;
    }
}
