package com.realmgate.loadbalancer.config;

import com.realmgate.loadbalancer.strategy.BalancingStrategy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the load balancer, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class LBConfig {

    @Builder.Default
    BalancingStrategy strategy = BalancingStrategy.LEAST_LOAD;

    // Capacity used by addServer when the caller does not give one
    @Builder.Default
    int defaultMaxConnections = 1000;

    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(30);

    // A node with no status update for this long is marked unhealthy by the sweep
    @Builder.Default
    Duration healthStaleAfter = Duration.ofMinutes(5);

    // Nodes at or above this load score refuse new assignments
    @Builder.Default
    double loadScoreCeiling = 0.8;

    public static LBConfig fromEnv() {
        return LBConfig.builder()
            .strategy(BalancingStrategy.fromName(getEnv("LB_STRATEGY", "least_load")))
            .defaultMaxConnections(Integer.parseInt(getEnv("LB_DEFAULT_MAX_CONNECTIONS", "1000")))
            .healthCheckInterval(Duration.ofSeconds(Long.parseLong(getEnv("LB_HEALTH_CHECK_INTERVAL_SEC", "30"))))
            .healthStaleAfter(Duration.ofSeconds(Long.parseLong(getEnv("LB_HEALTH_STALE_AFTER_SEC", "300"))))
            .loadScoreCeiling(Double.parseDouble(getEnv("LB_LOAD_SCORE_CEILING", "0.8")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
