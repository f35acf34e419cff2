package com.realmgate.core.lifecycle;

import com.realmgate.core.metrics.MetricSink;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle capability composed into each agent.
 * <p>
 * Tracks the running flag and start instant, carries the agent's {@link MetricSink},
 * and renders the textual health snapshot:
 * <ul>
 *   <li>{@code agent_id}</li>
 *   <li>{@code running}</li>
 *   <li>{@code uptime_seconds}</li>
 *   <li>{@code metric_<key>} for every metric in the sink</li>
 * </ul>
 * </p>
 */
public class AgentRuntime {

    @Getter
    private final String agentId;
    @Getter
    private final MetricSink metrics;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant startedAt;

    public AgentRuntime(String agentId, MetricSink metrics) {
        this(agentId, metrics, Clock.systemUTC());
    }

    public AgentRuntime(String agentId, MetricSink metrics, Clock clock) {
        this.agentId = agentId;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Flips the agent to running.
     *
     * @return true if the agent was stopped before this call
     */
    public boolean markStarted() {
        if (running.compareAndSet(false, true)) {
            startedAt = clock.instant();
            return true;
        }
        return false;
    }

    /**
     * Flips the agent to stopped.
     *
     * @return true if the agent was running before this call
     */
    public boolean markStopped() {
        return running.compareAndSet(true, false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration uptime() {
        Instant started = startedAt;
        if (!running.get() || started == null) {
            return Duration.ZERO;
        }
        return Duration.between(started, clock.instant());
    }

    public Map<String, String> healthSnapshot() {
        Map<String, String> health = new LinkedHashMap<>();
        health.put("agent_id", agentId);
        health.put("running", String.valueOf(running.get()));
        health.put("uptime_seconds", String.valueOf(uptime().toMillis() / 1000.0));

        new TreeMap<>(metrics.snapshot())
            .forEach((key, value) -> health.put("metric_" + key, String.valueOf(value)));
        return health;
    }
}
