package com.realmgate.core.lifecycle;

/**
 * Start/stop contract shared by every long-lived gateway component.
 * <p>
 * Implementations hold an {@link AgentRuntime} instead of extending a base class.
 * Both {@link #start()} and {@link #stop()} must be safe to call repeatedly.
 * </p>
 */
public interface Lifecycle {

    void start();

    void stop();

    boolean isRunning();
}
