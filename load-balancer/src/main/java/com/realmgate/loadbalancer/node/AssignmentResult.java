package com.realmgate.loadbalancer.node;

/**
 * Outcome of binding a connection to a backend node.
 */
public enum AssignmentResult {
    ASSIGNED,
    UNKNOWN_SERVER,
    CAPACITY_EXCEEDED,
    ALREADY_ASSIGNED;

    public boolean isAssigned() {
        return this == ASSIGNED;
    }

    public String tagValue() {
        return name().toLowerCase();
    }
}
