package com.realmgate.gateway.session;

/**
 * Outcome of {@link ConnectionManager#admit(String, String)}.
 */
public enum AdmissionResult {
    ADMITTED,
    CAPACITY_EXCEEDED,
    DUPLICATE;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
