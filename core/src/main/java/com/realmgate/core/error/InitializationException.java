package com.realmgate.core.error;

/**
 * Startup failure (for example the listening endpoint could not be bound).
 * Never swallowed: it aborts {@code start()} and propagates to the process.
 */
public class InitializationException extends GatewayException {

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
