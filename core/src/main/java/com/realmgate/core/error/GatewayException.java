package com.realmgate.core.error;

/**
 * Base unchecked exception for gateway failures that must reach the caller.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
