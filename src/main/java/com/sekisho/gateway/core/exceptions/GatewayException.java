package com.sekisho.gateway.core.exceptions;

/**
 * Root of the gateway's unchecked exceptions.
 * <p>
 * Thrown during startup it stops the process with exit code 1; on the request
 * path subclasses are turned into JSON error responses and never escape a
 * connection thread.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    /**
     * @param message what failed, safe to log.
     * @param cause   the underlying error.
     */
    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
