package com.sekisho.gateway.core.exceptions;

/**
 * Thrown when an inbound HTTP request cannot be parsed.
 */
public class ProtocolException extends GatewayException {
    private final int status;

    /**
     * Constructs a new ProtocolException answered with 400 Bad Request.
     * 
     * @param message the detail message.
     */
    public ProtocolException(String message) {
        this(400, message);
    }

    /**
     * Constructs a new ProtocolException answered with the given status.
     * 
     * @param status  HTTP status sent back to the client.
     * @param message the detail message.
     */
    public ProtocolException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
