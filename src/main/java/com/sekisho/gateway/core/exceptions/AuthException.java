package com.sekisho.gateway.core.exceptions;

/**
 * Authentication or authorization failure.
 * The status and message are safe to send to the client; the cause is for logs
 * only.
 */
public class AuthException extends GatewayException {
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;

    private final int status;

    /**
     * Constructs a new AuthException without a cause.
     * 
     * @param status  HTTP status (401 or 403).
     * @param message client-facing message.
     */
    public AuthException(int status, String message) {
        super(message);
        this.status = status;
    }

    /**
     * Constructs a new AuthException wrapping the underlying failure.
     * 
     * @param status  HTTP status (401 or 403).
     * @param message client-facing message.
     * @param cause   the underlying failure, never exposed to clients.
     */
    public AuthException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static AuthException unauthorized(String message) {
        return new AuthException(UNAUTHORIZED, message);
    }

    public static AuthException forbidden(String message) {
        return new AuthException(FORBIDDEN, message);
    }

    public int getStatus() {
        return status;
    }

    /**
     * Message with the cause appended, for log output.
     * 
     * @return the detailed description.
     */
    public String describe() {
        Throwable cause = getCause();
        return cause != null ? getMessage() + ": " + cause.getMessage() : getMessage();
    }
}
