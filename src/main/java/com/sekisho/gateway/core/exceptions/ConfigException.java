package com.sekisho.gateway.core.exceptions;

/**
 * The configuration is missing, unreadable or invalid: no targets, a bad target
 * URL, a weak JWT secret, an out-of-range port. Always fatal at startup.
 */
public class ConfigException extends GatewayException {

    public ConfigException(String message) {
        super(message);
    }

    /**
     * @param message the problem, naming the offending setting.
     * @param cause   the parse or I/O error behind it.
     */
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
