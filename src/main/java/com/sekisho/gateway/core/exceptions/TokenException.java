package com.sekisho.gateway.core.exceptions;

/**
 * Thrown by the token manager when a bearer token is rejected.
 */
public class TokenException extends GatewayException {

    /**
     * Failure kinds reported by token validation.
     */
    public enum Kind {
        /** Empty, malformed, badly signed or not-yet-valid token. */
        INVALID_TOKEN,
        /** Correctly signed token whose expiry has passed. */
        EXPIRED,
        /** Token not signed with an HMAC algorithm. */
        INVALID_SIGNING_METHOD,
        /** Issuer, audience or subject do not satisfy the gateway settings. */
        INVALID_CLAIMS
    }

    private final Kind kind;

    public TokenException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TokenException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
