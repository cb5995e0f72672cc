package com.sekisho.gateway.core.auth;

import com.sekisho.gateway.core.exceptions.AuthException;
import com.sekisho.gateway.core.exceptions.TokenException;

/**
 * Turns an {@code Authorization} header into validated claims.
 * Every failure is a 401 {@link AuthException} whose message is safe to return
 * to the client.
 */
public class BearerAuthenticator {

    private final TokenManager tokenManager;

    public BearerAuthenticator(TokenManager tokenManager) {
        this.tokenManager = tokenManager;
    }

    /**
     * Extracts the token from a {@code Bearer} header. The scheme is matched
     * case-insensitively.
     *
     * @param header raw header value; may be null.
     * @return the trimmed token.
     * @throws AuthException 401 describing what is wrong with the header.
     */
    public static String extractBearerToken(String header) {
        if (header == null || header.isEmpty()) {
            throw AuthException.unauthorized("missing authorization header");
        }
        int space = header.indexOf(' ');
        if (space < 0) {
            throw AuthException.unauthorized("invalid authorization header format");
        }
        if (!"bearer".equalsIgnoreCase(header.substring(0, space))) {
            throw AuthException.unauthorized("invalid authorization scheme (expected Bearer)");
        }
        String token = header.substring(space + 1).trim();
        if (token.isEmpty()) {
            throw AuthException.unauthorized("empty bearer token");
        }
        return token;
    }

    /**
     * Extracts and validates the bearer token.
     *
     * @param header raw {@code Authorization} header; may be null.
     * @return validated claims.
     * @throws AuthException 401 on any failure; the token error is kept as cause.
     */
    public TokenClaims authenticate(String header) {
        String token = extractBearerToken(header);
        try {
            return tokenManager.validate(token);
        } catch (TokenException e) {
            throw new AuthException(AuthException.UNAUTHORIZED, messageFor(e.getKind()), e);
        }
    }

    /**
     * @return the manager backing this authenticator.
     */
    public TokenManager getTokenManager() {
        return tokenManager;
    }

    private static String messageFor(TokenException.Kind kind) {
        return switch (kind) {
            case EXPIRED -> "token has expired";
            case INVALID_SIGNING_METHOD -> "invalid token signing method";
            case INVALID_CLAIMS -> "invalid token claims";
            default -> "invalid or expired token";
        };
    }
}
