package com.sekisho.gateway.core.auth;

import com.sekisho.gateway.core.exceptions.AuthException;

/**
 * Role checks over validated claims. Role names are compared exactly.
 */
public final class Roles {

    static final String NO_CLAIMS = "no claims provided";
    static final String INSUFFICIENT = "insufficient permissions";

    private Roles() {
    }

    /**
     * @throws AuthException 403 unless the claims carry {@code role}.
     */
    public static void requireRole(TokenClaims claims, String role) {
        ensureClaims(claims);
        if (!claims.hasRole(role)) {
            throw AuthException.forbidden(INSUFFICIENT);
        }
    }

    /**
     * Passes when the claims carry at least one of the roles, or when no roles
     * are given.
     *
     * @throws AuthException 403 otherwise.
     */
    public static void requireAnyRole(TokenClaims claims, String... roles) {
        ensureClaims(claims);
        if (roles == null || roles.length == 0) {
            return;
        }
        for (String role : roles) {
            if (claims.hasRole(role)) {
                return;
            }
        }
        throw AuthException.forbidden(INSUFFICIENT);
    }

    /**
     * Passes when the claims carry every one of the roles.
     *
     * @throws AuthException 403 otherwise.
     */
    public static void requireAllRoles(TokenClaims claims, String... roles) {
        ensureClaims(claims);
        if (roles == null) {
            return;
        }
        for (String role : roles) {
            if (!claims.hasRole(role)) {
                throw AuthException.forbidden(INSUFFICIENT);
            }
        }
    }

    private static void ensureClaims(TokenClaims claims) {
        if (claims == null) {
            throw AuthException.forbidden(NO_CLAIMS);
        }
    }
}
