package com.sekisho.gateway.core.http.filters;

import com.sekisho.gateway.core.auth.BearerAuthenticator;
import com.sekisho.gateway.core.auth.TokenClaims;
import com.sekisho.gateway.core.constants.HeaderConstants;
import com.sekisho.gateway.core.exceptions.AuthException;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.HttpFilter;
import com.sekisho.gateway.core.http.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filter that requires a valid bearer token.
 * On success the request carries the user id and claims; on failure the chain
 * stops with the failure's status and a JSON error body.
 */
public class AuthFilter implements HttpFilter {
    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    private final BearerAuthenticator authenticator;

    public AuthFilter(BearerAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    /**
     * Filter used when no token manager could be built: every request is
     * answered with 500.
     *
     * @return the filter.
     */
    public static HttpFilter failing() {
        return context -> GatewayResponse.error(500, "internal server error");
    }

    @Override
    public GatewayResponse preHandle(RequestContext context) {
        String header = context.getHeader(HeaderConstants.AUTHORIZATION.getValue());
        try {
            TokenClaims claims = authenticator.authenticate(header);
            context.authenticate(claims);
            log.debug("Authenticated request: path={}, method={}, user={}",
                    context.getPath(), context.getMethod(), claims.getUserId());
            return null;
        } catch (AuthException e) {
            log.warn("Authentication failed: path={}, method={}, reason={}, user={}",
                    context.getPath(), context.getMethod(), e.describe(), auditUserId(header));
            return GatewayResponse.error(e.getStatus(), e.getMessage());
        }
    }

    private String auditUserId(String header) {
        try {
            String userId = authenticator.getTokenManager()
                    .extractUserId(BearerAuthenticator.extractBearerToken(header));
            return userId.isEmpty() ? "-" : userId;
        } catch (AuthException e) {
            return "-";
        }
    }
}
