package com.sekisho.gateway.core.http.filters;

import com.sekisho.gateway.config.CorsConfig;
import com.sekisho.gateway.core.constants.HeaderConstants;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.HttpFilter;
import com.sekisho.gateway.core.http.RequestContext;
import java.util.List;

/**
 * Applies the CORS policy and answers preflight requests.
 * <p>
 * Every {@code OPTIONS} request is answered with 204 before routing or
 * authentication. CORS headers are added to any response, including errors,
 * when the request carries an allowed {@code Origin}.
 */
public class CorsFilter implements HttpFilter {
    private static final String WILDCARD = "*";

    private final List<String> allowedOrigins;
    private final boolean allowCredentials;
    private final String allowedMethods;
    private final String allowedHeaders;
    private final int maxAge;

    public CorsFilter(CorsConfig config) {
        this.allowedOrigins = List.copyOf(config.getAllowedOrigins());
        this.allowCredentials = config.isAllowCredentials();
        this.allowedMethods = String.join(", ", config.getAllowedMethods());
        this.allowedHeaders = String.join(", ", config.getAllowedHeaders());
        this.maxAge = config.getMaxAge();
    }

    @Override
    public GatewayResponse preHandle(RequestContext context) {
        if ("OPTIONS".equals(context.getMethod())) {
            return GatewayResponse.noContent();
        }
        return null;
    }

    @Override
    public void postHandle(RequestContext context, GatewayResponse response) {
        String origin = context.getHeader(HeaderConstants.ORIGIN.getValue());
        if (origin == null || origin.isEmpty() || !isOriginAllowed(origin)) {
            return;
        }
        response.setHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_ORIGIN.getValue(), origin);
        if (allowCredentials) {
            response.setHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_CREDENTIALS.getValue(), "true");
        }
        response.setHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_METHODS.getValue(), allowedMethods);
        response.setHeader(HeaderConstants.ACCESS_CONTROL_ALLOW_HEADERS.getValue(), allowedHeaders);
        if (maxAge > 0) {
            response.setHeader(HeaderConstants.ACCESS_CONTROL_MAX_AGE.getValue(), String.valueOf(maxAge));
        }
        if (!variesOnOrigin(response)) {
            response.addHeader(HeaderConstants.VARY.getValue(), HeaderConstants.ORIGIN.getValue());
        }
    }

    private static boolean variesOnOrigin(GatewayResponse response) {
        List<String> vary = response.getHeaders().getOrDefault(HeaderConstants.VARY.getValue(), List.of());
        for (String value : vary) {
            for (String field : value.split(",")) {
                String name = field.trim();
                if (WILDCARD.equals(name) || HeaderConstants.ORIGIN.getValue().equalsIgnoreCase(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return true when the allow-list contains the origin or {@code *}.
     */
    public boolean isOriginAllowed(String origin) {
        for (String allowed : allowedOrigins) {
            if (WILDCARD.equals(allowed) || allowed.equals(origin)) {
                return true;
            }
        }
        return false;
    }
}
