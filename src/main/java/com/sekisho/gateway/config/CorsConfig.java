package com.sekisho.gateway.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cross-origin resource sharing policy.
 */
public class CorsConfig {
    /** Allowed origins; {@code *} allows any origin. */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private List<String> allowedMethods = new ArrayList<>(
            List.of("GET", "POST", "PUT", "DELETE", "OPTIONS", "PATCH"));

    private List<String> allowedHeaders = new ArrayList<>(List.of("Content-Type", "Authorization"));

    private boolean allowCredentials = true;

    /** Preflight cache lifetime in seconds. Not sent when zero or negative. */
    private int maxAge = 3600;

    public List<String> getAllowedOrigins() {
        return allowedOrigins == null ? List.of() : Collections.unmodifiableList(allowedOrigins);
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins == null ? null : new ArrayList<>(allowedOrigins);
    }

    public List<String> getAllowedMethods() {
        return allowedMethods == null ? List.of() : Collections.unmodifiableList(allowedMethods);
    }

    public void setAllowedMethods(List<String> allowedMethods) {
        this.allowedMethods = allowedMethods == null ? null : new ArrayList<>(allowedMethods);
    }

    public List<String> getAllowedHeaders() {
        return allowedHeaders == null ? List.of() : Collections.unmodifiableList(allowedHeaders);
    }

    public void setAllowedHeaders(List<String> allowedHeaders) {
        this.allowedHeaders = allowedHeaders == null ? null : new ArrayList<>(allowedHeaders);
    }

    public boolean isAllowCredentials() {
        return allowCredentials;
    }

    public void setAllowCredentials(boolean allowCredentials) {
        this.allowCredentials = allowCredentials;
    }

    public int getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(int maxAge) {
        this.maxAge = maxAge;
    }
}
