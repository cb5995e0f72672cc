package com.sekisho.gateway.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backend targets and forwarding settings.
 */
public class ProxyConfig {
    /** Name of the target that switches the gateway to single-target mode. */
    public static final String DEFAULT_TARGET = "default";

    /** Service name to base URL. */
    private Map<String, String> targets = new LinkedHashMap<>();

    /** Per-request upstream deadline in milliseconds. Default is 30s. */
    private int timeout = 30000;

    /**
     * Disables authentication on prefixed service routes. Test environments only;
     * every affected route is logged at startup.
     */
    private boolean skipAuth = false;

    public Map<String, String> getTargets() {
        return targets == null ? Map.of() : Collections.unmodifiableMap(targets);
    }

    public void setTargets(Map<String, String> targets) {
        this.targets = targets == null ? null : new LinkedHashMap<>(targets);
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public boolean isSkipAuth() {
        return skipAuth;
    }

    public void setSkipAuth(boolean skipAuth) {
        this.skipAuth = skipAuth;
    }
}
