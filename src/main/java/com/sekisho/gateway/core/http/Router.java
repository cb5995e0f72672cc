package com.sekisho.gateway.core.http;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches requests by path.
 * <p>
 * Exact routes match one method and path. Prefix routes match {@code /name}
 * and {@code /name/...}; the prefix is removed from the forward path before the
 * route's handler runs, with an empty remainder becoming {@code /}. The
 * fallback handler receives everything else unchanged. Without a fallback,
 * unmatched requests get 404.
 */
public class Router implements HttpHandler {
    static final String NOT_FOUND = "not found";

    private final Map<String, HttpHandler> exactRoutes = new HashMap<>();
    private final Map<String, HttpHandler> prefixRoutes = new LinkedHashMap<>();
    private HttpHandler fallback;

    /**
     * Registers an exact {@code GET} route.
     */
    public Router get(String path, HttpHandler handler) {
        exactRoutes.put(key("GET", path), handler);
        return this;
    }

    /**
     * Registers a prefix route for {@code /name/*}.
     *
     * @param name    first path segment, without slashes.
     * @param handler handler invoked with the prefix stripped.
     */
    public Router prefix(String name, HttpHandler handler) {
        if (name.isEmpty() || name.contains("/")) {
            throw new IllegalArgumentException("Invalid route prefix: " + name);
        }
        if (prefixRoutes.putIfAbsent(name, handler) != null) {
            throw new IllegalArgumentException("Duplicate route prefix: " + name);
        }
        return this;
    }

    /**
     * Registers the catch-all route ({@code /*}).
     */
    public Router fallback(HttpHandler handler) {
        this.fallback = handler;
        return this;
    }

    public Set<String> prefixes() {
        return Set.copyOf(prefixRoutes.keySet());
    }

    @Override
    public GatewayResponse handle(RequestContext context) {
        String path = context.getPath();

        HttpHandler exact = exactRoutes.get(key(context.getMethod(), path));
        if (exact != null) {
            return exact.handle(context);
        }

        int end = path.indexOf('/', 1);
        String segment = end < 0 ? path.substring(1) : path.substring(1, end);
        HttpHandler prefixed = prefixRoutes.get(segment);
        if (prefixed != null) {
            String rest = end < 0 ? "" : path.substring(end);
            context.setForwardPath(rest.isEmpty() ? "/" : rest);
            return prefixed.handle(context);
        }

        if (fallback != null) {
            return fallback.handle(context);
        }
        return GatewayResponse.error(404, NOT_FOUND);
    }

    private static String key(String method, String path) {
        return method + " " + path;
    }
}
