package com.sekisho.gateway.core.http;

import com.sekisho.gateway.core.auth.TokenClaims;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Context for a single HTTP request passing through the filter chain.
 * Owned by the connection thread handling the request and never shared.
 */
public class RequestContext {
    private final String method;
    private final String path;
    private final String query;
    private final Map<String, List<String>> headers;
    private final String remoteAddr;
    private final boolean secure;
    private final byte[] body;
    private final long startNanos;

    /** Path sent to the backend; the inbound path unless a route strips a prefix. */
    private String forwardPath;
    private String service;
    private String userId;
    private TokenClaims claims;

    /**
     * @param method     request method.
     * @param path       raw request path, starting with {@code /}.
     * @param query      raw query string without {@code ?}; may be null.
     * @param headers    request headers with every value in arrival order; copied into a
     *                   case-insensitive map.
     * @param remoteAddr transport-level client address.
     * @param secure     whether the client connection is TLS.
     * @param body       request body; may be empty.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RequestContext(String method, String path, String query, Map<String, List<String>> headers,
            String remoteAddr, boolean secure, byte[] body) {
        this.method = method;
        this.path = path;
        this.query = query;
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> this.headers
                .computeIfAbsent(name, k -> new ArrayList<>()).addAll(values));
        this.remoteAddr = remoteAddr;
        this.secure = secure;
        this.body = body == null ? new byte[0] : body;
        this.forwardPath = path;
        this.startNanos = System.nanoTime();
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    public String getQuery() {
        return query;
    }

    public Map<String, List<String>> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * @return the first value of the named header, or null if absent.
     */
    public String getHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public String getRemoteAddr() {
        return remoteAddr;
    }

    public boolean isSecure() {
        return secure;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }

    public long getStartNanos() {
        return startNanos;
    }

    public String getForwardPath() {
        return forwardPath;
    }

    public void setForwardPath(String forwardPath) {
        this.forwardPath = forwardPath;
    }

    /**
     * @return name of the backend service the request was routed to, or null.
     */
    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    /**
     * @return authenticated user id, or null if the request was not authenticated.
     */
    public String getUserId() {
        return userId;
    }

    public TokenClaims getClaims() {
        return claims;
    }

    /**
     * Records the authenticated identity for downstream handlers.
     *
     * @param claims validated claims.
     */
    public void authenticate(TokenClaims claims) {
        this.claims = claims;
        this.userId = claims.getUserId();
    }

    /**
     * @return path plus query, as sent by the client.
     */
    public String getRequestTarget() {
        return query == null ? path : path + "?" + query;
    }
}
