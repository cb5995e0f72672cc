package com.sekisho.gateway.core.proxy;

import com.sekisho.gateway.core.constants.HeaderConstants;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.HttpHandler;
import com.sekisho.gateway.core.http.RequestContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards requests to one backend service.
 * <p>
 * Client-supplied forwarding headers and {@code X-User-Id} are never trusted:
 * they are dropped and replaced with values derived from the connection and the
 * authenticated identity. Each request gets a single attempt bounded by the
 * configured timeout; a late backend response is discarded.
 */
public class ServiceProxy implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(ServiceProxy.class);

    static final int HTTP_BAD_GATEWAY = 502;
    static final int HTTP_GATEWAY_TIMEOUT = 504;
    static final String BAD_GATEWAY_MSG = "bad gateway";
    static final String GATEWAY_TIMEOUT_MSG = "gateway timeout";

    /** Request headers that are not copied to the backend. */
    private static final Set<String> DISALLOWED_HEADERS;

    /** Response headers that are not relayed to the client. */
    private static final Set<String> HOP_BY_HOP_HEADERS;

    static {
        Set<String> hopByHop = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        hopByHop.addAll(List.of(
                HeaderConstants.CONNECTION.getValue(),
                HeaderConstants.KEEP_ALIVE.getValue(),
                HeaderConstants.PROXY_AUTHENTICATE.getValue(),
                HeaderConstants.PROXY_AUTHORIZATION.getValue(),
                HeaderConstants.TE.getValue(),
                HeaderConstants.TRAILERS.getValue(),
                HeaderConstants.TRANSFER_ENCODING.getValue(),
                HeaderConstants.UPGRADE.getValue()));
        HOP_BY_HOP_HEADERS = Collections.unmodifiableSet(hopByHop);

        Set<String> disallowed = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        disallowed.addAll(hopByHop);
        // Managed by the JDK client
        disallowed.addAll(List.of(
                HeaderConstants.HOST.getValue(),
                HeaderConstants.CONTENT_LENGTH.getValue(),
                "Date", "Expect", "From", "Via", "Warning"));
        // Set by the gateway only
        disallowed.addAll(List.of(
                HeaderConstants.X_REAL_IP.getValue(),
                HeaderConstants.X_FORWARDED_FOR.getValue(),
                HeaderConstants.X_FORWARDED_PROTO.getValue(),
                HeaderConstants.X_FORWARDED_HOST.getValue(),
                HeaderConstants.X_USER_ID.getValue()));
        DISALLOWED_HEADERS = Collections.unmodifiableSet(disallowed);
    }

    private final Target target;
    private final HttpClient httpClient;
    private final Duration timeout;
    private final MeterRegistry registry;
    private final Counter timeouts;
    private final Counter badGateways;

    /**
     * @param target     backend to forward to.
     * @param httpClient shared client.
     * @param timeout    deadline for the whole backend round trip.
     * @param registry   meter registry for upstream metrics.
     */
    public ServiceProxy(Target target, HttpClient httpClient, Duration timeout, MeterRegistry registry) {
        this.target = target;
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.registry = registry;
        this.timeouts = errorCounter("timeout");
        this.badGateways = errorCounter("bad_gateway");
    }

    private Counter errorCounter(String kind) {
        return Counter.builder("gateway.upstream.errors")
                .tag("service", target.name())
                .tag("kind", kind)
                .description("Failed backend round trips")
                .register(registry);
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public GatewayResponse handle(RequestContext context) {
        context.setService(target.name());
        log.debug("Proxying request: method={}, path={}, service={}, target={}",
                context.getMethod(), context.getForwardPath(), target.name(), target.url());

        CompletableFuture<HttpResponse<byte[]>> pending = null;
        try {
            HttpRequest request = buildRequest(context);
            pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
            HttpResponse<byte[]> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Received response: method={}, path={}, service={}, target={}, status={}",
                    context.getMethod(), context.getForwardPath(), target.name(), target.url(),
                    response.statusCode());
            Counter.builder("gateway.upstream.requests")
                    .tag("service", target.name())
                    .tag("status", String.valueOf(response.statusCode()))
                    .description("Completed backend round trips")
                    .register(registry)
                    .increment();
            return relay(context, response);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return gatewayTimeout(context, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                return gatewayTimeout(context, cause);
            }
            return badGateway(context, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (pending != null) {
                pending.cancel(true);
            }
            return badGateway(context, e);
        } catch (IllegalArgumentException e) {
            return badGateway(context, e);
        }
    }

    /**
     * Builds the backend URL: target base path, then the forward path, then the
     * original query.
     *
     * @param context the request.
     * @return the absolute backend URI.
     */
    URI targetUri(RequestContext context) {
        URI base = target.url();
        StringBuilder url = new StringBuilder()
                .append(base.getScheme()).append("://").append(base.getRawAuthority())
                .append(joinPath(base.getRawPath(), context.getForwardPath()));
        String query = joinQuery(base.getRawQuery(), context.getQuery());
        if (query != null) {
            url.append('?').append(query);
        }
        return URI.create(url.toString());
    }

    private static String joinPath(String basePath, String path) {
        String left = basePath == null ? "" : basePath;
        String right = path == null || path.isEmpty() ? "/" : path;
        boolean leftSlash = left.endsWith("/");
        boolean rightSlash = right.startsWith("/");
        if (leftSlash && rightSlash) {
            return left + right.substring(1);
        }
        if (!leftSlash && !rightSlash) {
            return left + "/" + right;
        }
        return left + right;
    }

    private static String joinQuery(String baseQuery, String query) {
        if (baseQuery == null || baseQuery.isEmpty()) {
            return query;
        }
        if (query == null || query.isEmpty()) {
            return baseQuery;
        }
        return baseQuery + "&" + query;
    }

    private HttpRequest buildRequest(RequestContext context) {
        byte[] body = context.getBody();
        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(targetUri(context))
                .version(HttpClient.Version.HTTP_1_1)
                .timeout(timeout)
                .method(context.getMethod(), body.length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body));

        context.getHeaders().forEach((k, values) -> {
            if (!DISALLOWED_HEADERS.contains(k)) {
                values.forEach(v -> rb.header(k, v));
            }
        });

        String clientIp = context.getRemoteAddr();
        rb.header(HeaderConstants.X_REAL_IP.getValue(), clientIp);
        rb.header(HeaderConstants.X_FORWARDED_FOR.getValue(), clientIp);
        rb.header(HeaderConstants.X_FORWARDED_PROTO.getValue(), context.isSecure() ? "https" : "http");
        String host = context.getHeader(HeaderConstants.HOST.getValue());
        if (host != null && !host.isEmpty()) {
            rb.header(HeaderConstants.X_FORWARDED_HOST.getValue(), host);
        }
        if (context.getUserId() != null) {
            rb.header(HeaderConstants.X_USER_ID.getValue(), context.getUserId());
        }
        return rb.build();
    }

    private GatewayResponse relay(RequestContext context, HttpResponse<byte[]> response) {
        GatewayResponse relayed = new GatewayResponse(response.statusCode(), response.body());
        boolean head = "HEAD".equals(context.getMethod());
        response.headers().map().forEach((k, values) -> {
            if (HOP_BY_HOP_HEADERS.contains(k) || k.startsWith(":")) {
                return;
            }
            if (!head && HeaderConstants.CONTENT_LENGTH.getValue().equalsIgnoreCase(k)) {
                return;
            }
            values.forEach(v -> relayed.addHeader(k, v));
        });
        return relayed;
    }

    private GatewayResponse gatewayTimeout(RequestContext context, Throwable cause) {
        timeouts.increment();
        logFailure(context, "timed out after " + timeout.toMillis() + "ms", cause);
        return GatewayResponse.error(HTTP_GATEWAY_TIMEOUT, GATEWAY_TIMEOUT_MSG);
    }

    private GatewayResponse badGateway(RequestContext context, Throwable cause) {
        badGateways.increment();
        logFailure(context, String.valueOf(cause.getMessage()), cause);
        return GatewayResponse.error(HTTP_BAD_GATEWAY, BAD_GATEWAY_MSG);
    }

    private void logFailure(RequestContext context, String error, Throwable cause) {
        log.error("Proxy error: method={}, path={}, service={}, target={}, error={} ({})",
                context.getMethod(), context.getForwardPath(), target.name(), target.url(), error,
                cause.getClass().getSimpleName());
    }
}
