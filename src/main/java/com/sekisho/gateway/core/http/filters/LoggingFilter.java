package com.sekisho.gateway.core.http.filters;

import com.sekisho.gateway.core.constants.HeaderConstants;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.HttpFilter;
import com.sekisho.gateway.core.http.RequestContext;
import com.sekisho.gateway.core.services.LoggingService;
import com.sekisho.gateway.core.services.LoggingService.AccessRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;

/**
 * Filter that logs every request once the final response is known, and counts
 * it in {@code gateway.requests}.
 */
public class LoggingFilter implements HttpFilter {
    private final LoggingService loggingService;
    private final MeterRegistry registry;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public LoggingFilter(LoggingService loggingService, MeterRegistry registry) {
        this.loggingService = loggingService;
        this.registry = registry;
    }

    @Override
    public GatewayResponse preHandle(RequestContext context) {
        return null;
    }

    @Override
    public void postHandle(RequestContext context, GatewayResponse response) {
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - context.getStartNanos());
        loggingService.logRequest(new AccessRecord(
                clientIp(context),
                context.getUserId(),
                context.getMethod(),
                context.getPath(),
                context.getQuery(),
                response.getStatus(),
                response.getBody().length,
                latencyMs,
                context.getHeader(HeaderConstants.USER_AGENT.getValue())));

        Counter.builder("gateway.requests")
                .tag("method", context.getMethod())
                .tag("status", String.valueOf(response.getStatus()))
                .description("Requests handled by the gateway")
                .register(registry)
                .increment();
    }

    /**
     * Client address for logging: the first {@code X-Forwarded-For} entry, then
     * {@code X-Real-IP}, then the transport address.
     *
     * @param context the request.
     * @return the best known client address.
     */
    public static String clientIp(RequestContext context) {
        String forwarded = context.getHeader(HeaderConstants.X_FORWARDED_FOR.getValue());
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
        }
        String realIp = context.getHeader(HeaderConstants.X_REAL_IP.getValue());
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return context.getRemoteAddr();
    }
}
