package com.sekisho.gateway.core.http;

import com.sekisho.gateway.config.GatewayProperties;
import com.sekisho.gateway.config.JwtConfig;
import com.sekisho.gateway.config.ProxyConfig;
import com.sekisho.gateway.core.auth.BearerAuthenticator;
import com.sekisho.gateway.core.auth.TokenManager;
import com.sekisho.gateway.core.exceptions.ConfigException;
import com.sekisho.gateway.core.http.filters.AuthFilter;
import com.sekisho.gateway.core.http.filters.CorsFilter;
import com.sekisho.gateway.core.http.filters.LoggingFilter;
import com.sekisho.gateway.core.proxy.ProxyRegistry;
import com.sekisho.gateway.core.proxy.ServiceProxy;
import com.sekisho.gateway.core.services.LoggingService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the request pipeline: logging, CORS, routing, authentication and
 * proxying.
 * <p>
 * With a single target named {@value ProxyConfig#DEFAULT_TARGET} every path
 * except the health check is authenticated and forwarded unchanged. Otherwise
 * each target owns the {@code /name/*} prefix, which is stripped before
 * forwarding.
 */
public final class PipelineFactory {
    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    public static final String HEALTH_PATH = "/health";

    private PipelineFactory() {
    }

    /**
     * Builds the top-level handler.
     *
     * @param props          validated configuration.
     * @param registry       backend proxies.
     * @param loggingService access log writer.
     * @param meterRegistry  registry for request metrics.
     * @return the handler to serve.
     */
    public static HttpHandler build(GatewayProperties props, ProxyRegistry registry,
            LoggingService loggingService, MeterRegistry meterRegistry) {
        Router router = new Router()
                .get(HEALTH_PATH, context -> GatewayResponse.text(200, "OK"));
        HttpFilter auth = createAuthFilter(props.getJwt());

        if (registry.isSingleTarget()) {
            ServiceProxy proxy = registry.lookup(ProxyConfig.DEFAULT_TARGET).orElseThrow();
            router.fallback(new FilteredHandler(List.of(auth), proxy));
            log.info("Registered route: pattern=/*, service={}", ProxyConfig.DEFAULT_TARGET);
        } else {
            if (registry.lookup(ProxyConfig.DEFAULT_TARGET).isPresent()) {
                throw new ConfigException("Target '" + ProxyConfig.DEFAULT_TARGET
                        + "' cannot be combined with named targets");
            }
            boolean skipAuth = props.getProxy() != null && props.getProxy().isSkipAuth();
            for (String name : registry.names()) {
                ServiceProxy proxy = registry.lookup(name).orElseThrow();
                if (skipAuth) {
                    log.warn("Authentication disabled for route /{}/* (proxy.skipAuth=true)", name);
                    router.prefix(name, proxy);
                } else {
                    router.prefix(name, new FilteredHandler(List.of(auth), proxy));
                }
                log.info("Registered route: pattern=/{}/*, service={}", name, name);
            }
        }

        return new FilteredHandler(List.of(
                new LoggingFilter(loggingService, meterRegistry),
                new CorsFilter(props.getCors())), router);
    }

    /**
     * Creates the authentication filter, falling back to one that answers 500
     * when the token manager cannot be built.
     *
     * @param jwt JWT settings.
     * @return the filter.
     */
    static HttpFilter createAuthFilter(JwtConfig jwt) {
        try {
            return new AuthFilter(new BearerAuthenticator(new TokenManager(jwt)));
        } catch (ConfigException e) {
            log.error("Failed to create token manager: {}", e.getMessage());
            return AuthFilter.failing();
        }
    }
}
