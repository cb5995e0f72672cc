package com.sekisho.gateway.core.services;

import com.sekisho.gateway.config.AdminConfig;
import com.sekisho.gateway.core.exceptions.GatewayException;
import com.sekisho.gateway.core.utils.IoUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the gateway's Prometheus meter registry and the admin endpoint that
 * exposes it, along with a liveness check.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    /**
     * Creates the registry and, when enabled, starts the admin server.
     *
     * @param config admin settings.
     * @throws GatewayException if the admin server cannot bind.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public MetricsService(AdminConfig config) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = config;
        setupAdminServer();
    }

    private void setupAdminServer() {
        if (config == null || !config.isEnabled()) {
            return;
        }
        InetSocketAddress address = new InetSocketAddress(config.getBindAddress(), config.getPort());
        try {
            adminServer = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new GatewayException("Failed to start admin server on port " + config.getPort(), e);
        }
        adminServer.createContext("/health", exchange -> reply(exchange, "text/plain; charset=utf-8", "OK"));
        adminServer.createContext("/metrics", exchange -> reply(exchange, PROMETHEUS_CONTENT_TYPE, registry.scrape()));

        adminExecutor = Executors.newCachedThreadPool(IoUtils.daemonThreadFactory("admin"));
        adminServer.setExecutor(adminExecutor);
        adminServer.start();
        log.info("Admin server listening on {}:{} (/health, /metrics)", config.getBindAddress(), getPort());
    }

    private static void reply(HttpExchange exchange, String contentType, String text) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the bound admin port, or -1 when the admin server is not running.
     */
    public int getPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
        registry.close();
    }
}
