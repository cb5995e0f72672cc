package com.sekisho.gateway;

import com.sekisho.gateway.config.ConfigLoader;
import com.sekisho.gateway.config.GatewayProperties;
import com.sekisho.gateway.core.exceptions.ConfigException;
import com.sekisho.gateway.core.exceptions.GatewayException;
import com.sekisho.gateway.core.http.HttpHandler;
import com.sekisho.gateway.core.http.PipelineFactory;
import com.sekisho.gateway.core.proxy.ProxyRegistry;
import com.sekisho.gateway.core.server.GatewayServer;
import com.sekisho.gateway.core.services.LoggingService;
import com.sekisho.gateway.core.services.MetricsService;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for the gateway.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "sekisho-gateway", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Authenticating HTTP reverse-proxy gateway.")
public class SekishoGatewayApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SekishoGatewayApplication.class);

    private static final long BIND_TIMEOUT_SECONDS = 10;

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    private MetricsService metricsService;
    private ProxyRegistry proxyRegistry;
    private GatewayServer server;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Released once the listener is bound. */
    private final CountDownLatch startedLatch = new CountDownLatch(1);

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     * 
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SekishoGatewayApplication()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration, builds the pipeline and serves until stopped.
     * 
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Sekisho Gateway...");

            GatewayProperties props = new ConfigLoader().load(configPath);
            this.metricsService = new MetricsService(props.getAdmin());
            LoggingService loggingService = new LoggingService(props.getLogging());

            this.proxyRegistry = ProxyRegistry.build(props.targets(),
                    Duration.ofMillis(props.getProxy().getTimeout()), metricsService.getRegistry());
            HttpHandler handler = PipelineFactory.build(props, proxyRegistry, loggingService,
                    metricsService.getRegistry());

            this.server = new GatewayServer(props.getServer(), handler, metricsService.getRegistry());
            Thread acceptor = new Thread(server::start, "gateway-acceptor");
            acceptor.start();
            if (!server.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new GatewayException("Failed to bind " + props.getServer().getHost() + ":"
                        + props.getServer().getPort());
            }
            log.info("Gateway started: version=1.0.0, host={}, port={}, services={}",
                    props.getServer().getHost(), server.getLocalPort(), proxyRegistry.names());
            startedLatch.countDown();

            if (System.getProperty("sekisho.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (GatewayException e) {
            log.error("Fatal gateway error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Waits until the gateway accepts connections.
     *
     * @param timeout maximum time to wait.
     * @return true if the gateway started in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return startedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the listener, draining in-flight requests, then releases the
     * backend client and the admin server.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Sekisho Gateway...");

            unregisterShutdownHook();

            if (server != null) {
                server.stop();
            }
            if (proxyRegistry != null) {
                proxyRegistry.close();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress: {}", e.getMessage());
            }
        }
    }
}
