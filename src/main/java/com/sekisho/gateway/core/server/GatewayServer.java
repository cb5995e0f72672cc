package com.sekisho.gateway.core.server;

import com.sekisho.gateway.config.ServerConfig;
import com.sekisho.gateway.core.http.HttpHandler;
import com.sekisho.gateway.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP/1.1 listener for the gateway.
 * <p>
 * Each accepted connection is served by its own worker thread. {@link #stop()}
 * stops accepting, closes idle keep-alive connections and waits for busy ones
 * up to the shutdown timeout before closing them forcibly.
 */
public class GatewayServer {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);

    private final ServerConfig config;
    private final HttpHandler handler;
    private final MeterRegistry registry;

    /** Executor for handling client connections. */
    private final ExecutorService executor;

    /** Semaphore to enforce the maximum number of concurrent connections. */
    private final Semaphore connectionSemaphore;

    /** Open connections, for graceful shutdown. */
    private final Set<HttpConnection> connections = ConcurrentHashMap.newKeySet();

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Gauge activeGauge;

    /**
     * Latch released once {@code serverSocket.bind()} has completed (successfully
     * or not).
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;
    private volatile boolean stopping = false;
    private volatile ServerSocket serverSocket;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public GatewayServer(ServerConfig config, HttpHandler handler, MeterRegistry registry) {
        this.config = config;
        this.handler = handler;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(IoUtils.daemonThreadFactory("gateway-worker"));
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        this.totalConnections = Counter.builder("gateway.connections.total")
                .description("Total number of accepted connections")
                .register(registry);
        this.connectionErrors = Counter.builder("gateway.connections.errors")
                .description("Total number of connection errors")
                .register(registry);
        this.activeGauge = Gauge.builder("gateway.connections.active", connections, Set::size)
                .description("Current number of open connections")
                .register(registry);
    }

    /**
     * Binds to the configured address and runs the accept loop until
     * {@link #stop()} is called. Blocks the calling thread.
     */
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            bindSuccess = true;
            bindLatch.countDown();
            log.info("Gateway listening on {}:{}", config.getHost(), serverSocket.getLocalPort());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("Gateway server error on port {}: {}", config.getPort(), e.getMessage(), e);
        }
    }

    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("Accept error on port {}: {}", config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("I/O error during accept on port {}: {}", config.getPort(), e.getMessage());
            return true;
        }
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
        } catch (SocketException e) {
            log.debug("Failed to configure client socket: {}", e.getMessage());
        }

        if (!connectionSemaphore.tryAcquire()) {
            log.warn("Connection limit reached ({}), rejecting {}", config.getMaxConnections(), remoteAddr);
            IoUtils.closeQuietly(client, "limit reached client socket");
            return;
        }

        HttpConnection connection = new HttpConnection(client, handler, this);
        connections.add(connection);
        try {
            executor.submit(() -> {
                try {
                    connection.run();
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("Unexpected error handling client {}: {}", remoteAddr, e.getMessage(), e);
                } finally {
                    connections.remove(connection);
                    connectionSemaphore.release();
                    connection.close();
                }
            });
        } catch (RuntimeException e) {
            connections.remove(connection);
            connectionSemaphore.release();
            connection.close();
            log.warn("Rejected connection from {}: {}", remoteAddr, e.getMessage());
        }
    }

    /**
     * Waits for the server to finish binding to its port.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return the bound port, or -1 before binding.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null && bindSuccess ? socket.getLocalPort() : -1;
    }

    boolean isStopping() {
        return stopping;
    }

    int getReadTimeout() {
        return config.getReadTimeout();
    }

    int getIdleTimeout() {
        return config.getIdleTimeout();
    }

    /**
     * Stops accepting connections and drains the open ones.
     */
    public void stop() {
        if (stopping) {
            return;
        }
        stopping = true;
        log.info("Stopping gateway server on port {}...", config.getPort());
        IoUtils.closeQuietly(serverSocket, "server socket");

        connections.forEach(HttpConnection::closeIfIdle);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getShutdownTimeout(), TimeUnit.MILLISECONDS)) {
                log.warn("{} connection(s) still busy after {} ms, closing them",
                        connections.size(), config.getShutdownTimeout());
                connections.forEach(HttpConnection::close);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connections.forEach(HttpConnection::close);
            executor.shutdownNow();
        }

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);
        log.info("Gateway server stopped");
    }
}
