package com.sekisho.gateway.config;

/**
 * Listener settings for the gateway HTTP server.
 */
public class ServerConfig {
    /** Local address to bind to. */
    private String host = "0.0.0.0";

    /** Port to listen on. */
    private int port = 8080;

    /** Maximum time in milliseconds to read one request. Default is 15s. */
    private int readTimeout = 15000;

    /** Maximum time in milliseconds a keep-alive connection may sit idle. Default is 60s. */
    private int idleTimeout = 60000;

    /** Grace period in milliseconds for in-flight requests on shutdown. Default is 30s. */
    private int shutdownTimeout = 30000;

    /** Maximum concurrent connections. Default is 10,000. */
    private int maxConnections = 10000;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(int idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public int getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(int shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }
}
