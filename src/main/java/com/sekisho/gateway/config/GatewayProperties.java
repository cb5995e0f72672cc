package com.sekisho.gateway.config;

import com.sekisho.gateway.core.auth.TokenManager;
import com.sekisho.gateway.core.exceptions.ConfigException;
import com.sekisho.gateway.core.proxy.Target;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the gateway.
 * Maps to the top-level structure of application.yml.
 */
public class GatewayProperties {
    private ServerConfig server = new ServerConfig();

    private CorsConfig cors = new CorsConfig();

    private JwtConfig jwt = new JwtConfig();

    private ProxyConfig proxy = new ProxyConfig();

    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CorsConfig getCors() {
        return cors;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setCors(CorsConfig cors) {
        this.cors = cors;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public JwtConfig getJwt() {
        return jwt;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setJwt(JwtConfig jwt) {
        this.jwt = jwt;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ProxyConfig getProxy() {
        return proxy;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setProxy(ProxyConfig proxy) {
        this.proxy = proxy;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    /**
     * Checks the settings the gateway cannot start without.
     *
     * @throws ConfigException describing the first problem found.
     */
    public void validate() {
        if (server == null || jwt == null || proxy == null) {
            throw new ConfigException("server, jwt and proxy sections must not be null");
        }
        if (jwt.getSecret() == null || jwt.getSecret().isBlank()) {
            throw new ConfigException("JWT secret is required (jwt.secret or $" + jwt.getSecretEnv() + ")");
        }
        if (jwt.getSecret().getBytes(StandardCharsets.UTF_8).length < TokenManager.MIN_SECRET_BYTES) {
            throw new ConfigException("JWT secret must be at least " + TokenManager.MIN_SECRET_BYTES + " bytes");
        }
        if (server.getPort() < 1 || server.getPort() > 65535) {
            throw new ConfigException("server.port must be between 1 and 65535");
        }
        if (proxy.getTimeout() <= 0) {
            throw new ConfigException("proxy.timeout must be positive");
        }
        List<Target> targets = targets();
        if (targets.size() > 1
                && targets.stream().anyMatch(t -> ProxyConfig.DEFAULT_TARGET.equals(t.name()))) {
            throw new ConfigException("Target '" + ProxyConfig.DEFAULT_TARGET
                    + "' cannot be combined with named targets");
        }
    }

    /**
     * Resolves the configured targets. Names are trimmed and lower-cased, URLs
     * must be absolute http or https.
     *
     * @return targets sorted by name.
     * @throws ConfigException if no target is configured or an entry is invalid.
     */
    public List<Target> targets() {
        Map<String, String> raw = proxy == null ? Map.of() : proxy.getTargets();
        if (raw.isEmpty()) {
            throw new ConfigException("At least one proxy target is required");
        }
        List<Target> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            String name = entry.getKey() == null ? "" : entry.getKey().trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty() || name.contains("/")) {
                throw new ConfigException("Invalid proxy target name: '" + entry.getKey() + "'");
            }
            if (!seen.add(name)) {
                throw new ConfigException("Duplicate proxy target: " + name);
            }
            result.add(new Target(name, parseUrl(name, entry.getValue())));
        }
        result.sort(Comparator.comparing(Target::name));
        return result;
    }

    private static URI parseUrl(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Proxy target '" + name + "' URL is required");
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigException("Proxy target '" + name + "' must be an absolute http(s) URL: " + value);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigException("Proxy target '" + name + "' has an invalid URL: " + value, e);
        }
    }
}
