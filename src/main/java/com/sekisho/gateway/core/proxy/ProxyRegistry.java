package com.sekisho.gateway.core.proxy;

import com.sekisho.gateway.config.ProxyConfig;
import com.sekisho.gateway.core.exceptions.ConfigException;
import com.sekisho.gateway.core.utils.IoUtils;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of backend proxies, built once at startup and read-only afterwards.
 * All proxies share one HTTP client and its executor.
 */
public final class ProxyRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProxyRegistry.class);

    private final Map<String, ServiceProxy> proxies;
    private final ExecutorService executor;

    private ProxyRegistry(Map<String, ServiceProxy> proxies, ExecutorService executor) {
        this.proxies = Collections.unmodifiableMap(proxies);
        this.executor = executor;
    }

    /**
     * Creates one proxy per target.
     *
     * @param targets  backends; at least one, names unique.
     * @param timeout  per-request deadline.
     * @param registry meter registry for upstream metrics.
     * @return the registry.
     * @throws ConfigException on an empty target list or duplicate names.
     */
    public static ProxyRegistry build(List<Target> targets, Duration timeout, MeterRegistry registry) {
        if (targets == null || targets.isEmpty()) {
            throw new ConfigException("No proxy targets configured");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigException("Proxy timeout must be positive");
        }

        ExecutorService executor = Executors.newCachedThreadPool(IoUtils.daemonThreadFactory("upstream"));
        HttpClient httpClient = HttpClient.newBuilder()
                .executor(executor)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();

        Map<String, ServiceProxy> proxies = new TreeMap<>();
        for (Target target : targets) {
            if (proxies.containsKey(target.name())) {
                executor.shutdownNow();
                throw new ConfigException("Duplicate proxy target: " + target.name());
            }
            proxies.put(target.name(), new ServiceProxy(target, httpClient, timeout, registry));
            log.info("Created proxy: service={}, target={}", target.name(), target.url());
        }
        return new ProxyRegistry(proxies, executor);
    }

    public Optional<ServiceProxy> lookup(String name) {
        return Optional.ofNullable(proxies.get(name));
    }

    /**
     * @return service names in ascending order.
     */
    public SortedSet<String> names() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(proxies.keySet()));
    }

    /**
     * @return true when the only target is {@value ProxyConfig#DEFAULT_TARGET}.
     */
    public boolean isSingleTarget() {
        return proxies.size() == 1 && proxies.containsKey(ProxyConfig.DEFAULT_TARGET);
    }

    /**
     * Releases the shared client's threads. In-flight backend calls are abandoned.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
