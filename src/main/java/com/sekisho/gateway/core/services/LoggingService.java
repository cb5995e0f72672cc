package com.sekisho.gateway.core.services;

import com.sekisho.gateway.config.LoggingConfig;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one access log line per request, using an Apache-style format.
 * <p>
 * Supported tokens: {@code %h} client ip, {@code %l} (always {@code -}),
 * {@code %u} user id, {@code %t} time, {@code %r} request line, {@code %m}
 * method, {@code %U} path, {@code %q} query, {@code %>s} status, {@code %b}
 * response bytes, {@code %D} latency in ms, {@code %i} user agent. Any other
 * {@code %} sequence is copied as is.
 */
public class LoggingService {

    private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    private final String format;

    /**
     * Cached formatted timestamp, refreshed at most once per second.
     */
    private volatile String cachedTimestamp = "";
    /** The epoch second at which {@link #cachedTimestamp} was last produced. */
    private volatile long cachedTimestampSec = 0;

    public LoggingService(LoggingConfig config) {
        this.format = config != null && config.getFormat() != null ? config.getFormat() : new LoggingConfig().getFormat();
    }

    /**
     * Request data rendered into an access log line.
     *
     * @param clientIp  client address, forwarded headers already resolved.
     * @param userId    authenticated user id; null when anonymous.
     * @param method    request method.
     * @param path      request path.
     * @param query     raw query string; null when absent.
     * @param status    response status.
     * @param bytes     response body size.
     * @param latencyMs time spent handling the request.
     * @param userAgent client user agent; may be null.
     */
    public record AccessRecord(String clientIp, String userId, String method, String path, String query,
            int status, long bytes, long latencyMs, String userAgent) {
    }

    /**
     * Logs a request using the configured format.
     *
     * @param access request data.
     */
    public void logRequest(AccessRecord access) {
        log.info(formatLine(access));
    }

    /**
     * Formats an access record without logging it.
     *
     * @param access request data.
     * @return the formatted line.
     */
    public String formatLine(AccessRecord access) {
        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, i, access);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private int appendToken(StringBuilder sb, int currentIdx, AccessRecord access) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(dash(access.clientIp()));
            case 'l' -> sb.append('-');
            case 'u' -> sb.append(dash(access.userId()));
            case 't' -> sb.append('[').append(getCachedTimestamp()).append(']');
            case 'r' -> sb.append(access.method()).append(' ').append(target(access)).append(" HTTP/1.1");
            case 'm' -> sb.append(access.method());
            case 'U' -> sb.append(access.path());
            case 'q' -> sb.append(access.query() != null ? "?" + access.query() : "");
            case 'b' -> sb.append(access.bytes() > 0 ? String.valueOf(access.bytes()) : "-");
            case 'D' -> sb.append(access.latencyMs());
            case 'i' -> sb.append(dash(access.userAgent()));
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(access.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    private static String target(AccessRecord access) {
        return access.query() != null ? access.path() + "?" + access.query() : access.path();
    }

    private static String dash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    /**
     * Returns a formatted timestamp string for the current second.
     *
     * @return Formatted timestamp string (e.g., {@code 22/Feb/2026:23:30:00 +0900}).
     */
    private String getCachedTimestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestampSec = nowSec;
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
        }
        return cachedTimestamp;
    }
}
