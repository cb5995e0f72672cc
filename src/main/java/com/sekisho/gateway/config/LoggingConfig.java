package com.sekisho.gateway.config;

/**
 * Configuration for the access log.
 */
public class LoggingConfig {
    /**
     * Access log format. Apache-style placeholders: %h client ip, %l ident, %u user,
     * %t time, %r request line, %m method, %U path, %q query, %>s status, %b bytes,
     * %D latency in ms, %i user agent.
     */
    private String format = "%h %l %u %t \"%r\" %>s %b %Dms \"%i\"";

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
