package com.sekisho.gateway.core.http;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a list of filters around a handler.
 * <p>
 * Filters run in order until one returns a response. {@code postHandle} is
 * then called, in reverse order, on every filter whose {@code preHandle} ran.
 * A handler or filter that throws yields a 500 response.
 */
public class FilteredHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(FilteredHandler.class);

    private final List<HttpFilter> filters;
    private final HttpHandler handler;

    public FilteredHandler(List<HttpFilter> filters, HttpHandler handler) {
        this.filters = List.copyOf(filters);
        this.handler = handler;
    }

    @Override
    public GatewayResponse handle(RequestContext context) {
        GatewayResponse response = null;
        int ran = 0;
        try {
            while (ran < filters.size() && response == null) {
                response = filters.get(ran++).preHandle(context);
            }
            if (response == null) {
                response = handler.handle(context);
            }
        } catch (RuntimeException e) {
            log.error("Unhandled error for {} {}: {}", context.getMethod(), context.getPath(), e.getMessage(), e);
            response = GatewayResponse.error(500, "internal server error");
        }
        for (int i = ran - 1; i >= 0; i--) {
            try {
                filters.get(i).postHandle(context, response);
            } catch (RuntimeException e) {
                log.warn("Filter post-processing failed: {}", e.getMessage(), e);
            }
        }
        return response;
    }
}
