package com.sekisho.gateway.core.http;

/**
 * Produces the response for a request.
 */
@FunctionalInterface
public interface HttpHandler {
    /**
     * @param context the request; may be amended by the handler.
     * @return the response to send, never null.
     */
    GatewayResponse handle(RequestContext context);
}
