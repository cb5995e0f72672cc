package com.sekisho.gateway.core.http;

/**
 * Filter for intercepting and potentially short-circuiting HTTP requests.
 */
public interface HttpFilter {
    /**
     * Called before the request reaches the handler.
     *
     * @return null to continue to the next filter, or a response to stop the chain.
     */
    GatewayResponse preHandle(RequestContext context);

    /**
     * Called with the final response before it is sent to the client, also when
     * this filter or a later one short-circuited.
     */
    default void postHandle(RequestContext context, GatewayResponse response) {
    }
}
