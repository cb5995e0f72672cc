package com.sekisho.gateway.core.constants;

/**
 * Common HTTP header names used by the gateway.
 */
public enum HeaderConstants {
    /** The Standard HTTP Host header. */
    HOST("Host"),
    /** Bearer credentials presented by the client. */
    AUTHORIZATION("Authorization"),
    /** Hop-by-hop credentials for an intermediate proxy. */
    PROXY_AUTHORIZATION("Proxy-Authorization"),
    /** Hop-by-hop challenge from an intermediate proxy. */
    PROXY_AUTHENTICATE("Proxy-Authenticate"),
    /** Hop-by-hop Connection header. */
    CONNECTION("Connection"),
    /** Length of the entity body in bytes. */
    CONTENT_LENGTH("Content-Length"),
    /** Media type of the entity body. */
    CONTENT_TYPE("Content-Type"),
    /** Type of encoding used to transfer the entity. */
    TRANSFER_ENCODING("Transfer-Encoding"),
    /** Specifies the persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive"),
    /** Specifies the transfer encodings the client is willing to accept. */
    TE("TE"),
    /** Specifies that a set of header fields is present in the trailer. */
    TRAILERS("Trailers"),
    /** Used by the client to request a protocol change. */
    UPGRADE("Upgrade"),
    /** Client software identification. */
    USER_AGENT("User-Agent"),
    /** Address of the client as observed by the gateway. */
    X_REAL_IP("X-Real-IP"),
    /** Forwarding chain; set by the gateway to the observed client address. */
    X_FORWARDED_FOR("X-Forwarded-For"),
    /** Scheme of the inbound connection. */
    X_FORWARDED_PROTO("X-Forwarded-Proto"),
    /** Host requested by the client. */
    X_FORWARDED_HOST("X-Forwarded-Host"),
    /** Authenticated user id relayed to backends. */
    X_USER_ID("X-User-Id"),
    /** Origin of a cross-site request. */
    ORIGIN("Origin"),
    /** Caches must key responses on Origin. */
    VARY("Vary"),
    /** CORS: permitted origin. */
    ACCESS_CONTROL_ALLOW_ORIGIN("Access-Control-Allow-Origin"),
    /** CORS: whether credentials may be sent. */
    ACCESS_CONTROL_ALLOW_CREDENTIALS("Access-Control-Allow-Credentials"),
    /** CORS: permitted methods. */
    ACCESS_CONTROL_ALLOW_METHODS("Access-Control-Allow-Methods"),
    /** CORS: permitted request headers. */
    ACCESS_CONTROL_ALLOW_HEADERS("Access-Control-Allow-Headers"),
    /** CORS: preflight cache lifetime in seconds. */
    ACCESS_CONTROL_MAX_AGE("Access-Control-Max-Age");

    private final String value;

    HeaderConstants(String value) {
        this.value = value;
    }

    /**
     * Retrieves the standard string value of the header.
     *
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }
}
