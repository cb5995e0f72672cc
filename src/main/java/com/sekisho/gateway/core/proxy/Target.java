package com.sekisho.gateway.core.proxy;

import java.net.URI;
import java.util.Objects;

/**
 * A named backend service.
 *
 * @param name service name; also the routing prefix in multi-target mode.
 * @param url  absolute http(s) base URL of the backend.
 */
public record Target(String name, URI url) {
    public Target {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
    }
}
