package io.shapestreams.server.core;

import java.net.URI;
import java.util.Objects;

/**
 * Framework-neutral request abstraction. Shape requests carry everything in the method, path and
 * query string.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;

    public ServerRequest(HttpMethod method, URI uri) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }
}
