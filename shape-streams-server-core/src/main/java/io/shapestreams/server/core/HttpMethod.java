package io.shapestreams.server.core;

/**
 * Request methods the handler distinguishes.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    DELETE,
    OPTIONS
}
