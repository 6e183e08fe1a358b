package com.keystone.apiserver.routing;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods the router can register handlers for.
 */
public enum HttpVerb {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS;

    /**
     * Parses a method name case-insensitively. Unknown or missing names yield an empty result
     * rather than an exception, so the router can answer them with its not-found response.
     */
    public static Optional<HttpVerb> parse(String method) {
        if (method == null || method.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(method.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
