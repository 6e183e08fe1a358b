package com.keystone.observability;

/**
 * Immutable context for a single inbound HTTP request.
 * <p>
 * The request-id filter establishes one {@code RequestContext} per request. Its values are
 * copied into SLF4J MDC by {@link RequestContextHolder} so every log line written while the
 * request is being served (including on data-access threads) carries the request id.
 *
 * @param requestId unique id of the request, echoed to the client as {@code X-Request-ID}
 * @param method    HTTP method as received (e.g. {@code GET})
 * @param path      request path within the application (nullable for background work)
 */
public record RequestContext(String requestId, String method, String path) {

    /** MDC key for the request id. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the HTTP method. */
    public static final String MDC_METHOD = "httpMethod";

    /** MDC key for the request path. */
    public static final String MDC_PATH = "httpPath";

    /**
     * Compact constructor: the request id is the one mandatory value.
     */
    public RequestContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
    }

    /**
     * Creates a context that carries only a request id.
     */
    public static RequestContext of(String requestId) {
        return new RequestContext(requestId, null, null);
    }
}
