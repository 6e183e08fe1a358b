package com.keystone.apiserver.routing;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Handler for a registered route.
 *
 * <p>Handlers complete asynchronously. An exception thrown by {@link #handle} or carried by the
 * returned future is not caught by the router; the web layer turns it into an error response.
 */
@FunctionalInterface
public interface RouteHandler {

    CompletableFuture<RouteResponse> handle(RouteRequest request);

    /**
     * Adapts a synchronous function. Exceptions thrown by {@code handler} propagate to the caller
     * of {@link #handle} unchanged.
     */
    static RouteHandler of(Function<RouteRequest, RouteResponse> handler) {
        return request -> CompletableFuture.completedFuture(handler.apply(request));
    }
}
