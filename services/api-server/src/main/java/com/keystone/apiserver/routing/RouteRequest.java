package com.keystone.apiserver.routing;

import java.util.Map;
import java.util.Optional;

/**
 * What a {@link RouteHandler} sees of an inbound request.
 *
 * @param method the matched method (a HEAD request served by a GET handler reports HEAD)
 * @param path the request path within the application
 * @param pathParameters the captured path parameter, if the route declares one
 * @param queryParameters first value of each query parameter
 * @param body the raw request body, or {@code null} when there is none
 */
public record RouteRequest(
        HttpVerb method,
        String path,
        Map<String, String> pathParameters,
        Map<String, String> queryParameters,
        String body) {

    public RouteRequest {
        pathParameters = pathParameters == null ? Map.of() : Map.copyOf(pathParameters);
        queryParameters = queryParameters == null ? Map.of() : Map.copyOf(queryParameters);
    }

    public Optional<String> pathParameter(String name) {
        return Optional.ofNullable(pathParameters.get(name));
    }

    public Optional<String> queryParameter(String name) {
        return Optional.ofNullable(queryParameters.get(name));
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
