package com.keystone.apiserver.routing;

/**
 * Status code and JSON-serializable body produced by a handler.
 *
 * @param status HTTP status code
 * @param body object serialized as the JSON response body
 */
public record RouteResponse(int status, Object body) {

    public static final String ROUTE_NOT_FOUND_MESSAGE = "Route Not Found";

    public RouteResponse {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status must be a valid HTTP status code: " + status);
        }
    }

    public static RouteResponse ok(Object body) {
        return new RouteResponse(200, body);
    }

    public static RouteResponse created(Object body) {
        return new RouteResponse(201, body);
    }

    public static RouteResponse notFound(String message) {
        return new RouteResponse(404, ResponseEnvelope.failed(message));
    }

    /** The response for any request no route matches. */
    public static RouteResponse routeNotFound() {
        return notFound(ROUTE_NOT_FOUND_MESSAGE);
    }
}
