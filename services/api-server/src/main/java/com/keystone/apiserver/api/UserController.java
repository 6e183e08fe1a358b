package com.keystone.apiserver.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.apiserver.domain.UserDetails;
import com.keystone.apiserver.domain.UserService;
import com.keystone.apiserver.routing.ResponseEnvelope;
import com.keystone.apiserver.routing.RouteRequest;
import com.keystone.apiserver.routing.RouteResponse;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * Route handlers for the users API. Translates {@link RouteRequest}s into {@link UserService}
 * calls and wraps results in the {@link ResponseEnvelope}.
 *
 * <p>Malformed input (a non-numeric id, a missing or unparsable body) raises {@link
 * IllegalArgumentException}, which the web layer answers with 400.
 */
@Component
public class UserController {

    public static final String USER_NOT_FOUND = "User Not Found";

    public static final String USER_DELETED = "User deleted";

    private static final String ID = "id";

    private final UserService userService;
    private final ObjectMapper objectMapper;

    public UserController(UserService userService, ObjectMapper objectMapper) {
        this.userService = userService;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<RouteResponse> list(RouteRequest request) {
        return userService.listUsers()
                .thenApply(users -> RouteResponse.ok(ResponseEnvelope.successData(users)));
    }

    public CompletableFuture<RouteResponse> find(RouteRequest request) {
        long id = userId(request);
        return userService.findUser(id)
                .thenApply(user -> user
                        .map(found -> RouteResponse.ok(ResponseEnvelope.successData(found)))
                        .orElseGet(() -> RouteResponse.notFound(USER_NOT_FOUND)));
    }

    public CompletableFuture<RouteResponse> create(RouteRequest request) {
        UserDetails details = userDetails(request);
        return userService.createUser(details)
                .thenApply(user -> RouteResponse.created(ResponseEnvelope.successData(user)));
    }

    public CompletableFuture<RouteResponse> update(RouteRequest request) {
        long id = userId(request);
        UserDetails details = userDetails(request);
        return userService.updateUser(id, details)
                .thenApply(user -> user
                        .map(updated -> RouteResponse.ok(ResponseEnvelope.successData(updated)))
                        .orElseGet(() -> RouteResponse.notFound(USER_NOT_FOUND)));
    }

    public CompletableFuture<RouteResponse> delete(RouteRequest request) {
        long id = userId(request);
        return userService.deleteUser(id)
                .thenApply(deleted -> deleted
                        ? RouteResponse.ok(ResponseEnvelope.successMessage(USER_DELETED))
                        : RouteResponse.notFound(USER_NOT_FOUND));
    }

    private static long userId(RouteRequest request) {
        String raw = request.pathParameter(ID)
                .orElseThrow(() -> new IllegalArgumentException("User id is required"));
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("User id must be numeric: " + raw, e);
        }
    }

    private UserDetails userDetails(RouteRequest request) {
        if (!request.hasBody()) {
            throw new IllegalArgumentException("Request body is required");
        }
        try {
            UserDetails details = objectMapper.readValue(request.body(), UserDetails.class);
            if (details == null) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            return details;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Malformed JSON body: " + e.getOriginalMessage(), e);
        }
    }
}
