package com.keystone.apiserver.api;

import com.keystone.apiserver.routing.ResponseEnvelope;
import com.keystone.apiserver.routing.RouteHandler;
import com.keystone.apiserver.routing.RouteRegistrar;
import com.keystone.apiserver.routing.RouteResponse;
import com.keystone.apiserver.routing.Router;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** {@code GET /}: the welcome message. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class WelcomeRoutes implements RouteRegistrar {

    public static final String WELCOME_MESSAGE = "Welcome to the server";

    @Override
    public void registerRoutes(Router router) {
        router.get(
                "/",
                RouteHandler.of(
                        request -> RouteResponse.ok(ResponseEnvelope.successMessage(WELCOME_MESSAGE))));
    }
}
