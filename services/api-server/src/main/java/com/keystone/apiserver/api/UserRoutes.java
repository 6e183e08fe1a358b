package com.keystone.apiserver.api;

import com.keystone.apiserver.routing.RouteRegistrar;
import com.keystone.apiserver.routing.Router;
import org.springframework.stereotype.Component;

/**
 * Mounts the users API under {@value #PREFIX}.
 *
 * <pre>
 * GET    /api/v1/users
 * GET    /api/v1/users/:id
 * POST   /api/v1/users
 * PUT    /api/v1/users/:id
 * DELETE /api/v1/users/:id
 * </pre>
 */
@Component
public class UserRoutes implements RouteRegistrar {

    public static final String PREFIX = "/api/v1/users";

    private final UserController controller;

    public UserRoutes(UserController controller) {
        this.controller = controller;
    }

    @Override
    public void registerRoutes(Router router) {
        router.group(PREFIX)
                .get("/", controller::list)
                .get("/:id", controller::find)
                .post("/", controller::create)
                .put("/:id", controller::update)
                .delete("/:id", controller::delete);
    }
}
