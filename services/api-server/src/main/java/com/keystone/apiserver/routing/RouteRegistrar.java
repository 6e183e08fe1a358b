package com.keystone.apiserver.routing;

/**
 * A set of routes contributed to the {@link Router} at startup. Spring collects every registrar
 * bean, applies them in order, then seals the router.
 */
@FunctionalInterface
public interface RouteRegistrar {

    void registerRoutes(Router router);
}
