package com.keystone.apiserver.routing;

/**
 * Registers routes on a {@link Router} under a fixed path prefix.
 *
 * <p>{@code router.group("/api/v1/users").get("/:id", handler)} registers {@code GET
 * /api/v1/users/:id}; a pattern of {@code "/"} registers the prefix itself.
 */
public final class RouteGroup {

    private final Router router;
    private final String prefix;

    RouteGroup(Router router, String prefix) {
        if (prefix == null || !prefix.startsWith("/")) {
            throw new IllegalArgumentException("Route group prefix must start with '/': " + prefix);
        }
        this.router = router;
        this.prefix = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }

    public RouteGroup register(HttpVerb method, String pattern, RouteHandler handler) {
        router.register(method, resolve(pattern), handler);
        return this;
    }

    public RouteGroup get(String pattern, RouteHandler handler) {
        return register(HttpVerb.GET, pattern, handler);
    }

    public RouteGroup post(String pattern, RouteHandler handler) {
        return register(HttpVerb.POST, pattern, handler);
    }

    public RouteGroup put(String pattern, RouteHandler handler) {
        return register(HttpVerb.PUT, pattern, handler);
    }

    public RouteGroup patch(String pattern, RouteHandler handler) {
        return register(HttpVerb.PATCH, pattern, handler);
    }

    public RouteGroup delete(String pattern, RouteHandler handler) {
        return register(HttpVerb.DELETE, pattern, handler);
    }

    /** Nested group, e.g. {@code group("/api").group("/v1")}. */
    public RouteGroup group(String subPrefix) {
        return new RouteGroup(router, resolve(subPrefix));
    }

    public String prefix() {
        return prefix.isEmpty() ? "/" : prefix;
    }

    String resolve(String pattern) {
        if (pattern == null || !pattern.startsWith("/")) {
            throw new IllegalArgumentException("Path pattern must start with '/': " + pattern);
        }
        if (pattern.equals("/")) {
            return prefix.isEmpty() ? "/" : prefix;
        }
        return prefix + pattern;
    }
}
