package com.keystone.apiserver.routing;

import com.keystone.observability.DispatchMetrics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@code (method, path)} to a registered {@link RouteHandler}.
 *
 * <p>Registration:
 *
 * <ul>
 *   <li>one entry per method and {@linkplain PathPattern#key() pattern key}; registering the same
 *       pair again replaces the handler (last write wins) and keeps its position
 *   <li>routes are registered during startup; {@link #seal()} freezes the table before the
 *       server listens, and later registrations fail
 * </ul>
 *
 * <p>Dispatch looks at parameterless routes first, then parameterized routes in registration
 * order. A {@code HEAD} request with no {@code HEAD} route falls back to the {@code GET} route.
 * Anything unmatched, unknown methods included, gets a 404 with
 * {@code {"status":"Failed","message":"Route Not Found"}}.
 *
 * <p>Registration is synchronized and publishes an immutable snapshot; dispatch reads the
 * snapshot without locking.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final DispatchMetrics metrics;
    private final Map<RouteKey, Route> entries = new LinkedHashMap<>();
    private volatile List<Route> table = List.of();
    private volatile boolean sealed;

    /** Creates a router that records no metrics. */
    public Router() {
        this(null);
    }

    /**
     * @param metrics dispatch outcome counters; may be null
     */
    public Router(DispatchMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Registers {@code handler} for {@code method} and {@code pattern}.
     *
     * @throws IllegalStateException if the router has been sealed
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public synchronized Router register(HttpVerb method, String pattern, RouteHandler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        if (sealed) {
            throw new IllegalStateException(
                    "Router is sealed; cannot register " + method + " " + pattern);
        }
        PathPattern compiled = PathPattern.compile(pattern);
        Route previous = entries.put(
                new RouteKey(method, compiled.key()), new Route(method, compiled, handler));
        if (previous != null) {
            log.debug("Replacing handler for {} {}", method, pattern);
        }
        table = List.copyOf(entries.values());
        return this;
    }

    public Router get(String pattern, RouteHandler handler) {
        return register(HttpVerb.GET, pattern, handler);
    }

    public Router post(String pattern, RouteHandler handler) {
        return register(HttpVerb.POST, pattern, handler);
    }

    public Router put(String pattern, RouteHandler handler) {
        return register(HttpVerb.PUT, pattern, handler);
    }

    public Router patch(String pattern, RouteHandler handler) {
        return register(HttpVerb.PATCH, pattern, handler);
    }

    public Router delete(String pattern, RouteHandler handler) {
        return register(HttpVerb.DELETE, pattern, handler);
    }

    /**
     * Returns a view that registers routes under {@code prefix}, the way a sub-router is mounted
     * at a path.
     */
    public RouteGroup group(String prefix) {
        return new RouteGroup(this, prefix);
    }

    /** Freezes the route table. Idempotent. */
    public synchronized void seal() {
        if (!sealed) {
            sealed = true;
            log.info("Router sealed with {} route(s)", table.size());
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    /** Number of registered routes. */
    public int size() {
        return table.size();
    }

    /** Dispatches a request with no query parameters and no body. */
    public CompletableFuture<RouteResponse> dispatch(String method, String path) {
        return dispatch(method, path, Map.of(), null);
    }

    /**
     * Dispatches a request to its handler, or answers with the not-found response.
     *
     * @param method HTTP method name (any case); unknown names are treated as unmatched
     * @param path request path within the application
     * @param queryParameters first value of each query parameter
     * @param body raw request body, or null
     * @return the handler's future unchanged, or a completed not-found response
     */
    public CompletableFuture<RouteResponse> dispatch(
            String method, String path, Map<String, String> queryParameters, String body) {
        Optional<HttpVerb> verb = HttpVerb.parse(method);
        if (verb.isPresent()) {
            List<String> segments = PathPattern.split(path);
            Optional<RouteMatch> match = find(verb.get(), segments);
            if (match.isEmpty() && verb.get() == HttpVerb.HEAD) {
                match = find(HttpVerb.GET, segments);
            }
            if (match.isPresent()) {
                countDispatch(verb.get().name(), true);
                RouteMatch found = match.get();
                var request = new RouteRequest(
                        verb.get(), path, found.parameters(), queryParameters, body);
                return Objects.requireNonNull(
                        found.route().handler().handle(request),
                        () -> "Handler for " + found.route() + " returned no future");
            }
        }
        countDispatch(verb.map(HttpVerb::name).orElse(null), false);
        log.debug("No route for {} {}", method, path);
        return CompletableFuture.completedFuture(RouteResponse.routeNotFound());
    }

    private Optional<RouteMatch> find(HttpVerb method, List<String> segments) {
        List<Route> snapshot = table;
        for (Route route : snapshot) {
            if (route.method() == method && !route.pattern().hasParameter()) {
                Optional<Map<String, String>> parameters = route.pattern().match(segments);
                if (parameters.isPresent()) {
                    return Optional.of(new RouteMatch(route, parameters.get()));
                }
            }
        }
        for (Route route : snapshot) {
            if (route.method() == method && route.pattern().hasParameter()) {
                Optional<Map<String, String>> parameters = route.pattern().match(segments);
                if (parameters.isPresent()) {
                    return Optional.of(new RouteMatch(route, parameters.get()));
                }
            }
        }
        return Optional.empty();
    }

    private void countDispatch(String method, boolean matched) {
        if (metrics == null) {
            return;
        }
        if (matched) {
            metrics.recordMatched(method);
        } else {
            metrics.recordNotFound(method);
        }
    }

    private record RouteKey(HttpVerb method, String patternKey) {}

    private record Route(HttpVerb method, PathPattern pattern, RouteHandler handler) {
        @Override
        public String toString() {
            return method + " " + pattern;
        }
    }

    private record RouteMatch(Route route, Map<String, String> parameters) {}
}
