package com.keystone.apiserver.infrastructure.web;

import com.keystone.apiserver.routing.RouteResponse;
import com.keystone.apiserver.routing.Router;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UrlPathHelper;

/**
 * Bridges Spring MVC into the {@link Router}.
 *
 * <p>Mapped to {@code /**} for every method, so any request not claimed by a more specific
 * mapping (actuator endpoints) reaches the router, and the router alone decides between a handler
 * and its 404. The methods are listed explicitly; a mapping without methods never matches
 * {@code OPTIONS}, which Spring MVC would then answer itself. The handler's future is returned to
 * Spring MVC as an async result.
 */
@RestController
public class RouterDispatchController {

    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final Router router;

    public RouterDispatchController(Router router) {
        this.router = router;
    }

    @RequestMapping(
            value = "/**",
            method = {
                RequestMethod.GET,
                RequestMethod.HEAD,
                RequestMethod.POST,
                RequestMethod.PUT,
                RequestMethod.PATCH,
                RequestMethod.DELETE,
                RequestMethod.OPTIONS
            })
    public CompletableFuture<ResponseEntity<Object>> dispatch(
            HttpServletRequest request, @RequestBody(required = false) String body) {
        String path = PATH_HELPER.getPathWithinApplication(request);
        return router.dispatch(request.getMethod(), path, queryParameters(request), body)
                .thenApply(RouterDispatchController::toResponseEntity);
    }

    private static ResponseEntity<Object> toResponseEntity(RouteResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.status());
        if (response.body() == null) {
            return builder.build();
        }
        return builder.contentType(MediaType.APPLICATION_JSON).body(response.body());
    }

    private static Map<String, String> queryParameters(HttpServletRequest request) {
        Map<String, String> parameters = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values.length > 0 && values[0] != null) {
                parameters.put(name, values[0]);
            }
        });
        return parameters;
    }
}
