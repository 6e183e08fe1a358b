package com.keystone.apiserver.infrastructure.web;

import com.keystone.observability.RequestContext;
import com.keystone.observability.RequestContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a request id for every HTTP request.
 *
 * <p>An {@code X-Request-ID} sent by the client is reused; otherwise a UUID is generated. The id is
 * installed in {@link RequestContextHolder} (and so in the SLF4J MDC) while the request is served,
 * and echoed on the response.
 *
 * <p>Handlers complete asynchronously, so the response is written on an async dispatch. The filter
 * runs for that dispatch too and restores the id from a request attribute; a new id is never
 * minted for the same request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        RequestContextHolder.set(
                new RequestContext(requestId, request.getMethod(), request.getRequestURI()));
        if (!response.isCommitted()) {
            response.setHeader(REQUEST_ID_HEADER, requestId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Servlet threads are pooled.
            RequestContextHolder.clear();
        }
    }

    private static String resolveRequestId(HttpServletRequest request) {
        Object existing = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        if (existing instanceof String id && !id.isBlank()) {
            return id;
        }
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
