package com.keystone.apiserver.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A compiled route path such as {@code /api/v1/users/:id}.
 *
 * <p>Matching rules:
 *
 * <ul>
 *   <li>literal segments compare case-insensitively
 *   <li>a segment written {@code :name} captures any non-empty segment; a pattern holds at most one
 *   <li>a single trailing slash is ignored on both the pattern and the path
 * </ul>
 */
public final class PathPattern {

    private final String source;
    private final List<String> segments;
    private final int parameterIndex;
    private final String parameterName;

    private PathPattern(String source, List<String> segments, int parameterIndex, String parameterName) {
        this.source = source;
        this.segments = segments;
        this.parameterIndex = parameterIndex;
        this.parameterName = parameterName;
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern absolute path pattern, e.g. {@code /} or {@code /users/:id}
     * @return the compiled pattern
     * @throws IllegalArgumentException if the pattern is not absolute, has an unnamed parameter, or
     *     has more than one parameter segment
     */
    public static PathPattern compile(String pattern) {
        if (pattern == null || !pattern.startsWith("/")) {
            throw new IllegalArgumentException("Path pattern must start with '/': " + pattern);
        }
        List<String> segments = split(pattern);
        int parameterIndex = -1;
        String parameterName = null;
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (!segment.startsWith(":")) {
                continue;
            }
            if (parameterIndex >= 0) {
                throw new IllegalArgumentException(
                        "Path pattern supports a single parameter segment: " + pattern);
            }
            if (segment.length() == 1) {
                throw new IllegalArgumentException("Path parameter must be named: " + pattern);
            }
            parameterIndex = i;
            parameterName = segment.substring(1);
        }
        return new PathPattern(pattern, segments, parameterIndex, parameterName);
    }

    /**
     * Splits a request path into segments. {@code "/"} and {@code ""} have none; {@code "//"} has
     * two empty ones.
     */
    static List<String> split(String path) {
        String trimmed = path == null ? "" : path;
        if (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        // a trailing slash is dropped only after a real segment
        if (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(trimmed.split("/", -1));
    }

    /**
     * Matches already-split path segments.
     *
     * @return the captured parameter (empty map for parameterless patterns), or empty if the path
     *     does not match
     */
    public Optional<Map<String, String>> match(List<String> pathSegments) {
        if (pathSegments.size() != segments.size()) {
            return Optional.empty();
        }
        for (int i = 0; i < segments.size(); i++) {
            String actual = pathSegments.get(i);
            if (i == parameterIndex) {
                if (actual.isEmpty()) {
                    return Optional.empty();
                }
            } else if (!segments.get(i).equalsIgnoreCase(actual)) {
                return Optional.empty();
            }
        }
        if (parameterIndex < 0) {
            return Optional.of(Map.of());
        }
        return Optional.of(Map.of(parameterName, pathSegments.get(parameterIndex)));
    }

    /** Convenience overload of {@link #match(List)} for a raw path. */
    public Optional<Map<String, String>> match(String path) {
        return match(split(path));
    }

    /**
     * Identity of the pattern for duplicate detection: literal segments lower-cased, the parameter
     * segment reduced to {@code :}. {@code /Users/:id/} and {@code /users/:userId} share a key.
     */
    public String key() {
        List<String> normalized = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            normalized.add(i == parameterIndex ? ":" : segments.get(i).toLowerCase(Locale.ROOT));
        }
        return "/" + String.join("/", normalized);
    }

    public boolean hasParameter() {
        return parameterIndex >= 0;
    }

    /** The parameter name, or {@code null} for parameterless patterns. */
    public String parameterName() {
        return parameterName;
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
