package org.owasp.blt.api.rest;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An HTTP method and compiled template bound to a handler. Immutable.
 */
public final class Route {

    private final String method;
    private final RoutePattern pattern;
    private final RouteHandler handler;

    public Route(String method, String pathTemplate, RouteHandler handler) {
        if (method == null || method.isBlank()) {
            throw new PatternException("HTTP method must not be empty for route template: " + pathTemplate);
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null for route " + method + " " + pathTemplate);
        }
        this.method = method.toUpperCase(Locale.ROOT);
        this.pattern = RoutePattern.compile(pathTemplate);
        this.handler = handler;
    }

    /**
     * @return captured path params (present but empty for literal routes), or empty if method or path differ
     */
    public Optional<Map<String, String>> matches(String method, String path) {
        if (method == null || !this.method.equals(method.toUpperCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.ofNullable(pattern.match(path));
    }

    public SpecificityKey specificity() {
        return pattern.getSpecificity();
    }

    public String getMethod() {
        return method;
    }

    public String getTemplate() {
        return pattern.getTemplate();
    }

    public RouteHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return method + " " + pattern.getTemplate();
    }
}
