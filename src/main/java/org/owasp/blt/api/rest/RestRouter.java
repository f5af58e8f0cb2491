package org.owasp.blt.api.rest;

import org.owasp.blt.api.pojos.RequestEvent;
import org.owasp.blt.api.services.GatewayEnvironment;
import org.owasp.blt.api.services.LoggingService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST router that maps HTTP method + path to route handlers.
 *
 * <p>The route table is kept sorted by {@link SpecificityKey} after every registration, so a literal
 * template such as {@code /bugs/search} is always tried before {@code /bugs/{id}} regardless of the order
 * the two were added in. Routes with equal keys keep their registration order.
 *
 * <p>Registration is expected to finish before the first request. Each registration publishes a new
 * immutable snapshot, so dispatching from several threads needs no locking.
 */
public class RestRouter {

    private static final Comparator<Route> BY_SPECIFICITY = Comparator.comparing(Route::specificity);

    private volatile List<Route> routes = Collections.emptyList();

    /**
     * Compile and register a route, then re-sort the table.
     *
     * @throws PatternException if the template is malformed
     */
    public synchronized void addRoute(String method, String pathTemplate, RouteHandler handler) {
        Route route = new Route(method, pathTemplate, handler);
        List<Route> table = new ArrayList<>(routes);
        table.add(route);
        // List.sort is stable: equal keys stay in insertion order
        table.sort(BY_SPECIFICITY);
        routes = Collections.unmodifiableList(table);
        LoggingService.debug("route_registered",
                LoggingService.data("route", route.toString(), "specificity", route.specificity().toString()));
    }

    /** Current route table in match order. */
    public List<Route> routes() {
        return routes;
    }

    /**
     * Find the first route, in table order, matching the method and an already-normalized path.
     */
    public RouteMatch dispatch(String method, String path) throws RouteNotFoundException {
        for (Route route : routes) {
            Optional<Map<String, String>> params = route.matches(method, path);
            if (params.isPresent()) {
                return new RouteMatch(route, params.get());
            }
        }
        throw new RouteNotFoundException(method, path);
    }

    public ApiResponse handle(RequestEvent event, GatewayEnvironment environment) {
        return handle(event.getMethod(), event.getUrl(), event, environment);
    }

    /**
     * Route a raw request and run its handler. Never throws: a miss becomes a 404 envelope and a
     * handler failure becomes a 500 envelope.
     */
    public ApiResponse handle(String method, String url, RequestEvent request, GatewayEnvironment environment) {
        String normalizedMethod = method == null ? "" : method.toUpperCase(Locale.ROOT);
        String path = parsePath(url);
        Map<String, String> queryParams = parseQueryParams(url);

        RouteMatch match;
        try {
            match = dispatch(normalizedMethod, path);
        } catch (RouteNotFoundException e) {
            LoggingService.info("route_not_found", LoggingService.data("method", normalizedMethod, "path", path));
            return ApiResponse.notFound(e.getMessage());
        }

        LoggingService.setRoute(match.getRoute().toString());
        HandlerContext context = new HandlerContext(request, environment, match.getPathParams(), queryParams, path);
        try {
            ApiResponse response = match.getHandler().handle(context);
            if (response == null) {
                LoggingService.error("rest_handler_null_response");
                return ApiResponse.internalError("Handler error: No response from handler");
            }
            return response;
        } catch (Exception e) {
            LoggingService.error("rest_handler_exception", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ApiResponse.internalError("Handler error: " + message);
        }
    }

    // ============= Route Helpers =============

    public RestRouter get(String pathPattern, RouteHandler handler) {
        addRoute("GET", pathPattern, handler);
        return this;
    }

    public RestRouter post(String pathPattern, RouteHandler handler) {
        addRoute("POST", pathPattern, handler);
        return this;
    }

    public RestRouter put(String pathPattern, RouteHandler handler) {
        addRoute("PUT", pathPattern, handler);
        return this;
    }

    public RestRouter delete(String pathPattern, RouteHandler handler) {
        addRoute("DELETE", pathPattern, handler);
        return this;
    }

    // ============= URL Decomposition =============

    /**
     * Path component of a URL: scheme and host dropped, query string dropped, leading slash ensured,
     * trailing slash removed except for the root path.
     */
    static String parsePath(String url) {
        if (url == null || url.isEmpty()) {
            return "/";
        }
        String path;
        if (url.startsWith("http://") || url.startsWith("https://")) {
            String[] parts = url.split("/", 4);
            path = parts.length >= 4 ? "/" + stripQuery(parts[3]) : "/";
        } else {
            path = stripQuery(url);
        }

        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        if (!path.equals("/") && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    /**
     * Flat {@code key=value} pairs after the first {@code ?}. Later duplicates win, pairs without
     * {@code =} are dropped, values are passed through without percent-decoding.
     */
    static Map<String, String> parseQueryParams(String url) {
        Map<String, String> params = new HashMap<>();
        if (url == null) return params;
        int q = url.indexOf('?');
        if (q < 0) return params;

        for (String pair : url.substring(q + 1).split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) continue;
            params.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return params;
    }

    private static String stripQuery(String s) {
        int q = s.indexOf('?');
        return q < 0 ? s : s.substring(0, q);
    }
}
