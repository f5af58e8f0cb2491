package org.owasp.blt.api.rest;

import java.util.Collections;
import java.util.Map;

/**
 * Result of a successful dispatch: the selected route and the parameters it captured.
 */
public final class RouteMatch {

    private final Route route;
    private final Map<String, String> pathParams;

    RouteMatch(Route route, Map<String, String> pathParams) {
        this.route = route;
        this.pathParams = Collections.unmodifiableMap(pathParams);
    }

    public Route getRoute() {
        return route;
    }

    public RouteHandler getHandler() {
        return route.getHandler();
    }

    public Map<String, String> getPathParams() {
        return pathParams;
    }
}
