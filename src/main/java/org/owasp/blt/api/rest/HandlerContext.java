package org.owasp.blt.api.rest;

import org.owasp.blt.api.pojos.RequestEvent;
import org.owasp.blt.api.services.GatewayEnvironment;

import java.util.Collections;
import java.util.Map;

/**
 * Everything a route handler receives for one request. Built fresh per request and discarded afterwards.
 */
public class HandlerContext {

    private final RequestEvent request;
    private final GatewayEnvironment environment;
    private final Map<String, String> pathParams;
    private final Map<String, String> queryParams;
    private final String path;

    public HandlerContext(RequestEvent request, GatewayEnvironment environment,
                          Map<String, String> pathParams, Map<String, String> queryParams, String path) {
        this.request = request;
        this.environment = environment;
        this.pathParams = Collections.unmodifiableMap(pathParams);
        this.queryParams = Collections.unmodifiableMap(queryParams);
        this.path = path;
    }

    /** The raw event, may be null when dispatching outside Lambda. */
    public RequestEvent getRequest() {
        return request;
    }

    public GatewayEnvironment getEnvironment() {
        return environment;
    }

    public Map<String, String> getPathParams() {
        return pathParams;
    }

    public String pathParam(String name) {
        return pathParams.get(name);
    }

    public Map<String, String> getQueryParams() {
        return queryParams;
    }

    public String queryParam(String name) {
        return queryParams.get(name);
    }

    public String getPath() {
        return path;
    }
}
