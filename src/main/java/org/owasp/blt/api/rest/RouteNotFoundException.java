package org.owasp.blt.api.rest;

/**
 * No registered route matches the request method and path.
 */
public class RouteNotFoundException extends Exception {

    private final String method;
    private final String path;

    public RouteNotFoundException(String method, String path) {
        super("Not Found: " + method + " " + path);
        this.method = method;
        this.path = path;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }
}
