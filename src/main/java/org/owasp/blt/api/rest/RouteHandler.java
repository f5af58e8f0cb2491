package org.owasp.blt.api.rest;

/**
 * Resource logic bound to a route. Any exception thrown here becomes a 500 response.
 */
@FunctionalInterface
public interface RouteHandler {
    ApiResponse handle(HandlerContext context) throws Exception;
}
