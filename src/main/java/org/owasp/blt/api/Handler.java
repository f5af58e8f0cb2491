package org.owasp.blt.api;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import org.owasp.blt.api.pojos.RequestEvent;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.RestRouter;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.GatewayEnvironment;
import org.owasp.blt.api.services.LoggingService;

import java.util.Map;

/**
 * Lambda Function URL entry point.
 *
 * The environment, upstream client and route table are built once per container and shared by
 * every invocation it serves.
 */
public class Handler implements RequestHandler<RequestEvent, Map<String, Object>> {

    private final GatewayEnvironment environment;
    private final RestRouter router;

    public Handler() {
        this(GatewayEnvironment.load());
    }

    Handler(GatewayEnvironment environment) {
        this(environment, ApiRoutes.build(new BltClient(environment)));
    }

    Handler(GatewayEnvironment environment, RestRouter router) {
        this.environment = environment;
        this.router = router;
        LoggingService.info("gateway_initialized", LoggingService.data(
                "routes", router.routes().size(),
                "upstream", environment.getApiBaseUrl()));
    }

    @Override
    public Map<String, Object> handleRequest(RequestEvent event, Context context) {
        LoggingService.initRequest(context);
        try {
            return handle(event).toLambdaResponse();
        } finally {
            LoggingService.clearContext();
        }
    }

    ApiResponse handle(RequestEvent event) {
        try {
            // CORS preflight never reaches the router
            if ("OPTIONS".equalsIgnoreCase(event.getMethod())) {
                return ApiResponse.options();
            }
            return router.handle(event, environment);
        } catch (Exception e) {
            LoggingService.error("gateway_unhandled_exception", e);
            return ApiResponse.internalError("Internal Server Error: " + e.getMessage());
        }
    }
}
