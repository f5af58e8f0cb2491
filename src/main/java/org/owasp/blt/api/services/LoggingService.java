package org.owasp.blt.api.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging facade for CloudWatch Logs Insights.
 *
 * Messages are short snake_case event names; request-scoped values live in the ThreadContext
 * so every line of one invocation carries them.
 *
 * <pre>
 * -- All upstream failures for one route
 * fields @timestamp, message, route, data
 * | filter message like /upstream_.*_failed/ and route = "GET /hunts/{id}"
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_ROUTE = "route";
    public static final String KEY_DATA = "data";

    /**
     * Initialize logging context with Lambda request information.
     * Call this at the start of every Lambda invocation.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null && context.getAwsRequestId() != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    /**
     * Set the matched route, e.g. {@code "GET /hunts/{id}"}.
     */
    public static void setRoute(String route) {
        if (route != null) {
            ThreadContext.put(KEY_ROUTE, route);
        }
    }

    /**
     * Clear all logging context. Call at the end of request processing.
     */
    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message) {
        logger.error(message);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Operation Timing
    // =========================================================================

    /**
     * Log the start of an operation. Returns start time for use with logOperationEnd.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        debug(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", duration);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        long duration = System.currentTimeMillis() - startTime;
        error(operation + "_failed", t, data("durationMs", duration));
    }

    public static void logOperationFailed(String operation, long startTime, String errorMessage) {
        long duration = System.currentTimeMillis() - startTime;
        warn(operation + "_failed", data("durationMs", duration, "errorMessage", errorMessage));
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Create a mutable map with the given key-value pairs.
     * Convenience method for creating log data.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
