package org.owasp.blt.api.rest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standardized API response wrapper for REST endpoints.
 * Produces Lambda Function URL structured responses with proper HTTP status codes and CORS headers.
 */
public class ApiResponse {

    private static final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    private static final Map<String, String> CORS_HEADERS;

    static {
        Map<String, String> cors = new LinkedHashMap<>();
        cors.put("Access-Control-Allow-Origin", "*");
        cors.put("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, OPTIONS");
        cors.put("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
        cors.put("Access-Control-Max-Age", "86400");
        CORS_HEADERS = Collections.unmodifiableMap(cors);
    }

    private final int statusCode;
    private final Map<String, String> headers;
    private final String body;

    ApiResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
        Map<String, String> h = new LinkedHashMap<>();
        h.put("Content-Type", "application/json");
        h.putAll(CORS_HEADERS);
        this.headers = Collections.unmodifiableMap(h);
    }

    /**
     * Convert to Lambda Function URL structured response format.
     * When a Lambda Function URL handler returns a Map with statusCode/headers/body,
     * Lambda uses those values instead of wrapping in 200.
     */
    public Map<String, Object> toLambdaResponse() {
        Map<String, Object> response = new HashMap<>();
        response.put("statusCode", statusCode);
        response.put("headers", headers);
        response.put("body", body);
        return response;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    // --- Factory Methods ---

    public static ApiResponse json(Object data, int status) {
        return new ApiResponse(status, gson.toJson(data));
    }

    public static ApiResponse ok(Object data) {
        return json(data, 200);
    }

    public static ApiResponse success(Object data, String message, int status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", message);
        if (data != null) {
            body.put("data", data);
        }
        return json(body, status);
    }

    public static ApiResponse paginated(List<?> items, int page, int perPage, Integer total) {
        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("page", page);
        pagination.put("per_page", perPage);
        pagination.put("count", items.size());
        if (total != null) {
            pagination.put("total", total);
            pagination.put("total_pages", (total + perPage - 1) / perPage);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", items);
        body.put("pagination", pagination);
        return json(body, 200);
    }

    public static ApiResponse error(String message, int status) {
        return error(message, status, null);
    }

    public static ApiResponse error(String message, int status, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", true);
        body.put("message", message);
        body.put("status", status);
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        return json(body, status);
    }

    public static ApiResponse badRequest(String message) {
        return error(message, 400);
    }

    public static ApiResponse notFound(String message) {
        return error(message, 404);
    }

    public static ApiResponse internalError(String message) {
        return error(message, 500);
    }

    public static ApiResponse options() {
        return new ApiResponse(204, "");
    }
}
