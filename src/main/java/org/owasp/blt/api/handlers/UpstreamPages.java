package org.owasp.blt.api.handlers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.Pagination;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared conversion from upstream results to response envelopes.
 */
final class UpstreamPages {

    private UpstreamPages() {
    }

    static ApiResponse error(UpstreamResult result, String fallbackMessage) {
        String message = result.getMessage() != null ? result.getMessage() : fallbackMessage;
        int status = result.getStatus() > 0 ? result.getStatus() : 500;
        return ApiResponse.error(message, status);
    }

    /**
     * Upstream pages come in three shapes: a paginated object with {@code results}, a bare list, or
     * anything else, which is passed through as {@code data}.
     *
     * @param extra fields placed between {@code success} and {@code data}, e.g. {@code type}
     */
    static ApiResponse page(UpstreamResult result, Pagination pagination, Map<String, Object> extra) {
        JsonElement data = result.getData();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.putAll(extra);

        if (data.isJsonObject() && data.getAsJsonObject().has("results")) {
            JsonObject page = data.getAsJsonObject();
            JsonElement results = page.get("results");
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("page", pagination.getPage());
            meta.put("per_page", pagination.getPerPage());
            meta.put("count", results.isJsonArray() ? results.getAsJsonArray().size() : 0);
            meta.put("total", orNull(page, "count"));
            meta.put("next", orNull(page, "next"));
            meta.put("previous", orNull(page, "previous"));
            body.put("data", results);
            body.put("pagination", meta);
            return ApiResponse.ok(body);
        }

        if (data.isJsonArray()) {
            JsonArray items = data.getAsJsonArray();
            if (extra.isEmpty()) {
                return ApiResponse.paginated(items.asList(), pagination.getPage(), pagination.getPerPage(), null);
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("page", pagination.getPage());
            meta.put("per_page", pagination.getPerPage());
            meta.put("count", items.size());
            body.put("data", items);
            body.put("pagination", meta);
            return ApiResponse.ok(body);
        }

        body.put("data", data);
        return ApiResponse.ok(body);
    }

    /** {@code {"success": true, "data": ...}} for a single upstream resource. */
    static ApiResponse single(UpstreamResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", result.getData());
        return ApiResponse.ok(body);
    }

    /** ASCII digits only, short enough to fit a long. */
    static boolean isNumeric(String value) {
        return value != null && !value.isEmpty() && value.length() <= 18
                && value.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static JsonElement orNull(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null ? value : JsonNull.INSTANCE;
    }
}
