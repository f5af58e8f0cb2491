package org.owasp.blt.api.handlers;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Platform-wide counters, proxied from the upstream {@code stats/} endpoint.
 */
public class StatsHandler {

    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        DESCRIPTIONS.put("bugs", "Total number of bugs reported");
        DESCRIPTIONS.put("users", "Total number of registered users");
        DESCRIPTIONS.put("hunts", "Total number of bug hunts");
        DESCRIPTIONS.put("domains", "Total number of tracked domains");
    }

    private final BltClient client;

    public StatsHandler(BltClient client) {
        this.client = client;
    }

    public ApiResponse stats(HandlerContext context) {
        UpstreamResult result = client.getStats();
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch statistics");
        }

        JsonObject upstream = result.getData().isJsonObject() ? result.getData().getAsJsonObject() : new JsonObject();
        Map<String, Object> counts = new LinkedHashMap<>();
        for (String key : DESCRIPTIONS.keySet()) {
            JsonElement value = upstream.get(key);
            counts.put(key, value != null && !value.isJsonNull() ? value : 0);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", counts);
        body.put("description", DESCRIPTIONS);
        return ApiResponse.ok(body);
    }
}
