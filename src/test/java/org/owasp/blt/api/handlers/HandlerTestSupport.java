package org.owasp.blt.api.handlers;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.services.GatewayEnvironment;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Map;

/**
 * Builders shared by the handler tests.
 */
final class HandlerTestSupport {

    private HandlerTestSupport() {
    }

    static HandlerContext context(String path, Map<String, String> pathParams, Map<String, String> queryParams) {
        return new HandlerContext(null, GatewayEnvironment.of(Map.of()), pathParams, queryParams, path);
    }

    static UpstreamResult ok(String json) {
        return UpstreamResult.success(200, JsonParser.parseString(json));
    }

    static JsonObject body(ApiResponse response) {
        return JsonParser.parseString(response.getBody()).getAsJsonObject();
    }
}
