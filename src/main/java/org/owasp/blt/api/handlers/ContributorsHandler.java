package org.owasp.blt.api.handlers;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.rest.Pagination;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Project contributors, proxied from the upstream {@code contributors/} listing.
 */
public class ContributorsHandler {

    private final BltClient client;

    public ContributorsHandler(BltClient client) {
        this.client = client;
    }

    /** GET /contributors */
    public ApiResponse list(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getContributors(pagination.getPage(), pagination.getPerPage());
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch contributors");
        }
        return UpstreamPages.page(result, pagination, Collections.emptyMap());
    }

    /**
     * GET /contributors/{id}. The upstream has no single-contributor endpoint, so the first page of the
     * listing is searched by {@code id} or {@code github_id}.
     */
    public ApiResponse get(HandlerContext context) {
        String contributorId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(contributorId)) {
            return ApiResponse.badRequest("Invalid contributor ID");
        }

        UpstreamResult result = client.getContributors(Pagination.DEFAULT_PAGE, Pagination.DEFAULT_PER_PAGE);
        if (result.isError()) {
            return UpstreamPages.error(result, "Contributor not found");
        }

        if (result.getData().isJsonArray()) {
            for (JsonElement element : result.getData().getAsJsonArray()) {
                if (element.isJsonObject() && matchesId(element.getAsJsonObject(), contributorId)) {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", true);
                    body.put("data", element);
                    return ApiResponse.ok(body);
                }
            }
        }
        return ApiResponse.notFound("Contributor not found");
    }

    private static boolean matchesId(JsonObject contributor, String id) {
        return id.equals(asText(contributor.get("id"))) || id.equals(asText(contributor.get("github_id")));
    }

    private static String asText(JsonElement value) {
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }
}
