package org.owasp.blt.api.handlers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.rest.Pagination;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Domains and their nested views: tags and reported issues.
 */
public class DomainsHandler {

    private final BltClient client;

    public DomainsHandler(BltClient client) {
        this.client = client;
    }

    /** GET /domains */
    public ApiResponse list(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getDomains(pagination.getPage(), pagination.getPerPage());
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch domains");
        }
        return UpstreamPages.page(result, pagination, Collections.emptyMap());
    }

    /** GET /domains/{id} */
    public ApiResponse get(HandlerContext context) {
        String domainId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(domainId)) {
            return ApiResponse.badRequest("Invalid domain ID");
        }

        UpstreamResult result = client.getDomain(Long.parseLong(domainId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Domain not found");
        }
        return UpstreamPages.single(result);
    }

    /**
     * GET /domains/{id}/tags. The upstream has no tags endpoint; tags are read off the domain record.
     */
    public ApiResponse tags(HandlerContext context) {
        String domainId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(domainId)) {
            return ApiResponse.badRequest("Invalid domain ID");
        }

        UpstreamResult result = client.getDomain(Long.parseLong(domainId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Domain not found");
        }

        JsonElement data = result.getData();
        JsonArray tags = new JsonArray();
        if (data.isJsonObject() && data.getAsJsonObject().has("tags")
                && data.getAsJsonObject().get("tags").isJsonArray()) {
            tags = data.getAsJsonObject().getAsJsonArray("tags");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("domain_id", Long.parseLong(domainId));
        body.put("data", tags);
        body.put("count", tags.size());
        return ApiResponse.ok(body);
    }

    /** GET /domains/{id}/issues, paginated. */
    public ApiResponse issues(HandlerContext context) {
        String domainId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(domainId)) {
            return ApiResponse.badRequest("Invalid domain ID");
        }

        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getIssues(pagination.getPage(), pagination.getPerPage(), null, domainId, null);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch domain issues");
        }
        return UpstreamPages.page(result, pagination, Map.of("domain_id", Long.parseLong(domainId)));
    }
}
