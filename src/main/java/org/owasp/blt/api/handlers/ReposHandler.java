package org.owasp.blt.api.handlers;

import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Repositories. The upstream only exposes them per organization.
 */
public class ReposHandler {

    private final BltClient client;

    public ReposHandler(BltClient client) {
        this.client = client;
    }

    /** GET /repos, proxied only when {@code ?organization=<id>} is given. */
    public ApiResponse list(HandlerContext context) {
        String organizationId = context.queryParam("organization");
        if (UpstreamPages.isNumeric(organizationId)) {
            UpstreamResult result = client.getOrganizationRepos(Long.parseLong(organizationId));
            if (result.isError()) {
                return UpstreamPages.error(result, "Failed to fetch repositories");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("organization_id", Long.parseLong(organizationId));
            body.put("data", result.getData());
            body.put("count", result.getData().isJsonArray() ? result.getData().getAsJsonArray().size() : 0);
            return ApiResponse.ok(body);
        }

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("organization_repos", "/organizations/{id}/repos");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Repository listing");
        body.put("info", "Use ?organization={id} to get repositories for a specific organization");
        body.put("endpoints", endpoints);
        return ApiResponse.ok(body);
    }

    /** GET /repos/{id} */
    public ApiResponse get(HandlerContext context) {
        String repoId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(repoId)) {
            return ApiResponse.badRequest("Invalid repository ID");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", Long.parseLong(repoId));
        data.put("note", "Direct repository lookup may require organization context");
        return ApiResponse.success(data, "Repository details endpoint", 200);
    }
}
