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
 * Organizations, their repositories and their projects.
 */
public class OrganizationsHandler {

    private final BltClient client;

    public OrganizationsHandler(BltClient client) {
        this.client = client;
    }

    /** GET /organizations. Accepts {@code ?search=} or {@code ?q=}. */
    public ApiResponse list(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        String search = context.getQueryParams().getOrDefault("search", context.queryParam("q"));

        UpstreamResult result = client.getOrganizations(pagination.getPage(), pagination.getPerPage(), search);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch organizations");
        }
        return UpstreamPages.page(result, pagination, Collections.emptyMap());
    }

    /** GET /organizations/{id} */
    public ApiResponse get(HandlerContext context) {
        String orgId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(orgId)) {
            return ApiResponse.badRequest("Invalid organization ID");
        }

        UpstreamResult result = client.getOrganization(Long.parseLong(orgId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Organization not found");
        }
        return UpstreamPages.single(result);
    }

    /** GET /organizations/{id}/repos */
    public ApiResponse repos(HandlerContext context) {
        String orgId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(orgId)) {
            return ApiResponse.badRequest("Invalid organization ID");
        }

        UpstreamResult result = client.getOrganizationRepos(Long.parseLong(orgId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch organization repositories");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("organization_id", Long.parseLong(orgId));
        body.put("data", result.getData());
        return ApiResponse.ok(body);
    }

    /**
     * GET /organizations/{id}/projects. The upstream cannot filter projects by organization, so a
     * {@code {"projects": [...]}} listing is filtered here on each project's {@code organization}.
     */
    public ApiResponse projects(HandlerContext context) {
        String orgId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(orgId)) {
            return ApiResponse.badRequest("Invalid organization ID");
        }

        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getProjects(pagination.getPage(), pagination.getPerPage(), null);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch organization projects");
        }

        JsonElement data = result.getData();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("organization_id", Long.parseLong(orgId));

        if (data.isJsonObject() && data.getAsJsonObject().has("projects")
                && data.getAsJsonObject().get("projects").isJsonArray()) {
            JsonArray owned = new JsonArray();
            for (JsonElement project : data.getAsJsonObject().getAsJsonArray("projects")) {
                if (belongsTo(project, orgId)) {
                    owned.add(project);
                }
            }
            body.put("data", owned);
            body.put("count", owned.size());
            return ApiResponse.ok(body);
        }

        body.put("data", data);
        return ApiResponse.ok(body);
    }

    private static boolean belongsTo(JsonElement project, String orgId) {
        if (!project.isJsonObject()) {
            return false;
        }
        JsonElement organization = project.getAsJsonObject().get("organization");
        return organization != null && organization.isJsonPrimitive() && orgId.equals(organization.getAsString());
    }
}
