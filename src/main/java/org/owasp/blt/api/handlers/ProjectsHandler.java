package org.owasp.blt.api.handlers;

import com.google.gson.JsonArray;
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
 * Projects and their contributors.
 */
public class ProjectsHandler {

    private final BltClient client;

    public ProjectsHandler(BltClient client) {
        this.client = client;
    }

    /**
     * GET /projects. Accepts {@code ?search=} or {@code ?q=}. Besides the usual page shapes the upstream
     * may answer with {@code {"projects": [...], "count": n}}.
     */
    public ApiResponse list(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        String search = context.getQueryParams().getOrDefault("search", context.queryParam("q"));

        UpstreamResult result = client.getProjects(pagination.getPage(), pagination.getPerPage(), search);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch projects");
        }

        JsonElement data = result.getData();
        if (data.isJsonObject() && data.getAsJsonObject().has("projects")) {
            JsonObject listing = data.getAsJsonObject();
            JsonElement projects = listing.get("projects");
            JsonElement count = listing.get("count");
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("data", projects);
            if (count != null && !count.isJsonNull()) {
                body.put("count", count);
            } else {
                body.put("count", projects.isJsonArray() ? projects.getAsJsonArray().size() : 0);
            }
            return ApiResponse.ok(body);
        }
        return UpstreamPages.page(result, pagination, Collections.emptyMap());
    }

    /** GET /projects/{id} */
    public ApiResponse get(HandlerContext context) {
        String projectId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(projectId)) {
            return ApiResponse.badRequest("Invalid project ID");
        }

        UpstreamResult result = client.getProject(Long.parseLong(projectId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Project not found");
        }
        return UpstreamPages.single(result);
    }

    /** GET /projects/{id}/contributors, read off the project record. */
    public ApiResponse contributors(HandlerContext context) {
        String projectId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(projectId)) {
            return ApiResponse.badRequest("Invalid project ID");
        }

        UpstreamResult result = client.getProject(Long.parseLong(projectId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Project not found");
        }

        JsonElement data = result.getData();
        JsonArray contributors = new JsonArray();
        if (data.isJsonObject() && data.getAsJsonObject().has("contributors")
                && data.getAsJsonObject().get("contributors").isJsonArray()) {
            contributors = data.getAsJsonObject().getAsJsonArray("contributors");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("project_id", Long.parseLong(projectId));
        body.put("data", contributors);
        body.put("count", contributors.size());
        return ApiResponse.ok(body);
    }
}
