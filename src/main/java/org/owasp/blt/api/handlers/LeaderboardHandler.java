package org.owasp.blt.api.handlers;

import com.google.gson.JsonElement;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.rest.Pagination;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global, monthly and organization leaderboards.
 */
public class LeaderboardHandler {

    private final BltClient client;

    public LeaderboardHandler(BltClient client) {
        this.client = client;
    }

    /** GET /leaderboard */
    public ApiResponse global(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getLeaderboard(pagination.getPage(), pagination.getPerPage(), null, null, false);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch leaderboard");
        }
        return UpstreamPages.page(result, pagination, Map.of("type", "global"));
    }

    /** GET /leaderboard/organizations */
    public ApiResponse organizations(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getLeaderboard(pagination.getPage(), pagination.getPerPage(), null, null, true);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch organization leaderboard");
        }
        return UpstreamPages.page(result, pagination, Map.of("type", "organizations"));
    }

    /**
     * GET /leaderboard/monthly. Optional {@code month} (1-12) and {@code year} (2000-2100).
     */
    public ApiResponse monthly(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());

        Integer month = null;
        String rawMonth = context.queryParam("month");
        if (rawMonth != null && !rawMonth.isEmpty()) {
            try {
                month = Integer.parseInt(rawMonth);
            } catch (NumberFormatException e) {
                return ApiResponse.badRequest("Invalid month format");
            }
            if (month < 1 || month > 12) {
                return ApiResponse.badRequest("Month must be between 1 and 12");
            }
        }

        Integer year = null;
        String rawYear = context.queryParam("year");
        if (rawYear != null && !rawYear.isEmpty()) {
            try {
                year = Integer.parseInt(rawYear);
            } catch (NumberFormatException e) {
                return ApiResponse.badRequest("Invalid year format");
            }
            if (year < 2000 || year > 2100) {
                return ApiResponse.badRequest("Invalid year");
            }
        }

        UpstreamResult result = client.getLeaderboard(pagination.getPage(), pagination.getPerPage(), month, year, false);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch monthly leaderboard");
        }

        JsonElement data = result.getData();
        if (data.isJsonObject() && data.getAsJsonObject().has("results")) {
            data = data.getAsJsonObject().get("results");
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("page", pagination.getPage());
        meta.put("per_page", pagination.getPerPage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("type", "monthly");
        body.put("month", month);
        body.put("year", year);
        body.put("data", data);
        body.put("pagination", meta);
        return ApiResponse.ok(body);
    }
}
