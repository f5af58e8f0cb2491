package org.owasp.blt.api.handlers;

import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.rest.Pagination;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.HuntFilter;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Bug hunts: listing, single hunt, and the active/previous/upcoming views.
 */
public class HuntsHandler {

    private final BltClient client;

    public HuntsHandler(BltClient client) {
        this.client = client;
    }

    /**
     * GET /hunts. Accepts {@code ?active=true}, {@code ?previous=true} or {@code ?upcoming=true};
     * the first one set wins.
     */
    public ApiResponse list(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        HuntFilter filter = HuntFilter.ALL;
        if ("true".equals(context.queryParam("active"))) {
            filter = HuntFilter.ACTIVE;
        } else if ("true".equals(context.queryParam("previous"))) {
            filter = HuntFilter.PREVIOUS;
        } else if ("true".equals(context.queryParam("upcoming"))) {
            filter = HuntFilter.UPCOMING;
        }

        UpstreamResult result = client.getHunts(pagination.getPage(), pagination.getPerPage(), filter);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch hunts");
        }
        return UpstreamPages.page(result, pagination, Collections.emptyMap());
    }

    /** GET /hunts/{id} */
    public ApiResponse get(HandlerContext context) {
        String huntId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(huntId)) {
            return ApiResponse.badRequest("Invalid hunt ID");
        }

        UpstreamResult result = client.getHunt(Long.parseLong(huntId));
        if (result.isError()) {
            return UpstreamPages.error(result, "Hunt not found");
        }
        return UpstreamPages.single(result);
    }

    public ApiResponse active(HandlerContext context) {
        return filtered(HuntFilter.ACTIVE);
    }

    public ApiResponse previous(HandlerContext context) {
        return filtered(HuntFilter.PREVIOUS);
    }

    public ApiResponse upcoming(HandlerContext context) {
        return filtered(HuntFilter.UPCOMING);
    }

    private ApiResponse filtered(HuntFilter filter) {
        String name = filter.name().toLowerCase(Locale.ROOT);
        UpstreamResult result = client.getHunts(Pagination.DEFAULT_PAGE, Pagination.DEFAULT_PER_PAGE, filter);
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch " + name + " hunts");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("filter", name);
        body.put("data", result.getData());
        return ApiResponse.ok(body);
    }
}
