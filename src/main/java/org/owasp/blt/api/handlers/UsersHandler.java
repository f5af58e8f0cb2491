package org.owasp.blt.api.handlers;

import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;
import org.owasp.blt.api.rest.Pagination;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Collections;

/**
 * User profiles, proxied from the upstream {@code profile/} endpoint.
 */
public class UsersHandler {

    private final BltClient client;

    public UsersHandler(BltClient client) {
        this.client = client;
    }

    /** GET /users */
    public ApiResponse list(HandlerContext context) {
        Pagination pagination = Pagination.from(context.getQueryParams());
        UpstreamResult result = client.getUsers(pagination.getPage(), pagination.getPerPage());
        if (result.isError()) {
            return UpstreamPages.error(result, "Failed to fetch users");
        }
        return UpstreamPages.page(result, pagination, Collections.emptyMap());
    }

    /** GET /users/{id} and GET /users/{id}/profile */
    public ApiResponse get(HandlerContext context) {
        String userId = context.pathParam("id");
        if (!UpstreamPages.isNumeric(userId)) {
            return ApiResponse.badRequest("Invalid user ID");
        }

        UpstreamResult result = client.getUser(Long.parseLong(userId));
        if (result.isError()) {
            return UpstreamPages.error(result, "User not found");
        }
        return UpstreamPages.single(result);
    }
}
