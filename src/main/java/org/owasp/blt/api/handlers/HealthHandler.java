package org.owasp.blt.api.handlers;

import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.rest.HandlerContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static health and API index document. Served locally, never proxied.
 */
public class HealthHandler {

    public static final String VERSION = "1.0.0";

    /** Top-level collections listed under {@code endpoints}; each is served at {@code /<name>}. */
    public static final List<String> RESOURCES = List.of("users", "domains", "organizations", "projects",
            "hunts", "stats", "leaderboard", "contributors", "repos");

    public ApiResponse health(HandlerContext context) {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        for (String resource : RESOURCES) {
            endpoints.put(resource, "/" + resource);
        }

        Map<String, Object> links = new LinkedHashMap<>();
        links.put("github", "https://github.com/OWASP-BLT/BLT");
        links.put("website", context.getEnvironment().getWebsiteUrl());
        links.put("documentation", "https://github.com/OWASP-BLT/BLT-API");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("api", "BLT API");
        body.put("version", VERSION);
        body.put("endpoints", endpoints);
        body.put("links", links);
        return ApiResponse.ok(body);
    }
}
