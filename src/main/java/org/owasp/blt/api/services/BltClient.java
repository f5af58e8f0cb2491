package org.owasp.blt.api.services;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * HTTP client for the upstream BLT REST backend.
 *
 * Every call returns an {@link UpstreamResult}; transport failures and HTTP error statuses are folded
 * into error results so handlers can turn them into error envelopes. No retries.
 */
public class BltClient {

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final String USER_AGENT = "BLT-API-Worker/1.0";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String authToken;
    private final Duration timeout;
    private final Gson gson = new Gson();

    public BltClient(GatewayEnvironment environment) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(environment.getUpstreamTimeoutSeconds()))
                        .build(),
                environment.getApiBaseUrl(),
                environment.getApiToken(),
                Duration.ofSeconds(environment.getUpstreamTimeoutSeconds()));
    }

    public BltClient(HttpClient httpClient, String baseUrl, String authToken, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = trimTrailingSlashes(baseUrl);
        this.authToken = authToken;
        this.timeout = timeout;
    }

    // ==================== Generic Requests ====================

    public UpstreamResult get(String endpoint, Map<String, String> params) {
        return request("GET", endpoint, params, null);
    }

    public UpstreamResult post(String endpoint, Object data) {
        return request("POST", endpoint, null, data);
    }

    public UpstreamResult put(String endpoint, Object data) {
        return request("PUT", endpoint, null, data);
    }

    public UpstreamResult delete(String endpoint) {
        return request("DELETE", endpoint, null, null);
    }

    UpstreamResult request(String method, String endpoint, Map<String, String> params, Object data) {
        String url = buildUrl(endpoint, params);
        long start = LoggingService.logOperationStart("upstream_request",
                LoggingService.data("method", method, "url", url));
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url)).timeout(timeout);
            defaultHeaders().forEach(builder::header);
            if (data != null && BODY_METHODS.contains(method)) {
                builder.method(method, HttpRequest.BodyPublishers.ofString(gson.toJson(data)));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            JsonElement body = parseBody(response.body());

            if (status >= 400) {
                String message = extractErrorMessage(body);
                LoggingService.logOperationFailed("upstream_request", start, message);
                return UpstreamResult.failure(status, message, body);
            }
            LoggingService.logOperationEnd("upstream_request", start, LoggingService.data("status", status));
            return UpstreamResult.success(status, body);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggingService.logOperationFailed("upstream_request", start, e);
            return UpstreamResult.failure(500, "Request failed: interrupted");
        } catch (IOException | IllegalArgumentException e) {
            LoggingService.logOperationFailed("upstream_request", start, e);
            return UpstreamResult.failure(500, "Request failed: " + e.getMessage());
        }
    }

    // ==================== Stats API ====================

    public UpstreamResult getStats() {
        return get("stats/", null);
    }

    // ==================== Contributors API ====================

    public UpstreamResult getContributors(int page, int perPage) {
        return get("contributors/", pageParams(page, perPage));
    }

    // ==================== Bug Hunts API ====================

    public UpstreamResult getHunts(int page, int perPage, HuntFilter filter) {
        Map<String, String> params = pageParams(page, perPage);
        if (filter != null && filter.getQueryFlag() != null) {
            params.put(filter.getQueryFlag(), "true");
        }
        return get("hunt/", params);
    }

    public UpstreamResult getHunt(long huntId) {
        return get("hunt/" + huntId + "/", null);
    }

    // ==================== Leaderboard API ====================

    public UpstreamResult getLeaderboard(int page, int perPage, Integer month, Integer year, boolean organizations) {
        Map<String, String> params = pageParams(page, perPage);
        if (month != null) {
            params.put("filter", "true");
            params.put("month", String.valueOf(month));
        }
        if (year != null) {
            params.put("filter", "true");
            params.put("year", String.valueOf(year));
        }
        if (organizations) {
            params.put("leaderboard_type", "organizations");
        }
        return get("leaderboard/", params);
    }

    // ==================== Issues API ====================

    /**
     * @param domain upstream domain filter, omitted when null
     */
    public UpstreamResult getIssues(int page, int perPage, String status, String domain, String search) {
        Map<String, String> params = pageParams(page, perPage);
        params.put("status", emptyToNull(status));
        params.put("domain", emptyToNull(domain));
        params.put("search", emptyToNull(search));
        return get("issues/", params);
    }

    // ==================== Users API ====================

    public UpstreamResult getUsers(int page, int perPage) {
        return get("profile/", pageParams(page, perPage));
    }

    public UpstreamResult getUser(long userId) {
        return get("profile/" + userId + "/", null);
    }

    // ==================== Domains API ====================

    public UpstreamResult getDomains(int page, int perPage) {
        return get("domain/", pageParams(page, perPage));
    }

    public UpstreamResult getDomain(long domainId) {
        return get("domain/" + domainId + "/", null);
    }

    // ==================== Organizations API ====================

    public UpstreamResult getOrganizations(int page, int perPage, String search) {
        Map<String, String> params = pageParams(page, perPage);
        params.put("search", emptyToNull(search));
        return get("organizations/", params);
    }

    public UpstreamResult getOrganization(long organizationId) {
        return get("organizations/" + organizationId + "/", null);
    }

    public UpstreamResult getOrganizationRepos(long organizationId) {
        return get("organizations/" + organizationId + "/repositories/", null);
    }

    // ==================== Projects API ====================

    /**
     * The projects endpoint takes its search term as {@code q}, unlike organizations.
     */
    public UpstreamResult getProjects(int page, int perPage, String search) {
        Map<String, String> params = pageParams(page, perPage);
        params.put("q", emptyToNull(search));
        return get("projects/", params);
    }

    public UpstreamResult getProject(long projectId) {
        return get("projects/" + projectId + "/", null);
    }

    // ==================== Helpers ====================

    String buildUrl(String endpoint, Map<String, String> params) {
        String path = endpoint == null ? "" : endpoint.replaceFirst("^/+", "");
        StringBuilder url = new StringBuilder(baseUrl).append('/').append(path);
        if (params != null) {
            StringJoiner query = new StringJoiner("&");
            params.forEach((key, value) -> {
                if (value != null) {
                    query.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                            + URLEncoder.encode(value, StandardCharsets.UTF_8));
                }
            });
            if (query.length() > 0) {
                url.append('?').append(query);
            }
        }
        return url.toString();
    }

    Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        headers.put("User-Agent", USER_AGENT);
        if (authToken != null) {
            headers.put("Authorization", "Token " + authToken);
        }
        return headers;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static Map<String, String> pageParams(int page, int perPage) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("page", String.valueOf(page));
        params.put("per_page", String.valueOf(perPage));
        return params;
    }

    /**
     * Empty bodies become an empty object; anything that is not a JSON object or array is wrapped
     * as {@code {"raw_response": text}}.
     */
    static JsonElement parseBody(String text) {
        if (text == null || text.isBlank()) {
            return new JsonObject();
        }
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (parsed.isJsonObject() || parsed.isJsonArray()) {
                return parsed;
            }
        } catch (JsonParseException e) {
            LoggingService.debug("upstream_non_json_body", LoggingService.data("length", text.length()));
        }
        JsonObject raw = new JsonObject();
        raw.addProperty("raw_response", text);
        return raw;
    }

    private static String extractErrorMessage(JsonElement body) {
        if (body.isJsonObject()) {
            JsonObject object = body.getAsJsonObject();
            for (String key : new String[]{"detail", "error"}) {
                JsonElement value = object.get(key);
                if (value != null && !value.isJsonNull()) {
                    return value.isJsonPrimitive() ? value.getAsString() : value.toString();
                }
            }
        }
        return "Request failed";
    }

    private static String trimTrailingSlashes(String url) {
        if (url == null) {
            throw new IllegalArgumentException("Upstream base URL must not be null");
        }
        return url.replaceAll("/+$", "");
    }
}
