package org.owasp.blt.api.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Environment bindings handed to every route handler.
 *
 * Values are resolved once at cold start: built-in defaults, then {@code env.json} in the working
 * directory, then process environment variables, later sources overriding earlier ones.
 */
public final class GatewayEnvironment {

    public static final String BLT_API_BASE_URL = "BLT_API_BASE_URL";
    public static final String BLT_WEBSITE_URL = "BLT_WEBSITE_URL";
    public static final String BLT_API_TOKEN = "BLT_API_TOKEN";
    public static final String UPSTREAM_TIMEOUT_SECONDS = "UPSTREAM_TIMEOUT_SECONDS";

    static final String ENV_FILE = "env.json";

    private static final Map<String, String> DEFAULTS = Map.of(
            BLT_API_BASE_URL, "https://blt.owasp.org/api/v1",
            BLT_WEBSITE_URL, "https://blt.owasp.org",
            UPSTREAM_TIMEOUT_SECONDS, "10"
    );

    private final Map<String, String> values;

    private GatewayEnvironment(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static GatewayEnvironment load() {
        return load(Paths.get(ENV_FILE), System.getenv());
    }

    static GatewayEnvironment load(Path envFile, Map<String, String> processEnv) {
        Map<String, String> merged = new HashMap<>(DEFAULTS);
        merged.putAll(readEnvFile(envFile));
        for (String key : knownKeys()) {
            String value = processEnv.get(key);
            if (value != null && !value.isBlank()) {
                merged.put(key, value);
            }
        }
        return new GatewayEnvironment(merged);
    }

    /**
     * Defaults overlaid with the given bindings. Intended for tests and embedding.
     */
    public static GatewayEnvironment of(Map<String, String> bindings) {
        Map<String, String> merged = new HashMap<>(DEFAULTS);
        merged.putAll(bindings);
        return new GatewayEnvironment(merged);
    }

    public String get(String key) {
        return values.get(key);
    }

    public String getOrDefault(String key, String fallback) {
        return values.getOrDefault(key, fallback);
    }

    public String getApiBaseUrl() {
        return values.get(BLT_API_BASE_URL);
    }

    public String getWebsiteUrl() {
        return values.get(BLT_WEBSITE_URL);
    }

    /** Upstream API token, or null when none is configured. */
    public String getApiToken() {
        String token = values.get(BLT_API_TOKEN);
        return token == null || token.isBlank() ? null : token;
    }

    public int getUpstreamTimeoutSeconds() {
        int fallback = Integer.parseInt(DEFAULTS.get(UPSTREAM_TIMEOUT_SECONDS));
        String raw = values.get(UPSTREAM_TIMEOUT_SECONDS);
        if (raw == null) {
            return fallback;
        }
        try {
            int seconds = Integer.parseInt(raw.trim());
            return seconds > 0 ? seconds : fallback;
        } catch (NumberFormatException e) {
            LoggingService.warn("environment_invalid_timeout", LoggingService.data("value", raw));
            return fallback;
        }
    }

    private static String[] knownKeys() {
        return new String[]{BLT_API_BASE_URL, BLT_WEBSITE_URL, BLT_API_TOKEN, UPSTREAM_TIMEOUT_SECONDS};
    }

    private static Map<String, String> readEnvFile(Path envFile) {
        Map<String, String> map = new HashMap<>();
        if (envFile == null || !Files.isRegularFile(envFile)) {
            return map;
        }
        try {
            JsonNode rootNode = new ObjectMapper().readTree(envFile.toFile());
            Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                map.put(entry.getKey(), entry.getValue().asText(""));
            }
        } catch (Exception e) {
            LoggingService.error("environment_file_load_failed", e, LoggingService.data("file", envFile.toString()));
        }
        return map;
    }
}
