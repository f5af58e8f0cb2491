package org.owasp.blt.api.services;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GatewayEnvironmentTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsApplyWithoutFileOrVariables() {
        GatewayEnvironment env = GatewayEnvironment.load(tempDir.resolve("missing.json"), Map.of());

        assertEquals("https://blt.owasp.org/api/v1", env.getApiBaseUrl());
        assertEquals("https://blt.owasp.org", env.getWebsiteUrl());
        assertEquals(10, env.getUpstreamTimeoutSeconds());
        assertNull(env.getApiToken());
    }

    @Test
    void fileOverridesDefaultsAndVariablesOverrideFile() throws IOException {
        Path file = tempDir.resolve("env.json");
        Files.writeString(file, "{\"BLT_API_BASE_URL\": \"https://staging.example.org/api/v1\","
                + " \"BLT_WEBSITE_URL\": \"https://staging.example.org\", \"UPSTREAM_TIMEOUT_SECONDS\": 3}");

        GatewayEnvironment env = GatewayEnvironment.load(file,
                Map.of("BLT_WEBSITE_URL", "https://www.example.org", "BLT_API_TOKEN", "secret"));

        assertEquals("https://staging.example.org/api/v1", env.getApiBaseUrl());
        assertEquals("https://www.example.org", env.getWebsiteUrl());
        assertEquals(3, env.getUpstreamTimeoutSeconds());
        assertEquals("secret", env.getApiToken());
    }

    @Test
    void blankVariablesDoNotOverride() {
        GatewayEnvironment env = GatewayEnvironment.load(tempDir.resolve("missing.json"),
                Map.of("BLT_API_BASE_URL", "  "));

        assertEquals("https://blt.owasp.org/api/v1", env.getApiBaseUrl());
    }

    @Test
    void malformedFileIsIgnored() throws IOException {
        Path file = tempDir.resolve("env.json");
        Files.writeString(file, "{not json");

        GatewayEnvironment env = GatewayEnvironment.load(file, Map.of());

        assertEquals("https://blt.owasp.org/api/v1", env.getApiBaseUrl());
    }

    @Test
    void invalidTimeoutFallsBackToDefault() {
        assertEquals(10, GatewayEnvironment.of(Map.of("UPSTREAM_TIMEOUT_SECONDS", "soon")).getUpstreamTimeoutSeconds());
        assertEquals(10, GatewayEnvironment.of(Map.of("UPSTREAM_TIMEOUT_SECONDS", "-1")).getUpstreamTimeoutSeconds());
    }

    @Test
    void ofOverlaysDefaults() {
        GatewayEnvironment env = GatewayEnvironment.of(Map.of("CUSTOM", "value"));

        assertEquals("value", env.get("CUSTOM"));
        assertEquals("fallback", env.getOrDefault("OTHER", "fallback"));
        assertEquals("https://blt.owasp.org", env.getWebsiteUrl());
    }
}
