package org.owasp.blt.api.handlers;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.owasp.blt.api.rest.ApiResponse;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.owasp.blt.api.handlers.HandlerTestSupport.*;

public class StatsHandlerTest {

    @Mock
    private BltClient client;

    private StatsHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        handler = new StatsHandler(client);
    }

    @Test
    void missingCountersDefaultToZero() {
        when(client.getStats()).thenReturn(ok("{\"bugs\": 120, \"users\": 45}"));

        JsonObject json = body(handler.stats(context("/stats", Map.of(), Map.of())));

        JsonObject data = json.getAsJsonObject("data");
        assertEquals(120, data.get("bugs").getAsInt());
        assertEquals(45, data.get("users").getAsInt());
        assertEquals(0, data.get("hunts").getAsInt());
        assertEquals(0, data.get("domains").getAsInt());
        assertEquals("Total number of bugs reported", json.getAsJsonObject("description").get("bugs").getAsString());
    }

    @Test
    void upstreamFailureBecomesErrorEnvelope() {
        when(client.getStats()).thenReturn(UpstreamResult.failure(502, "Request failed"));

        ApiResponse response = handler.stats(context("/stats", Map.of(), Map.of()));

        assertEquals(502, response.getStatusCode());
        assertTrue(body(response).get("error").getAsBoolean());
    }
}
