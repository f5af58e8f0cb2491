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
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;
import static org.owasp.blt.api.handlers.HandlerTestSupport.*;

public class UsersHandlerTest {

    @Mock
    private BltClient client;

    private UsersHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        handler = new UsersHandler(client);
    }

    @Test
    void listMapsUpstreamPage() {
        when(client.getUsers(1, 10)).thenReturn(ok(
                "{\"count\": 40, \"next\": \"n\", \"previous\": null, \"results\": [{\"id\": 1}]}"));

        JsonObject json = body(handler.list(context("/users", Map.of(), Map.of("per_page", "10"))));

        assertEquals(1, json.getAsJsonArray("data").size());
        assertEquals(40, json.getAsJsonObject("pagination").get("total").getAsInt());
    }

    @Test
    void listErrorFallsBackToGenericMessage() {
        when(client.getUsers(1, 20)).thenReturn(UpstreamResult.failure(502, null));

        ApiResponse response = handler.list(context("/users", Map.of(), Map.of()));

        assertEquals(502, response.getStatusCode());
        assertEquals("Failed to fetch users", body(response).get("message").getAsString());
    }

    @Test
    void getRejectsNonNumericId() {
        ApiResponse response = handler.get(context("/users/me", Map.of("id", "me"), Map.of()));

        assertEquals(400, response.getStatusCode());
        assertEquals("Invalid user ID", body(response).get("message").getAsString());
        verify(client, never()).getUser(anyLong());
    }

    @Test
    void getReturnsProfile() {
        when(client.getUser(5)).thenReturn(ok("{\"id\": 5, \"user\": \"alice\"}"));

        JsonObject json = body(handler.get(context("/users/5/profile", Map.of("id", "5"), Map.of())));

        assertTrue(json.get("success").getAsBoolean());
        assertEquals("alice", json.getAsJsonObject("data").get("user").getAsString());
    }

    @Test
    void missingUserKeepsUpstream404() {
        when(client.getUser(9)).thenReturn(UpstreamResult.failure(404, "Not found."));

        ApiResponse response = handler.get(context("/users/9", Map.of("id", "9"), Map.of()));

        assertEquals(404, response.getStatusCode());
        assertEquals("Not found.", body(response).get("message").getAsString());
    }
}
