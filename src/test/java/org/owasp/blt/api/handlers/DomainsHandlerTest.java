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

public class DomainsHandlerTest {

    @Mock
    private BltClient client;

    private DomainsHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        handler = new DomainsHandler(client);
    }

    @Test
    void listOfPlainArrayIsPaginated() {
        when(client.getDomains(1, 20)).thenReturn(ok("[{\"id\": 1}, {\"id\": 2}]"));

        JsonObject json = body(handler.list(context("/domains", Map.of(), Map.of())));

        assertEquals(2, json.getAsJsonObject("pagination").get("count").getAsInt());
    }

    @Test
    void getReturnsDomain() {
        when(client.getDomain(2)).thenReturn(ok("{\"id\": 2, \"name\": \"example.com\"}"));

        JsonObject json = body(handler.get(context("/domains/2", Map.of("id", "2"), Map.of())));

        assertEquals("example.com", json.getAsJsonObject("data").get("name").getAsString());
    }

    @Test
    void tagsAreReadFromDomainRecord() {
        when(client.getDomain(2)).thenReturn(ok("{\"id\": 2, \"tags\": [\"web\", \"api\"]}"));

        JsonObject json = body(handler.tags(context("/domains/2/tags", Map.of("id", "2"), Map.of())));

        assertEquals(2, json.get("domain_id").getAsLong());
        assertEquals(2, json.get("count").getAsInt());
        assertEquals("web", json.getAsJsonArray("data").get(0).getAsString());
    }

    @Test
    void tagsOfUntaggedDomainAreEmpty() {
        when(client.getDomain(3)).thenReturn(ok("{\"id\": 3}"));

        JsonObject json = body(handler.tags(context("/domains/3/tags", Map.of("id", "3"), Map.of())));

        assertEquals(0, json.get("count").getAsInt());
        assertEquals(0, json.getAsJsonArray("data").size());
    }

    @Test
    void issuesAreFilteredByDomain() {
        when(client.getIssues(1, 20, null, "2", null)).thenReturn(ok(
                "{\"count\": 1, \"next\": null, \"previous\": null, \"results\": [{\"id\": 77}]}"));

        JsonObject json = body(handler.issues(context("/domains/2/issues", Map.of("id", "2"), Map.of())));

        assertEquals(2, json.get("domain_id").getAsLong());
        assertEquals(77, json.getAsJsonArray("data").get(0).getAsJsonObject().get("id").getAsInt());
        assertEquals(1, json.getAsJsonObject("pagination").get("total").getAsInt());
    }

    @Test
    void nonNumericIdIsRejectedOnEveryView() {
        Map<String, String> bad = Map.of("id", "x1");

        assertEquals(400, handler.get(context("/domains/x1", bad, Map.of())).getStatusCode());
        assertEquals(400, handler.tags(context("/domains/x1/tags", bad, Map.of())).getStatusCode());
        assertEquals(400, handler.issues(context("/domains/x1/issues", bad, Map.of())).getStatusCode());
        verify(client, never()).getDomain(anyLong());
        verifyNoMoreInteractions(client);
    }

    @Test
    void missingDomainKeepsUpstreamStatus() {
        when(client.getDomain(4)).thenReturn(UpstreamResult.failure(404, null));

        ApiResponse response = handler.get(context("/domains/4", Map.of("id", "4"), Map.of()));

        assertEquals(404, response.getStatusCode());
        assertEquals("Domain not found", body(response).get("message").getAsString());
    }
}
