package org.owasp.blt.api;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.owasp.blt.api.pojos.RequestContext;
import org.owasp.blt.api.pojos.RequestContextHttp;
import org.owasp.blt.api.pojos.RequestEvent;
import org.owasp.blt.api.rest.RestRouter;
import org.owasp.blt.api.services.BltClient;
import org.owasp.blt.api.services.GatewayEnvironment;
import org.owasp.blt.api.services.HuntFilter;
import org.owasp.blt.api.services.UpstreamResult;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Lambda entry point against the real route table with a mocked upstream.
 */
public class HandlerTest {

    @Mock
    private BltClient client;
    @Mock
    private Context lambdaContext;

    private Handler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(lambdaContext.getAwsRequestId()).thenReturn("req-1");
        handler = new Handler(GatewayEnvironment.of(Map.of()), ApiRoutes.build(client));
    }

    static RequestEvent event(String method, String rawPath, String rawQueryString) {
        RequestContext requestContext = new RequestContext();
        requestContext.setDomainName("abc123.lambda-url.ap-south-1.on.aws");
        requestContext.setHttp(new RequestContextHttp(method, rawPath));

        RequestEvent event = new RequestEvent();
        event.setRawPath(rawPath);
        event.setRawQueryString(rawQueryString);
        event.setRequestContext(requestContext);
        return event;
    }

    @SuppressWarnings("unchecked")
    private static JsonObject body(Map<String, Object> lambdaResponse) {
        return JsonParser.parseString((String) lambdaResponse.get("body")).getAsJsonObject();
    }

    @Test
    void optionsPreflightShortCircuitsRouting() {
        Map<String, Object> response = handler.handleRequest(event("OPTIONS", "/no/such/route", null), lambdaContext);

        assertEquals(204, response.get("statusCode"));
        assertEquals("", response.get("body"));
        @SuppressWarnings("unchecked")
        Map<String, String> headers = (Map<String, String>) response.get("headers");
        assertEquals("*", headers.get("Access-Control-Allow-Origin"));
        verifyNoInteractions(client);
    }

    @Test
    void healthIsServedLocally() {
        Map<String, Object> response = handler.handleRequest(event("GET", "/health/", null), lambdaContext);

        assertEquals(200, response.get("statusCode"));
        assertEquals("healthy", body(response).get("status").getAsString());
    }

    @Test
    void literalHuntViewsWinOverHuntId() {
        when(client.getHunts(1, 20, HuntFilter.ACTIVE))
                .thenReturn(UpstreamResult.success(200, JsonParser.parseString("[]")));

        Map<String, Object> response = handler.handleRequest(event("GET", "/hunts/active", null), lambdaContext);

        assertEquals(200, response.get("statusCode"));
        assertEquals("active", body(response).get("filter").getAsString());
        verify(client, never()).getHunt(anyLong());
    }

    @Test
    void queryStringReachesHandler() {
        when(client.getLeaderboard(1, 20, 2, null, false))
                .thenReturn(UpstreamResult.success(200, JsonParser.parseString("[]")));

        Map<String, Object> response = handler.handleRequest(event("GET", "/leaderboard/monthly", "month=2"), lambdaContext);

        assertEquals(2, body(response).get("month").getAsInt());
    }

    @Test
    void unknownRouteIs404Envelope() {
        Map<String, Object> response = handler.handleRequest(event("GET", "/bugs/search", null), lambdaContext);

        assertEquals(404, response.get("statusCode"));
        JsonObject json = body(response);
        assertTrue(json.get("error").getAsBoolean());
        assertEquals("Not Found: GET /bugs/search", json.get("message").getAsString());
    }

    @Test
    void handlerExceptionIs500Envelope() {
        when(client.getStats()).thenThrow(new IllegalStateException("upstream client closed"));

        Map<String, Object> response = handler.handleRequest(event("GET", "/stats", null), lambdaContext);

        assertEquals(500, response.get("statusCode"));
        assertEquals("Handler error: upstream client closed", body(response).get("message").getAsString());
    }

    @Test
    void eventWithoutRequestContextStillGetsEnvelope() {
        Map<String, Object> response = handler.handleRequest(new RequestEvent(), lambdaContext);

        assertEquals(404, response.get("statusCode"));
        assertEquals("Not Found:  /", body(response).get("message").getAsString());
    }

    @Test
    void brokenRouterIsContained() {
        RestRouter broken = mock(RestRouter.class);
        when(broken.handle(any(RequestEvent.class), any(GatewayEnvironment.class)))
                .thenThrow(new IllegalStateException("route table corrupted"));
        Handler guarded = new Handler(GatewayEnvironment.of(Map.of()), broken);

        Map<String, Object> response = guarded.handleRequest(event("GET", "/health", null), lambdaContext);

        assertEquals(500, response.get("statusCode"));
        assertEquals("Internal Server Error: route table corrupted", body(response).get("message").getAsString());
    }
}
