package org.owasp.blt.api.pojos;

import java.util.Map;

/**
 * Lambda Function URL event (payload format 2.0), reduced to the fields the gateway reads.
 */
public class RequestEvent {
    private String rawPath;
    private String rawQueryString;
    private Map<String, String> headers;
    private String body;
    private boolean isBase64Encoded;
    private RequestContext requestContext;

    public RequestEvent() {
    }

    public String getRawPath() {
        return rawPath;
    }

    public void setRawPath(String rawPath) {
        this.rawPath = rawPath;
    }

    public String getRawQueryString() {
        return rawQueryString;
    }

    public void setRawQueryString(String rawQueryString) {
        this.rawQueryString = rawQueryString;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public boolean getIsBase64Encoded() {
        return isBase64Encoded;
    }

    public void setIsBase64Encoded(boolean isBase64Encoded) {
        this.isBase64Encoded = isBase64Encoded;
    }

    public RequestContext getRequestContext() {
        return this.requestContext;
    }

    public void setRequestContext(RequestContext requestContext) {
        this.requestContext = requestContext;
    }

    /**
     * HTTP method from requestContext.http, or null if the event carries none.
     */
    public String getMethod() {
        if (requestContext == null || requestContext.getHttp() == null) {
            return null;
        }
        return requestContext.getHttp().getMethod();
    }

    /**
     * Reassembles the request URL as {@code https://<domainName><rawPath>[?<rawQueryString>]}.
     * The scheme and host are left out when the event has no domain name.
     */
    public String getUrl() {
        String path = rawPath;
        if (path == null && requestContext != null && requestContext.getHttp() != null) {
            path = requestContext.getHttp().getPath();
        }
        if (path == null) {
            path = "/";
        }

        StringBuilder url = new StringBuilder();
        if (requestContext != null && requestContext.getDomainName() != null) {
            url.append("https://").append(requestContext.getDomainName());
        }
        url.append(path);
        if (rawQueryString != null && !rawQueryString.isEmpty()) {
            url.append('?').append(rawQueryString);
        }
        return url.toString();
    }
}
