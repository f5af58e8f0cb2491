package org.owasp.blt.api.pojos;

/**
 * Represents the HTTP context from Lambda Function URL events.
 * Located at requestContext.http in the event payload.
 */
public class RequestContextHttp {
    private String method;
    private String path;
    private String protocol;
    private String sourceIp;
    private String userAgent;

    public RequestContextHttp() {
    }

    public RequestContextHttp(String method, String path) {
        this.method = method;
        this.path = path;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getProtocol() {
        return protocol;
    }

    public void setProtocol(String protocol) {
        this.protocol = protocol;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public void setSourceIp(String sourceIp) {
        this.sourceIp = sourceIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
