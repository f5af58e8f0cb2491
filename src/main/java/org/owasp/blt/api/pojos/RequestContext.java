package org.owasp.blt.api.pojos;

public class RequestContext {
    private String requestId;
    private String domainName;
    private RequestContextHttp http;

    public RequestContext() {
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getDomainName() {
        return domainName;
    }

    public void setDomainName(String domainName) {
        this.domainName = domainName;
    }

    public RequestContextHttp getHttp() {
        return http;
    }

    public void setHttp(RequestContextHttp http) {
        this.http = http;
    }
}
