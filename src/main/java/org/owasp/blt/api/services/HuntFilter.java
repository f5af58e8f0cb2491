package org.owasp.blt.api.services;

/**
 * Bug hunt listing filters understood by the upstream {@code hunt/} endpoint.
 */
public enum HuntFilter {
    ALL(null),
    ACTIVE("activeHunt"),
    PREVIOUS("previousHunt"),
    UPCOMING("upcomingHunt");

    private final String queryFlag;

    HuntFilter(String queryFlag) {
        this.queryFlag = queryFlag;
    }

    /** Query parameter set to {@code "true"} for this filter, null for {@link #ALL}. */
    public String getQueryFlag() {
        return queryFlag;
    }
}
