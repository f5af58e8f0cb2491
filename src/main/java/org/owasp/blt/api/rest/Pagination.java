package org.owasp.blt.api.rest;

import java.util.Map;

/**
 * Page and page size read from {@code page} / {@code per_page} query parameters.
 */
public final class Pagination {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 20;
    public static final int MAX_PER_PAGE = 100;

    private final int page;
    private final int perPage;

    private Pagination(int page, int perPage) {
        this.page = page;
        this.perPage = perPage;
    }

    /**
     * Unparsable values fall back to the defaults; page is at least 1, per_page is clamped to [1, 100].
     */
    public static Pagination from(Map<String, String> queryParams) {
        int page = parseOrDefault(queryParams.get("page"), DEFAULT_PAGE);
        int perPage = parseOrDefault(queryParams.get("per_page"), DEFAULT_PER_PAGE);
        return new Pagination(Math.max(1, page), Math.max(1, Math.min(MAX_PER_PAGE, perPage)));
    }

    public int getPage() {
        return page;
    }

    public int getPerPage() {
        return perPage;
    }

    private static int parseOrDefault(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
