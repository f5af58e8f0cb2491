package org.owasp.blt.api.services;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Outcome of one upstream call. Failures are values, never exceptions.
 */
public final class UpstreamResult {

    private final boolean error;
    private final int status;
    private final String message;
    private final JsonElement data;

    private UpstreamResult(boolean error, int status, String message, JsonElement data) {
        this.error = error;
        this.status = status;
        this.message = message;
        this.data = data != null ? data : new JsonObject();
    }

    public static UpstreamResult success(int status, JsonElement data) {
        return new UpstreamResult(false, status, null, data);
    }

    public static UpstreamResult failure(int status, String message, JsonElement data) {
        return new UpstreamResult(true, status, message, data);
    }

    public static UpstreamResult failure(int status, String message) {
        return new UpstreamResult(true, status, message, null);
    }

    public boolean isError() {
        return error;
    }

    public int getStatus() {
        return status;
    }

    /** Error message, null on success. */
    public String getMessage() {
        return message;
    }

    /** Parsed response body; an empty object when the body was empty. */
    public JsonElement getData() {
        return data;
    }
}
