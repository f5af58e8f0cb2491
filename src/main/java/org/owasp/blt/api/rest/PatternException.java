package org.owasp.blt.api.rest;

/**
 * Thrown when a route template cannot be compiled. Raised during route table construction, so it aborts startup.
 */
public class PatternException extends IllegalArgumentException {

    public PatternException(String message) {
        super(message);
    }
}
