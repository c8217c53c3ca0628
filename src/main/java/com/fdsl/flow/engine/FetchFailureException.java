package com.fdsl.flow.engine;

/** A source call failed. Carries the failing source name. */
public class FetchFailureException extends RuntimeException {
    private final String source;

    public FetchFailureException(String source, Throwable cause) {
        super("Fetch from source '" + source + "' failed: " + cause.getMessage(), cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
