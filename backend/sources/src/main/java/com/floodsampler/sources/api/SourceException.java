package com.floodsampler.sources.api;

public abstract class SourceException extends RuntimeException {
    private final String source;

    protected SourceException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }

    public abstract boolean retryable();
}
