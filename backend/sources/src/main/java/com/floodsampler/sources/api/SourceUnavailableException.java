package com.floodsampler.sources.api;

public class SourceUnavailableException extends SourceException {
    public SourceUnavailableException(String source, String message) {
        this(source, message, null);
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
