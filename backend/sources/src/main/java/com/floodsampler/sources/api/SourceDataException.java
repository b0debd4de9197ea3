package com.floodsampler.sources.api;

public class SourceDataException extends SourceException {
    public SourceDataException(String source, String message) {
        this(source, message, null);
    }

    public SourceDataException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
