package com.floodsampler.sources.api;

import com.floodsampler.core.model.FetchKey;

public class CacheConsistencyException extends IllegalStateException {
    private final transient FetchKey key;

    public CacheConsistencyException(FetchKey key, String detail) {
        super("Cache entry for " + key.canonical() + " already holds a different payload: " + detail);
        this.key = key;
    }

    public FetchKey key() {
        return key;
    }
}
