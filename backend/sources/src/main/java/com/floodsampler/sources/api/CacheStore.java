package com.floodsampler.sources.api;

import com.floodsampler.core.model.FetchKey;

import java.util.Optional;

public interface CacheStore {
    Optional<String> get(FetchKey key);

    void put(FetchKey key, String payload);
}
