package com.floodsampler.sources.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.floodsampler.core.model.FetchKey;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.core.util.JsonUtils;
import com.floodsampler.sources.api.CacheStore;
import com.floodsampler.sources.api.RecordSource;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

public class CachingRecordSource<T> implements RecordSource<T> {
    private static final Logger LOGGER = Logger.getLogger(CachingRecordSource.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final RecordSource<T> delegate;
    private final CacheStore cacheStore;
    private final JavaType listType;
    private final AtomicInteger upstreamFetches = new AtomicInteger();
    private final AtomicInteger cacheHits = new AtomicInteger();

    public CachingRecordSource(RecordSource<T> delegate, CacheStore cacheStore, Class<T> recordType) {
        this.delegate = delegate;
        this.cacheStore = cacheStore;
        this.listType = MAPPER.getTypeFactory().constructCollectionType(List.class, recordType);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public List<T> fetch(Region region, TimeInterval interval) {
        return fetchTracked(region, interval).records();
    }

    public Fetched<T> fetchTracked(Region region, TimeInterval interval) {
        FetchKey key = FetchKey.of(delegate.name(), region, interval);
        Optional<String> cached = cacheStore.get(key);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            LOGGER.fine(() -> "Cache hit for " + key.canonical());
            return new Fetched<>(key, decode(key, cached.get()), true);
        }

        upstreamFetches.incrementAndGet();
        List<T> records = List.copyOf(delegate.fetch(region, interval));
        cacheStore.put(key, encode(key, records));
        return new Fetched<>(key, records, false);
    }

    public int upstreamFetches() {
        return upstreamFetches.get();
    }

    public int cacheHits() {
        return cacheHits.get();
    }

    private String encode(FetchKey key, List<T> records) {
        try {
            return MAPPER.writerFor(listType).writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode records for " + key.canonical(), e);
        }
    }

    private List<T> decode(FetchKey key, String payload) {
        try {
            List<T> records = MAPPER.readValue(payload, listType);
            return List.copyOf(records);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Corrupt cache entry for " + key.canonical(), e);
        }
    }

    public record Fetched<T>(FetchKey key, List<T> records, boolean fromCache) {
    }
}
