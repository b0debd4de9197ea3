package com.floodsampler.core.model;

import com.floodsampler.core.util.HashingUtils;

import java.util.Objects;

public record FetchKey(String source, String regionId, TimeInterval interval) {
    public FetchKey {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(regionId, "regionId is required");
        Objects.requireNonNull(interval, "interval is required");
    }

    public static FetchKey of(String source, Region region, TimeInterval interval) {
        return new FetchKey(source, region.id(), interval);
    }

    public String canonical() {
        return source + "|" + regionId + "|" + interval.start() + "|" + interval.end();
    }

    public String fingerprint() {
        return HashingUtils.sha256(canonical());
    }
}
