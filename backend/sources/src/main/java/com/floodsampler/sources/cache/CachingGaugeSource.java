package com.floodsampler.sources.cache;

import com.floodsampler.core.model.GaugeRecord;
import com.floodsampler.sources.api.CacheStore;
import com.floodsampler.sources.api.GaugeSource;

public class CachingGaugeSource extends CachingRecordSource<GaugeRecord> implements GaugeSource {
    public CachingGaugeSource(GaugeSource delegate, CacheStore cacheStore) {
        super(delegate, cacheStore, GaugeRecord.class);
    }
}
