package com.floodsampler.sources.cache;

import com.floodsampler.core.model.AlertRecord;
import com.floodsampler.sources.api.AlertSource;
import com.floodsampler.sources.api.CacheStore;

public class CachingAlertSource extends CachingRecordSource<AlertRecord> implements AlertSource {
    public CachingAlertSource(AlertSource delegate, CacheStore cacheStore) {
        super(delegate, cacheStore, AlertRecord.class);
    }
}
