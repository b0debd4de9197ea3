package com.floodsampler.sources.api;

import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.TimeInterval;

import java.util.List;

public interface RecordSource<T> {
    String name();

    List<T> fetch(Region region, TimeInterval interval);
}
