package com.floodsampler.sources.api;

import com.floodsampler.core.model.GaugeRecord;

public interface GaugeSource extends RecordSource<GaugeRecord> {
}
