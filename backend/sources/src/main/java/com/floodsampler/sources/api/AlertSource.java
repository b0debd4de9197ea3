package com.floodsampler.sources.api;

import com.floodsampler.core.model.AlertRecord;

public interface AlertSource extends RecordSource<AlertRecord> {
}
