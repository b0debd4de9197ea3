package com.floodsampler.service.config;

import com.floodsampler.sources.iem.IemAlertSource;
import com.floodsampler.sources.usgs.UsgsGaugeSource;

import java.util.Map;

public record SourceSettings(
        String iemBaseUrl,
        String usgsBaseUrl,
        String usgsApiKey,
        Integer usgsPageSize,
        Integer usgsMaxPages,
        Map<String, Double> floodStagesFt
) {
    public SourceSettings {
        iemBaseUrl = iemBaseUrl == null ? IemAlertSource.DEFAULT_BASE_URL : iemBaseUrl;
        usgsBaseUrl = usgsBaseUrl == null ? UsgsGaugeSource.DEFAULT_BASE_URL : usgsBaseUrl;
        usgsApiKey = usgsApiKey == null ? "" : usgsApiKey;
        usgsPageSize = usgsPageSize == null ? 5000 : usgsPageSize;
        usgsMaxPages = usgsMaxPages == null ? 20 : usgsMaxPages;
        floodStagesFt = floodStagesFt == null ? Map.of() : Map.copyOf(floodStagesFt);
    }

    public static SourceSettings defaults() {
        return new SourceSettings(null, null, null, null, null, null);
    }

    public SourceSettings withUsgsApiKey(String apiKey) {
        return new SourceSettings(iemBaseUrl, usgsBaseUrl, apiKey, usgsPageSize, usgsMaxPages, floodStagesFt);
    }
}
