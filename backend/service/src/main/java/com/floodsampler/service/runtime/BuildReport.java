package com.floodsampler.service.runtime;

import com.floodsampler.core.model.Sample;

import java.util.List;
import java.util.Locale;

public record BuildReport(
        String regionId,
        List<Sample> samples,
        int positives,
        int negatives,
        int targetNegatives,
        int droppedCandidates,
        List<FailedFetch> failedFetches,
        int upstreamFetches,
        int cacheHits
) {
    public BuildReport {
        samples = List.copyOf(samples);
        failedFetches = List.copyOf(failedFetches);
    }

    public double achievedRatio() {
        return positives == 0 ? 0.0 : (double) negatives / positives;
    }

    public boolean underSampled() {
        return negatives < targetNegatives;
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "region=%s positives=%d negatives=%d target=%d ratio=%.3f dropped=%d failedFetches=%d upstreamFetches=%d cacheHits=%d",
                regionId, positives, negatives, targetNegatives, achievedRatio(), droppedCandidates,
                failedFetches.size(), upstreamFetches, cacheHits);
    }

    public record FailedFetch(String source, String fetchKey, boolean retryable, int attempts, String message) {
    }
}
