package com.floodsampler.core.sampling;

import com.floodsampler.core.model.Sample;

import java.util.List;

public record NegativeSynthesisResult(
        List<Sample> negatives,
        int target,
        List<Exhausted> exhausted,
        int collapsed
) {
    public NegativeSynthesisResult {
        negatives = List.copyOf(negatives);
        exhausted = List.copyOf(exhausted);
    }

    public static NegativeSynthesisResult empty() {
        return new NegativeSynthesisResult(List.of(), 0, List.of(), 0);
    }

    public record Exhausted(String positiveProvenance, int slot, int attempts) {
    }
}
