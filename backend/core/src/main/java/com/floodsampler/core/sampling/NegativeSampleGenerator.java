package com.floodsampler.core.sampling;

import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.Sample;
import com.floodsampler.core.model.SampleLabel;
import com.floodsampler.core.model.TimeWindow;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public final class NegativeSampleGenerator {
    private static final Logger LOGGER = Logger.getLogger(NegativeSampleGenerator.class.getName());

    private final NegativeSamplingConfig config;

    public NegativeSampleGenerator(NegativeSamplingConfig config) {
        this.config = config;
    }

    public List<Sample> generate(List<Sample> positives, Region region, TimeWindow window) {
        return synthesize(positives, region, window).negatives();
    }

    public List<Sample> generate(List<Sample> positives, Region region, TimeWindow window, double ratio) {
        return new NegativeSampleGenerator(config.withRatio(ratio)).generate(positives, region, window);
    }

    public NegativeSynthesisResult synthesize(List<Sample> positives, Region region, TimeWindow window) {
        if (positives.isEmpty()) {
            return NegativeSynthesisResult.empty();
        }
        for (Sample positive : positives) {
            if (positive.label() != SampleLabel.POSITIVE) {
                throw new IllegalArgumentException("Negative synthesis expects positives only, got: " + positive);
            }
        }

        List<Sample> ordered = new ArrayList<>(positives);
        ordered.sort(Sample.CANONICAL_ORDER);
        ExclusionIndex index = ExclusionIndex.build(ordered, config.exclusionRadiusKm(), config.exclusionWindow());
        CandidatePerturbation perturbation = new CandidatePerturbation(config);

        int target = config.targetFor(ordered.size());
        int perPositive = target / ordered.size();
        int remainder = target % ordered.size();

        Map<DedupKey, Sample> accepted = new LinkedHashMap<>();
        List<NegativeSynthesisResult.Exhausted> exhausted = new ArrayList<>();
        int collapsed = 0;
        for (int i = 0; i < ordered.size(); i++) {
            Sample positive = ordered.get(i);
            int slots = perPositive + (i < remainder ? 1 : 0);
            for (int slot = 0; slot < slots; slot++) {
                Sample negative = place(positive, slot, perturbation, index, region, window);
                if (negative == null) {
                    exhausted.add(new NegativeSynthesisResult.Exhausted(positive.provenance(), slot, config.maxAttempts()));
                    int droppedSlot = slot;
                    LOGGER.fine(() -> "No valid negative for " + positive.provenance() + " slot " + droppedSlot
                            + " after " + config.maxAttempts() + " attempts");
                    continue;
                }
                if (accepted.putIfAbsent(dedupKey(negative), negative) != null) {
                    collapsed++;
                }
            }
        }

        List<Sample> negatives = new ArrayList<>(accepted.values());
        negatives.sort(Sample.CANONICAL_ORDER);
        return new NegativeSynthesisResult(negatives, target, exhausted, collapsed);
    }

    private Sample place(
            Sample positive,
            int slot,
            CandidatePerturbation perturbation,
            ExclusionIndex index,
            Region region,
            TimeWindow window
    ) {
        for (int attempt = 0; attempt < config.maxAttempts(); attempt++) {
            CandidatePerturbation.Candidate candidate = perturbation.draw(positive, slot, attempt);
            if (!region.bounds().contains(candidate.location())) {
                continue;
            }
            if (!window.contains(candidate.timestamp())) {
                continue;
            }
            if (index.isExcluded(candidate.location(), candidate.timestamp())) {
                continue;
            }
            return Sample.negative(
                    candidate.location(),
                    candidate.timestamp(),
                    "synthetic:" + positive.provenance() + "#" + slot
            );
        }
        return null;
    }

    private DedupKey dedupKey(Sample sample) {
        GeoPoint location = sample.location();
        return new DedupKey(
                (long) Math.floor(location.lat() / config.dedupCellDegrees()),
                (long) Math.floor(location.lon() / config.dedupCellDegrees()),
                LocalDate.ofInstant(sample.timestamp(), ZoneOffset.UTC)
        );
    }

    private record DedupKey(long latCell, long lonCell, LocalDate day) {
    }
}
