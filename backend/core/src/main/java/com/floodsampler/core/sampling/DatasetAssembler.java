package com.floodsampler.core.sampling;

import com.floodsampler.core.model.Sample;
import com.floodsampler.core.model.SampleLabel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public final class DatasetAssembler {
    private static final Logger LOGGER = Logger.getLogger(DatasetAssembler.class.getName());

    public List<Sample> assemble(List<Sample> positives, List<Sample> negatives) {
        requireLabel(positives, SampleLabel.POSITIVE);
        requireLabel(negatives, SampleLabel.NEGATIVE);

        Set<Sample.DiscreteKey> seen = new HashSet<>();
        List<Sample> merged = new ArrayList<>(positives.size() + negatives.size());
        int droppedPositives = keepFirst(positives, seen, merged);
        int droppedNegatives = keepFirst(negatives, seen, merged);
        merged.sort(Sample.CANONICAL_ORDER);

        if (droppedPositives > 0 || droppedNegatives > 0) {
            LOGGER.fine(() -> "Assembler removed " + droppedPositives + " duplicate positives and "
                    + droppedNegatives + " colliding negatives");
        }
        return List.copyOf(merged);
    }

    private static int keepFirst(List<Sample> samples, Set<Sample.DiscreteKey> seen, List<Sample> out) {
        List<Sample> ordered = new ArrayList<>(samples);
        ordered.sort(Sample.CANONICAL_ORDER);
        int dropped = 0;
        for (Sample sample : ordered) {
            if (seen.add(sample.discreteKey())) {
                out.add(sample);
            } else {
                dropped++;
            }
        }
        return dropped;
    }

    private static void requireLabel(List<Sample> samples, SampleLabel expected) {
        for (Sample sample : samples) {
            if (sample.label() != expected) {
                throw new IllegalStateException("Expected only " + expected + " samples but found " + sample);
            }
        }
    }
}
