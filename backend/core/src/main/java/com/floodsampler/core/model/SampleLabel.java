package com.floodsampler.core.model;

public enum SampleLabel {
    POSITIVE(1),
    NEGATIVE(0);

    private final int value;

    SampleLabel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
