package com.floodsampler.core.model;

public record RegionFilter(String county, String state) {
    public static RegionFilter nationwide() {
        return new RegionFilter(null, null);
    }

    public boolean hasCounty() {
        return county != null && !county.isBlank();
    }

    public boolean hasState() {
        return state != null && !state.isBlank();
    }
}
