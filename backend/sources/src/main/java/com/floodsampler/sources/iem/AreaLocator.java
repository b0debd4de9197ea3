package com.floodsampler.sources.iem;

import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;

import java.util.Optional;

@FunctionalInterface
public interface AreaLocator {
    Optional<GeoPoint> locate(String areaDescription, Region region);
}
