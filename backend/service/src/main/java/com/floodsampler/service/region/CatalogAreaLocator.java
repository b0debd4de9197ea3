package com.floodsampler.service.region;

import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.sources.iem.AreaLocator;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CatalogAreaLocator implements AreaLocator {
    private static final Pattern AREA = Pattern.compile("([^,;\\[\\]]+?)\\s*\\[([A-Za-z]{2})\\]");

    private final RegionCatalog catalog;

    public CatalogAreaLocator(RegionCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Optional<GeoPoint> locate(String areaDescription, Region region) {
        if (areaDescription == null || areaDescription.isBlank()) {
            return Optional.empty();
        }
        if (region.coversCounty()) {
            return catalog.findCounty(region.stateCodes().get(0), region.county())
                    .map(RegionCatalog.CountyEntry::centroid);
        }
        Matcher matcher = AREA.matcher(areaDescription);
        String firstState = null;
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            String state = matcher.group(2);
            if (firstState == null && catalog.findState(state).isPresent()) {
                firstState = state;
            }
            Optional<RegionCatalog.CountyEntry> county = catalog.findCounty(state, name);
            if (county.isPresent()) {
                return Optional.of(county.get().centroid());
            }
        }
        if (firstState == null) {
            return Optional.empty();
        }
        return catalog.findState(firstState).map(RegionCatalog.StateEntry::center);
    }
}
