package com.floodsampler.service.region;

import com.floodsampler.core.model.BoundingBox;
import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.RegionFilter;
import com.floodsampler.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class RegionCatalog {
    public static final String RESOURCE = "regions.json";

    private final BoundingBox nationwideBounds;
    private final List<StateEntry> states;
    private final List<CountyEntry> counties;

    public RegionCatalog(BoundingBox nationwideBounds, List<StateEntry> states, List<CountyEntry> counties) {
        this.nationwideBounds = nationwideBounds;
        this.states = List.copyOf(states);
        this.counties = List.copyOf(counties);
    }

    public static RegionCatalog loadDefault() {
        try (InputStream in = RegionCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Region catalog resource not found: " + RESOURCE);
            }
            CatalogFile file = JsonUtils.objectMapper().readValue(in, CatalogFile.class);
            return new RegionCatalog(file.nationwideBounds(), file.states(), file.counties());
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading region catalog " + RESOURCE, e);
        }
    }

    public Region resolve(RegionFilter filter) {
        if (filter.hasCounty() && !filter.hasState()) {
            throw new IllegalArgumentException("County '" + filter.county() + "' requires a state "
                    + "(for example --county 'Travis' --state 'Texas')");
        }
        if (!filter.hasState()) {
            return nationwide();
        }
        StateEntry state = findState(filter.state())
                .orElseThrow(() -> new IllegalArgumentException("Unknown state: " + filter.state()));
        if (!filter.hasCounty()) {
            return new Region(
                    "US-" + state.code(),
                    state.name(),
                    List.of(state.code()),
                    List.of(state.fips()),
                    state.offices(),
                    state.bounds(),
                    null
            );
        }
        CountyEntry county = findCounty(state.code(), filter.county())
                .orElseThrow(() -> new IllegalArgumentException("Unknown county '" + filter.county() + "' in " + state.name()));
        return new Region(
                "US-" + state.code() + "-" + slug(county.name()),
                county.name() + " County, " + state.name(),
                List.of(state.code()),
                List.of(state.fips()),
                state.offices(),
                BoundingBox.around(county.centroid(), county.halfExtentKm()),
                county.name()
        );
    }

    public Region nationwide() {
        LinkedHashSet<String> offices = new LinkedHashSet<>();
        List<String> codes = new ArrayList<>();
        List<String> fips = new ArrayList<>();
        for (StateEntry state : states) {
            codes.add(state.code());
            fips.add(state.fips());
            offices.addAll(state.offices());
        }
        return new Region("US", "United States", codes, fips, new ArrayList<>(offices), nationwideBounds, null);
    }

    public Optional<StateEntry> findState(String nameOrCode) {
        String wanted = nameOrCode.trim();
        return states.stream()
                .filter(state -> state.name().equalsIgnoreCase(wanted) || state.code().equalsIgnoreCase(wanted))
                .findFirst();
    }

    public Optional<CountyEntry> findCounty(String stateCode, String name) {
        String wanted = stripCountySuffix(name);
        return counties.stream()
                .filter(county -> county.state().equalsIgnoreCase(stateCode))
                .filter(county -> county.name().equalsIgnoreCase(wanted))
                .findFirst();
    }

    private static String stripCountySuffix(String name) {
        String trimmed = name.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.endsWith(" county")) {
            return trimmed.substring(0, trimmed.length() - " county".length()).trim();
        }
        return trimmed;
    }

    private static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }

    public record StateEntry(
            String name,
            String code,
            String fips,
            List<String> offices,
            BoundingBox bounds,
            GeoPoint center
    ) {
        public StateEntry {
            offices = offices == null ? List.of() : List.copyOf(offices);
        }
    }

    public record CountyEntry(String name, String state, GeoPoint centroid, double halfExtentKm) {
    }

    private record CatalogFile(BoundingBox nationwideBounds, List<StateEntry> states, List<CountyEntry> counties) {
    }
}
