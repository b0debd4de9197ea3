package com.floodsampler.core.model;

import java.util.List;
import java.util.Objects;

public record Region(
        String id,
        String name,
        List<String> stateCodes,
        List<String> stateFips,
        List<String> forecastOffices,
        BoundingBox bounds,
        String county
) {
    public Region {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(bounds, "bounds is required");
        name = name == null ? id : name;
        stateCodes = stateCodes == null ? List.of() : List.copyOf(stateCodes);
        stateFips = stateFips == null ? List.of() : List.copyOf(stateFips);
        forecastOffices = forecastOffices == null ? List.of() : List.copyOf(forecastOffices);
    }

    public boolean coversCounty() {
        return county != null && !county.isBlank();
    }
}
