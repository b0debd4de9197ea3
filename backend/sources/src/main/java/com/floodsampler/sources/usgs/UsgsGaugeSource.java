package com.floodsampler.sources.usgs;

import com.fasterxml.jackson.databind.JsonNode;
import com.floodsampler.core.model.GaugeReading;
import com.floodsampler.core.model.GaugeRecord;
import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.sources.api.GaugeSource;
import com.floodsampler.sources.api.SourceDataException;
import com.floodsampler.sources.http.UpstreamHttp;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class UsgsGaugeSource implements GaugeSource {
    public static final String NAME = "usgs-gage-height";
    public static final String DEFAULT_BASE_URL = "https://api.waterdata.usgs.gov/ogcapi/v0";

    private static final Logger LOGGER = Logger.getLogger(UsgsGaugeSource.class.getName());
    private static final String GAGE_HEIGHT = "00065";

    private final UpstreamHttp http;
    private final String baseUrl;
    private final String apiKey;
    private final int pageSize;
    private final int maxPages;

    public UsgsGaugeSource(
            UpstreamHttp http,
            String baseUrl,
            String apiKey,
            int pageSize,
            int maxPages
    ) {
        if (pageSize < 1 || maxPages < 1) {
            throw new IllegalArgumentException("pageSize and maxPages must be positive");
        }
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<GaugeRecord> fetch(Region region, TimeInterval interval) {
        Map<String, Station> stations = new TreeMap<>();
        Map<String, String> stationParams = new LinkedHashMap<>();
        stationParams.put("f", "json");
        stationParams.put("site_type_code", "ST");
        stationParams.put("bbox", region.bounds().toQueryParam());
        stationParams.put("limit", Integer.toString(pageSize));
        forEachFeature("monitoring-locations", stationParams, feature -> readStation(feature)
                .ifPresent(station -> stations.putIfAbsent(station.id(), station)));

        if (stations.isEmpty() || interval.isEmpty()) {
            return List.of();
        }

        Map<String, List<GaugeReading>> readings = new TreeMap<>();
        Map<String, String> dailyParams = new LinkedHashMap<>();
        dailyParams.put("f", "json");
        dailyParams.put("parameter_code", GAGE_HEIGHT);
        dailyParams.put("bbox", region.bounds().toQueryParam());
        dailyParams.put("time", interval.start() + "/" + interval.end());
        dailyParams.put("limit", Integer.toString(pageSize));
        forEachFeature("daily", dailyParams, feature -> {
            JsonNode props = feature.path("properties");
            String stationId = stripAgency(props.path("monitoring_location_id").asText(""));
            if (!stations.containsKey(stationId)) {
                return;
            }
            Double value = number(props.path("value"));
            String time = props.path("time").asText("");
            if (value == null || time.isBlank()) {
                return;
            }
            Instant observedAt = parseTime(time);
            if (interval.contains(observedAt)) {
                readings.computeIfAbsent(stationId, ignored -> new ArrayList<>()).add(new GaugeReading(observedAt, value));
            }
        });

        List<GaugeRecord> records = new ArrayList<>();
        for (Station station : stations.values()) {
            List<GaugeReading> series = readings.getOrDefault(station.id(), List.of()).stream()
                    .sorted(Comparator.comparing(GaugeReading::observedAt).thenComparingDouble(GaugeReading::stageFt))
                    .toList();
            records.add(new GaugeRecord(station.id(), station.name(), station.location(), null, series));
        }
        return records;
    }

    private void forEachFeature(String collection, Map<String, String> params, Consumer<JsonNode> consumer) {
        Map<String, String> query = new LinkedHashMap<>(params);
        if (!apiKey.isBlank()) {
            query.put("api_key", apiKey);
        }
        URI next = URI.create(baseUrl + "/collections/" + collection + "/items?" + UpstreamHttp.query(query));
        for (int page = 0; page < maxPages && next != null; page++) {
            JsonNode root = http.getJson(NAME, next);
            JsonNode features = root.path("features");
            if (!features.isArray()) {
                throw new SourceDataException(NAME, "Response for " + collection + " has no features array");
            }
            features.forEach(consumer);
            next = nextLink(root);
            if (next != null && page == maxPages - 1) {
                LOGGER.warning("Stopping " + collection + " paging after " + maxPages + " pages");
            }
        }
    }

    private static Optional<Station> readStation(JsonNode feature) {
        JsonNode props = feature.path("properties");
        String id = props.path("monitoring_location_number").asText("");
        if (id.isBlank()) {
            id = stripAgency(feature.path("id").asText(""));
        }
        JsonNode geometry = feature.path("geometry");
        JsonNode coordinates = geometry.path("coordinates");
        if (id.isBlank() || !"Point".equals(geometry.path("type").asText()) || coordinates.size() < 2) {
            return Optional.empty();
        }
        try {
            GeoPoint location = new GeoPoint(coordinates.get(1).asDouble(), coordinates.get(0).asDouble());
            return Optional.of(new Station(id, props.path("monitoring_location_name").asText(id), location));
        } catch (IllegalArgumentException badCoordinates) {
            return Optional.empty();
        }
    }

    private static URI nextLink(JsonNode root) {
        for (JsonNode link : root.path("links")) {
            if ("next".equals(link.path("rel").asText())) {
                String href = link.path("href").asText("");
                if (!href.isBlank()) {
                    return URI.create(href);
                }
            }
        }
        return null;
    }

    private static String stripAgency(String id) {
        int dash = id.indexOf('-');
        return dash >= 0 ? id.substring(dash + 1) : id;
    }

    private static Double number(JsonNode value) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant parseTime(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new SourceDataException(NAME, "Unparsable reading time: " + text, e);
        }
    }

    private record Station(String id, String name, GeoPoint location) {
    }
}
