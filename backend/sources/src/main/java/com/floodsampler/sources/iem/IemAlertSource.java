package com.floodsampler.sources.iem;

import com.fasterxml.jackson.databind.JsonNode;
import com.floodsampler.core.model.AlertRecord;
import com.floodsampler.core.model.AlertSeverity;
import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.sources.api.AlertSource;
import com.floodsampler.sources.api.SourceDataException;
import com.floodsampler.sources.http.UpstreamHttp;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public final class IemAlertSource implements AlertSource {
    public static final String NAME = "iem-vtec-fl";
    public static final String DEFAULT_BASE_URL = "https://mesonet.agron.iastate.edu";

    private static final Logger LOGGER = Logger.getLogger(IemAlertSource.class.getName());
    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd[ ]['T']HH:mm[:ss]");

    private final UpstreamHttp http;
    private final AreaLocator areaLocator;
    private final String baseUrl;

    public IemAlertSource(UpstreamHttp http, AreaLocator areaLocator) {
        this(http, areaLocator, DEFAULT_BASE_URL);
    }

    public IemAlertSource(UpstreamHttp http, AreaLocator areaLocator, String baseUrl) {
        this.http = http;
        this.areaLocator = areaLocator;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<AlertRecord> fetch(Region region, TimeInterval interval) {
        if (interval.isEmpty()) {
            return List.of();
        }
        int firstYear = interval.start().atZone(ZoneOffset.UTC).getYear();
        int lastYear = interval.end().minusNanos(1).atZone(ZoneOffset.UTC).getYear();

        Map<String, AlertRecord> byId = new LinkedHashMap<>();
        for (String office : region.forecastOffices()) {
            for (int year = firstYear; year <= lastYear; year++) {
                JsonNode root = http.getJson(NAME, listingUri(office, year));
                JsonNode events = root.path("events");
                if (!events.isArray()) {
                    throw new SourceDataException(NAME, "Listing for " + office + "/" + year + " has no events array");
                }
                for (JsonNode event : events) {
                    toRecord(office, year, event, region, interval).ifPresent(record -> byId.putIfAbsent(record.id(), record));
                }
            }
        }

        List<AlertRecord> records = new ArrayList<>(byId.values());
        records.sort(Comparator.comparing(AlertRecord::onset).thenComparing(AlertRecord::id));
        return records;
    }

    private URI listingUri(String office, int year) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("wfo", office);
        params.put("phenomena", "FL");
        params.put("year", Integer.toString(year));
        return URI.create(baseUrl + "/json/vtec_events.py?" + UpstreamHttp.query(params));
    }

    private Optional<AlertRecord> toRecord(String office, int year, JsonNode event, Region region, TimeInterval interval) {
        Instant issued = parseInstant(event.path("issue").asText(""), "issue");
        if (!interval.contains(issued)) {
            return Optional.empty();
        }
        String locations = event.path("locations").asText("");
        if (!mentionsRegion(locations, region)) {
            return Optional.empty();
        }

        String significance = event.path("significance").asText("");
        AlertSeverity severity;
        try {
            severity = AlertSeverity.fromVtecSignificance(significance);
        } catch (IllegalArgumentException unknownCode) {
            LOGGER.fine(() -> "Skipping " + office + " event with significance '" + significance + "'");
            return Optional.empty();
        }

        Optional<GeoPoint> point = areaLocator.locate(locations, region);
        if (point.isEmpty()) {
            LOGGER.fine(() -> "Skipping " + office + " event with unlocatable area: " + locations);
            return Optional.empty();
        }

        JsonNode expireNode = event.path("expire");
        Instant expires = expireNode.isTextual() && !expireNode.asText().isBlank()
                ? parseInstant(expireNode.asText(), "expire")
                : issued;
        String eventId = event.path("eventid").asText("");
        if (eventId.isBlank()) {
            throw new SourceDataException(NAME, "Event without eventid from " + office + "/" + year);
        }
        String id = String.format(Locale.ROOT, "%s-%d-FL.%s.%s", office, year, significance.toUpperCase(Locale.ROOT), eventId);
        String name = event.path("ph_name").asText("Flood") + " " + event.path("sig_name").asText(severity.name());

        return Optional.of(new AlertRecord(
                id,
                office,
                name.trim(),
                locations,
                severity,
                issued,
                expires,
                List.of(point.get()),
                event.path("area").asDouble(0.0)
        ));
    }

    private static boolean mentionsRegion(String locations, Region region) {
        if (region.stateCodes().isEmpty()) {
            return true;
        }
        for (String state : region.stateCodes()) {
            String tag = "[" + state.toUpperCase(Locale.ROOT) + "]";
            if (!region.coversCounty()) {
                if (locations.contains(tag)) {
                    return true;
                }
                continue;
            }
            Pattern county = Pattern.compile("(^|[,;]\\s*)" + Pattern.quote(region.county()) + "\\s*(County\\s*)?" + Pattern.quote(tag),
                    Pattern.CASE_INSENSITIVE);
            if (county.matcher(locations).find()) {
                return true;
            }
        }
        return false;
    }

    private static Instant parseInstant(String text, String field) {
        if (text.isBlank()) {
            throw new SourceDataException(NAME, "Event is missing '" + field + "'");
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notIso) {
            try {
                return LocalDateTime.parse(text.endsWith("Z") ? text.substring(0, text.length() - 1) : text, LOCAL_FORMAT)
                        .toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new SourceDataException(NAME, "Unparsable '" + field + "' value: " + text, e);
            }
        }
    }
}
