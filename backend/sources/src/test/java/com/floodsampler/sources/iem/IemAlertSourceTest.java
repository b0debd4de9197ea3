package com.floodsampler.sources.iem;

import com.floodsampler.core.model.AlertRecord;
import com.floodsampler.core.model.AlertSeverity;
import com.floodsampler.core.model.BoundingBox;
import com.floodsampler.core.model.GeoPoint;
import com.floodsampler.core.model.Region;
import com.floodsampler.core.model.TimeInterval;
import com.floodsampler.sources.api.SourceDataException;
import com.floodsampler.sources.api.SourceUnavailableException;
import com.floodsampler.sources.http.UpstreamHttp;
import com.floodsampler.sources.support.Fixtures;
import com.floodsampler.sources.support.StubServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IemAlertSourceTest {
    private static final BoundingBox TEXAS_BOUNDS = new BoundingBox(25.8, -106.7, 36.5, -93.5);
    private static final Region TEXAS = new Region("US-TX", "Texas", List.of("TX"), List.of("48"), List.of("EWX"),
            TEXAS_BOUNDS, null);
    private static final Region TRAVIS = new Region("US-TX-travis", "Travis County, Texas", List.of("TX"),
            List.of("48"), List.of("EWX"), new BoundingBox(30.0, -98.05, 30.54, -97.43), "Travis");
    private static final TimeInterval FIRST_HALF_2025 = new TimeInterval(
            Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-07-01T00:00:00Z"));
    private static final Map<String, GeoPoint> COUNTIES = Map.of(
            "Travis", new GeoPoint(30.2672, -97.7431),
            "Bexar", new GeoPoint(29.4241, -98.4936),
            "Atascosa", new GeoPoint(28.8936, -98.5272)
    );
    private static final AreaLocator LOCATOR = (area, region) -> COUNTIES.entrySet().stream()
            .filter(entry -> area.startsWith(entry.getKey()))
            .map(Map.Entry::getValue)
            .findFirst();

    private StubServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void parsesEventsForStateRegion() throws Exception {
        server = new StubServer()
                .route("/json/vtec_events.py", exchange -> StubServer.respond(exchange, 200, Fixtures.read("fixtures/iem/vtec_events_ewx.json")))
                .start();

        List<AlertRecord> alerts = source(LOCATOR).fetch(TEXAS, FIRST_HALF_2025);

        assertEquals(List.of("EWX-2025-FL.Y.13", "EWX-2025-FL.W.12", "EWX-2025-FL.W.17"),
                alerts.stream().map(AlertRecord::id).toList());

        AlertRecord advisory = alerts.get(0);
        assertEquals(AlertSeverity.ADVISORY, advisory.severity());
        assertEquals(Instant.parse("2025-03-10T08:00:00Z"), advisory.onset());
        assertEquals(Instant.parse("2025-03-10T20:00:00Z"), advisory.expires());
        assertEquals("Flood Advisory", advisory.event());

        AlertRecord warning = alerts.get(1);
        assertEquals(AlertSeverity.WARNING, warning.severity());
        assertEquals(COUNTIES.get("Travis"), warning.representativePoint());
        assertEquals(250.0, warning.areaSqMiles());

        AlertRecord noExpiry = alerts.get(2);
        assertEquals(noExpiry.onset(), noExpiry.expires());

        String query = server.requests().get(0).getQuery();
        assertTrue(query.contains("wfo=EWX"));
        assertTrue(query.contains("phenomena=FL"));
        assertTrue(query.contains("year=2025"));
    }

    @Test
    void countyRegionKeepsOnlyEventsNamingTheCounty() throws Exception {
        server = new StubServer()
                .route("/json/vtec_events.py", exchange -> StubServer.respond(exchange, 200, Fixtures.read("fixtures/iem/vtec_events_ewx.json")))
                .start();

        List<AlertRecord> alerts = source(LOCATOR).fetch(TRAVIS, FIRST_HALF_2025);

        assertEquals(List.of("EWX-2025-FL.W.12"), alerts.stream().map(AlertRecord::id).toList());
    }

    @Test
    void unlocatableEventsAreSkipped() throws Exception {
        server = new StubServer()
                .route("/json/vtec_events.py", exchange -> StubServer.respond(exchange, 200, Fixtures.read("fixtures/iem/vtec_events_ewx.json")))
                .start();

        List<AlertRecord> alerts = source((area, region) -> Optional.empty()).fetch(TEXAS, FIRST_HALF_2025);

        assertTrue(alerts.isEmpty());
    }

    @Test
    void requestsEveryYearTouchedByInterval() throws Exception {
        server = new StubServer()
                .route("/json/vtec_events.py", exchange -> StubServer.respond(exchange, 200, "{\"events\": []}"))
                .start();
        TimeInterval winter = new TimeInterval(Instant.parse("2024-12-01T00:00:00Z"), Instant.parse("2025-01-01T00:00:00Z"));
        TimeInterval spanning = new TimeInterval(Instant.parse("2024-12-01T00:00:00Z"), Instant.parse("2025-02-01T00:00:00Z"));

        source(LOCATOR).fetch(TEXAS, winter);
        assertEquals(1, server.requests().size());

        source(LOCATOR).fetch(TEXAS, spanning);
        List<String> queries = server.requests().stream().map(uri -> uri.getQuery()).toList();
        assertEquals(3, queries.size());
        assertTrue(queries.get(1).contains("year=2024"));
        assertTrue(queries.get(2).contains("year=2025"));
    }

    @Test
    void mapsUpstreamFailuresToSourceErrors() throws Exception {
        server = new StubServer()
                .route("/json/vtec_events.py", exchange -> {
                    String query = exchange.getRequestURI().getQuery();
                    if (query.contains("year=2024")) {
                        StubServer.respond(exchange, 503, "{}");
                    } else {
                        StubServer.respond(exchange, 200, "{\"error\": \"no such office\"}");
                    }
                })
                .start();

        SourceUnavailableException unavailable = assertThrows(SourceUnavailableException.class, () -> source(LOCATOR)
                .fetch(TEXAS, new TimeInterval(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z"))));
        assertTrue(unavailable.retryable());
        assertEquals(IemAlertSource.NAME, unavailable.source());

        SourceDataException malformed = assertThrows(SourceDataException.class, () -> source(LOCATOR).fetch(TEXAS, FIRST_HALF_2025));
        assertFalse(malformed.retryable());
    }

    private IemAlertSource source(AreaLocator locator) {
        UpstreamHttp http = new UpstreamHttp(HttpClient.newHttpClient(), Duration.ofSeconds(5), "flood-sampler-test");
        return new IemAlertSource(http, locator, server.baseUrl() + "/");
    }
}
