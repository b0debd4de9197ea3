package com.floodsampler.sources.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.floodsampler.core.util.JsonUtils;
import com.floodsampler.sources.api.SourceDataException;
import com.floodsampler.sources.api.SourceUnavailableException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

public final class UpstreamHttp {
    private final HttpClient httpClient;
    private final Duration timeout;
    private final String userAgent;

    public UpstreamHttp(HttpClient httpClient, Duration timeout, String userAgent) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    public JsonNode getJson(String source, URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/geo+json,application/json")
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException(source, "Request failed for " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(source, "Interrupted while requesting " + uri, e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new SourceUnavailableException(source, "Status " + status + " for " + uri);
        }
        if (status / 100 != 2) {
            throw new SourceDataException(source, "Unexpected status " + status + " for " + uri);
        }
        try {
            return JsonUtils.objectMapper().readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new SourceDataException(source, "Response from " + uri + " is not valid JSON", e);
        }
    }

    public static String query(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((name, value) -> joiner.add(
                URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }
}
