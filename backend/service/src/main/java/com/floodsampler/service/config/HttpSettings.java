package com.floodsampler.service.config;

import java.time.Duration;

public record HttpSettings(Duration connectTimeout, Duration requestTimeout) {
    public HttpSettings {
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(30) : requestTimeout;
    }

    public static HttpSettings defaults() {
        return new HttpSettings(null, null);
    }
}
