package com.taildeck.backend.modules.upstream.client;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("app.upstream")
public record UpstreamProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("30s") Duration timeout,
        @DefaultValue("5s") Duration connectTimeout
) {

    public static final String API_PREFIX = "/api/v1";

    public String apiBaseUrl() {
        String trimmed = baseUrl == null ? "" : baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + API_PREFIX;
    }
}
