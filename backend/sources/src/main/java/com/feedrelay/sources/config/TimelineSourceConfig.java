package com.feedrelay.sources.config;

import java.time.Duration;

public record TimelineSourceConfig(
        String baseUrl,
        String apiHost,
        String apiKey,
        int pageSize,
        Duration requestTimeout
) {
    public static final String DEFAULT_BASE_URL = "https://twitter241.p.rapidapi.com";
    public static final String DEFAULT_API_HOST = "twitter241.p.rapidapi.com";
    public static final int DEFAULT_PAGE_SIZE = 20;

    public TimelineSourceConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
        apiHost = apiHost == null || apiHost.isBlank() ? DEFAULT_API_HOST : apiHost.trim();
        apiKey = apiKey == null ? "" : apiKey.trim();
        pageSize = pageSize <= 0 ? DEFAULT_PAGE_SIZE : pageSize;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
    }

    public TimelineSourceConfig withApiKey(String key) {
        return new TimelineSourceConfig(baseUrl, apiHost, key, pageSize, requestTimeout);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
