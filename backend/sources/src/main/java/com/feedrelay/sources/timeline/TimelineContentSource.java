package com.feedrelay.sources.timeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.feedrelay.core.util.JsonUtils;
import com.feedrelay.sources.api.ContentSource;
import com.feedrelay.sources.api.FetchOutcome;
import com.feedrelay.sources.config.TimelineSourceConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a user's timeline through the RapidAPI user-tweets endpoint, newest first.
 */
public class TimelineContentSource implements ContentSource {
    private static final Logger LOGGER = Logger.getLogger(TimelineContentSource.class.getName());

    private final HttpClient httpClient;
    private final TimelineSourceConfig config;
    private final Clock clock;

    public TimelineContentSource(HttpClient httpClient, TimelineSourceConfig config, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public String name() {
        return "timeline";
    }

    @Override
    public FetchOutcome fetch(String sourceIdentity) {
        HttpRequest request;
        try {
            request = buildRequest(sourceIdentity);
        } catch (IllegalArgumentException e) {
            return FetchOutcome.failure("Invalid request for " + sourceIdentity + ": " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Timeline request failed for " + sourceIdentity, e);
            return FetchOutcome.failure("Timeline request failed for " + sourceIdentity + ": " + rootMessage(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.failure("Timeline request interrupted for " + sourceIdentity, e);
        }

        if (response.statusCode() / 100 != 2) {
            return FetchOutcome.failure(
                    "Timeline request for " + sourceIdentity + " failed with status " + response.statusCode(),
                    null
            );
        }

        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(response.body());
        } catch (JsonProcessingException e) {
            return FetchOutcome.failure("Timeline response for " + sourceIdentity + " is not valid JSON", e);
        }

        return TimelineResponseParser.latestItem(root, clock.instant())
                .map(FetchOutcome::item)
                .orElseGet(() -> {
                    LOGGER.fine(() -> "No recognisable item in timeline response for " + sourceIdentity);
                    return FetchOutcome.noItem();
                });
    }

    HttpRequest buildRequest(String sourceIdentity) {
        if (sourceIdentity == null || sourceIdentity.isBlank()) {
            throw new IllegalArgumentException("source identity is required");
        }
        String query = "user=" + URLEncoder.encode(sourceIdentity.trim(), StandardCharsets.UTF_8)
                + "&count=" + config.pageSize();
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.baseUrl() + "/user-tweets?" + query))
                .GET()
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .header("x-rapidapi-host", config.apiHost());
        if (!config.apiKey().isBlank()) {
            builder.header("x-rapidapi-key", config.apiKey());
        }
        return builder.build();
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
