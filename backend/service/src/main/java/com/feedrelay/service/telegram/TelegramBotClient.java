package com.feedrelay.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.feedrelay.core.util.JsonUtils;
import com.feedrelay.service.config.TelegramConfig;
import com.feedrelay.service.notify.DeliveryResult;
import com.feedrelay.service.notify.NotificationSink;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Bot API calls: {@code sendMessage} for notifications and replies, {@code setWebhook} at startup.
 */
public class TelegramBotClient implements NotificationSink {
    private static final Logger LOGGER = Logger.getLogger(TelegramBotClient.class.getName());
    static final int MAX_MESSAGE_LENGTH = 4096;

    private final HttpClient httpClient;
    private final TelegramConfig config;
    private final String botToken;

    public TelegramBotClient(HttpClient httpClient, TelegramConfig config, String botToken) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.botToken = botToken == null ? "" : botToken.trim();
    }

    @Override
    public DeliveryResult deliver(String message, String targetEndpoint) {
        if (botToken.isEmpty()) {
            return DeliveryResult.failed(0, "bot token is not configured");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("chat_id", targetEndpoint);
        form.put("text", truncate(message));
        try {
            HttpResponse<String> response = post("sendMessage", form);
            if (response.statusCode() == 200) {
                return DeliveryResult.ok(response.statusCode());
            }
            return DeliveryResult.failed(response.statusCode(), "Failed to send message: " + response.body());
        } catch (IOException e) {
            return DeliveryResult.failed(-1, "Error sending message: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed(-1, "Interrupted while sending message");
        }
    }

    /**
     * Points the bot at {@code webhookUrl}. Returns whether Telegram accepted it.
     */
    public boolean registerWebhook(String webhookUrl, String secretToken) {
        if (botToken.isEmpty()) {
            LOGGER.warning("Cannot register webhook: bot token is not configured");
            return false;
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("url", webhookUrl);
        if (secretToken != null && !secretToken.isBlank()) {
            form.put("secret_token", secretToken);
        }
        try {
            HttpResponse<String> response = post("setWebhook", form);
            JsonNode body = JsonUtils.objectMapper().readTree(response.body());
            boolean ok = response.statusCode() == 200 && body.path("ok").asBoolean(false);
            if (!ok) {
                LOGGER.warning(() -> "setWebhook rejected with status " + response.statusCode() + ": " + response.body());
            }
            return ok;
        } catch (IOException e) {
            LOGGER.warning(() -> "setWebhook failed: " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpResponse<String> post(String method, Map<String, String> form) throws IOException, InterruptedException {
        String body = form.entrySet().stream()
                .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.apiBaseUrl() + "/bot" + botToken + "/" + method))
                .timeout(config.requestTimeout())
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    static String truncate(String message) {
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        int end = MAX_MESSAGE_LENGTH - 3;
        if (Character.isHighSurrogate(message.charAt(end - 1))) {
            end--;
        }
        return message.substring(0, end) + "...";
    }
}
