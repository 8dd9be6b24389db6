package com.feedrelay.service.config;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Credentials read from the environment. Missing values are reported but do not stop startup;
 * the affected calls fail at runtime and surface through the usual diagnostics.
 */
public record RelaySecrets(String botToken, String rapidApiKey, String webhookUrl, String webhookSecret) {
    public static final String BOT_TOKEN_ENV = "TELEGRAM_BOT_TOKEN";
    public static final String RAPIDAPI_KEY_ENV = "RAPIDAPI_KEY";
    public static final String WEBHOOK_URL_ENV = "WEBHOOK_URL";
    public static final String WEBHOOK_SECRET_ENV = "WEBHOOK_SECRET";

    public static RelaySecrets fromEnvironment(Map<String, String> env, Consumer<String> reportMissing) {
        return new RelaySecrets(
                required(env, BOT_TOKEN_ENV, reportMissing),
                required(env, RAPIDAPI_KEY_ENV, reportMissing),
                required(env, WEBHOOK_URL_ENV, reportMissing),
                env.getOrDefault(WEBHOOK_SECRET_ENV, "").trim()
        );
    }

    private static String required(Map<String, String> env, String name, Consumer<String> reportMissing) {
        String value = env.getOrDefault(name, "").trim();
        if (value.isEmpty()) {
            reportMissing.accept(name + " is not set in environment variables.");
        }
        return value;
    }
}
