package com.feedrelay.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.feedrelay.core.util.JsonUtils;
import com.feedrelay.service.conversation.ConversationManager;
import com.feedrelay.service.monitor.MonitorService;
import com.feedrelay.service.notify.DeliveryResult;
import com.feedrelay.service.notify.NotificationSink;
import com.feedrelay.service.telegram.InboundMessage;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives Telegram webhook updates and exposes read-only status endpoints.
 */
public class WebhookServer {
    private static final Logger LOGGER = Logger.getLogger(WebhookServer.class.getName());
    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final int port;
    private final ConversationManager conversations;
    private final NotificationSink replySink;
    private final MonitorService monitorService;
    private final RelayDiagnostics diagnostics;
    private final String webhookSecret;

    private HttpServer server;
    private ExecutorService executor;

    public WebhookServer(
            int port,
            ConversationManager conversations,
            NotificationSink replySink,
            MonitorService monitorService,
            RelayDiagnostics diagnostics,
            String webhookSecret
    ) {
        this.port = port;
        this.conversations = conversations;
        this.replySink = replySink;
        this.monitorService = monitorService;
        this.diagnostics = diagnostics;
        this.webhookSecret = webhookSecret == null ? "" : webhookSecret;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/", this::handleRoot);
            server.createContext("/webhook", this::handleWebhook);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/subscriptions", this::handleSubscriptions);
            server.createContext("/api/metrics", this::handleMetrics);
            server.start();
            LOGGER.info(() -> "Webhook server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting webhook server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleRoot(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeText(exchange, 200, "Telegram Bot is running");
    }

    private void handleWebhook(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        if (!webhookSecret.isEmpty() && !secretMatches(exchange.getRequestHeaders().getFirst(SECRET_HEADER))) {
            writeJson(exchange, 401, Map.of("error", "invalid_secret_token"));
            return;
        }

        JsonNode update = readUpdate(exchange);
        if (update == null || !update.isObject()) {
            writeJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        LOGGER.fine(() -> "Received update: " + update);

        // Telegram re-delivers any update not answered with 2xx.
        Optional<InboundMessage> message = InboundMessage.fromUpdate(update);
        if (message.isPresent()) {
            try {
                reply(message.get());
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Failed handling update from chat " + message.get().chatId(), e);
            }
        }
        writeText(exchange, 200, "OK");
    }

    private JsonNode readUpdate(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return JsonUtils.objectMapper().readTree(in);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void reply(InboundMessage message) {
        List<String> replies = conversations.handle(message.chatId(), message.text());
        for (String reply : replies) {
            DeliveryResult result = replySink.deliver(reply, message.chatId());
            if (!result.delivered()) {
                LOGGER.warning(() -> "Reply to chat " + message.chatId() + " failed: " + result.detail());
            }
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSubscriptions(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, monitorService.activeSubscriptions());
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnostics.metricsSnapshot());
    }

    private boolean secretMatches(String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8),
                webhookSecret.getBytes(StandardCharsets.UTF_8)
        );
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        write(exchange, status, payload);
    }

    private void writeText(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        write(exchange, status, body.getBytes(StandardCharsets.UTF_8));
    }

    private void write(HttpExchange exchange, int status, byte[] payload) throws IOException {
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
