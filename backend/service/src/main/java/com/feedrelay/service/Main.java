package com.feedrelay.service;

import com.feedrelay.core.bus.EventBus;
import com.feedrelay.service.api.RelayDiagnostics;
import com.feedrelay.service.api.WebhookServer;
import com.feedrelay.service.config.ConfigLoader;
import com.feedrelay.service.config.RelayConfig;
import com.feedrelay.service.config.RelaySecrets;
import com.feedrelay.service.conversation.ConversationManager;
import com.feedrelay.service.http.HttpClientFactory;
import com.feedrelay.service.monitor.DedupFilterEvaluator;
import com.feedrelay.service.monitor.MonitorContext;
import com.feedrelay.service.monitor.MonitorService;
import com.feedrelay.service.monitor.SubscriptionRegistry;
import com.feedrelay.service.notify.MessageFormatter;
import com.feedrelay.service.telegram.TelegramBotClient;
import com.feedrelay.sources.timeline.TimelineContentSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configFile = Path.of(args.length > 0 ? args[0] : "config/relay.json");
        RelayConfig config = ConfigLoader.loadOrDefaults(configFile);
        RelaySecrets secrets = RelaySecrets.fromEnvironment(System.getenv(), LOGGER::severe);
        Clock clock = Clock.systemUTC();

        HttpClient sharedHttpClient = HttpClientFactory.create(config.connectTimeout());
        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(event -> LOGGER.fine(() -> "Event " + event.type() + ": " + event));
        RelayDiagnostics diagnostics = new RelayDiagnostics(eventBus, clock);

        TelegramBotClient botClient = new TelegramBotClient(sharedHttpClient, config.telegram(), secrets.botToken());
        MonitorContext context = new MonitorContext(
                new TimelineContentSource(sharedHttpClient, config.timeline().withApiKey(secrets.rapidApiKey()), clock),
                botClient,
                MessageFormatter.from(config.presentation()),
                new DedupFilterEvaluator(),
                eventBus,
                clock,
                config.pollInterval()
        );
        MonitorService monitorService = new MonitorService(
                new SubscriptionRegistry(SubscriptionRegistry.newWorkerExecutor(), clock),
                context
        );

        WebhookServer webhookServer = new WebhookServer(
                config.port(),
                new ConversationManager(monitorService),
                botClient,
                monitorService,
                diagnostics,
                secrets.webhookSecret()
        );
        webhookServer.start();
        registerWebhook(botClient, secrets);

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            webhookServer.stop();
            monitorService.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static String webhookEndpoint(String baseUrl) {
        String trimmed = baseUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + "/webhook";
    }

    private static void registerWebhook(TelegramBotClient botClient, RelaySecrets secrets) {
        if (secrets.webhookUrl().isBlank()) {
            LOGGER.warning("WEBHOOK_URL is not set; skipping webhook registration.");
            return;
        }
        String endpoint = webhookEndpoint(secrets.webhookUrl());
        LOGGER.info(() -> "Setting webhook to " + endpoint);
        boolean registered = botClient.registerWebhook(endpoint, secrets.webhookSecret());
        LOGGER.info(() -> "Webhook set: " + registered);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning(() -> "Could not load bundled logging.properties: " + e.getMessage());
        }
    }
}
