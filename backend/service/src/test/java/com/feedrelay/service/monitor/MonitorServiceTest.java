package com.feedrelay.service.monitor;

import com.feedrelay.core.bus.EventBus;
import com.feedrelay.core.events.SubscriptionStarted;
import com.feedrelay.core.events.SubscriptionStopped;
import com.feedrelay.service.api.RelayDiagnostics;
import com.feedrelay.service.support.RecordingNotificationSink;
import com.feedrelay.service.support.ScriptedContentSource;
import com.feedrelay.service.support.TestContexts;
import com.feedrelay.service.support.Waiting;
import com.feedrelay.sources.api.FetchOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.feedrelay.service.support.ScriptedContentSource.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitorServiceTest {
    private final RecordingNotificationSink sink = new RecordingNotificationSink();
    private final EventBus bus = new EventBus();
    private final List<Object> lifecycle = new CopyOnWriteArrayList<>();
    private MonitorService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void startPollsAndRelaysToItsOwnEndpoint() {
        ScriptedContentSource source = new ScriptedContentSource().then(item("500", "Big Launch Today #artemis"));
        service = service(source);

        assertEquals(StartResult.STARTED, service.startMonitoring("chat-1", "nasa", List.of("Launch")));

        Waiting.awaitTrue(Duration.ofSeconds(2), () -> !sink.messagesTo("chat-1").isEmpty(), "relay");
        assertTrue(sink.messagesTo("chat-1").get(0).contains("Tweet ID: 500"));
        assertEquals(1, lifecycle.stream().filter(SubscriptionStarted.class::isInstance).count());
    }

    @Test
    void duplicateStartIsConflictAndKeepsOriginalKeywords() {
        service = service(new ScriptedContentSource());

        assertEquals(StartResult.STARTED, service.startMonitoring("chat-1", "nasa", List.of("launch")));
        assertEquals(StartResult.CONFLICT, service.startMonitoring("chat-1", "nasa", List.of("weather")));
        assertEquals(1, service.activeSubscriptions("chat-1").size());
        assertEquals(1, lifecycle.stream().filter(SubscriptionStarted.class::isInstance).count());
    }

    @Test
    void concurrentDuplicateStartsYieldOneWinner() throws Exception {
        service = service(new ScriptedContentSource());
        ExecutorService callers = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<StartResult>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                Callable<StartResult> call = () -> {
                    go.await();
                    return service.startMonitoring("chat-1", "nasa", List.of());
                };
                results.add(callers.submit(call));
            }
            go.countDown();

            int started = 0;
            int conflicts = 0;
            for (Future<StartResult> result : results) {
                if (result.get() == StartResult.STARTED) {
                    started++;
                } else {
                    conflicts++;
                }
            }
            assertEquals(1, started);
            assertEquals(7, conflicts);
            assertEquals(1, service.activeSubscriptions().size());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void stopAllOnlyAffectsCallingEndpoint() {
        service = service(new ScriptedContentSource());
        service.startMonitoring("chat-1", "nasa", List.of());
        service.startMonitoring("chat-1", "esa", List.of());
        service.startMonitoring("chat-2", "nasa", List.of());

        StopResult result = service.stopMonitoring("chat-1", "ALL");

        assertEquals(2, result.stoppedCount());
        assertTrue(service.activeSubscriptions("chat-1").isEmpty());
        assertEquals(1, service.activeSubscriptions("chat-2").size());
        Waiting.awaitTrue(Duration.ofSeconds(2),
                () -> lifecycle.stream().filter(SubscriptionStopped.class::isInstance).count() == 2,
                "two workers stopped");
    }

    @Test
    void stopSingleAndUnknownTargets() {
        service = service(new ScriptedContentSource());
        service.startMonitoring("chat-1", "nasa", List.of());

        assertFalse(service.stopMonitoring("chat-1", "esa").found());
        assertFalse(service.stopMonitoring("chat-2", "nasa").found());
        assertFalse(service.stopMonitoring("chat-1", "  ").found());
        assertEquals(1, service.stopMonitoring("chat-1", " nasa ").stoppedCount());
        assertFalse(service.stopMonitoring("chat-1", "nasa").found());
    }

    @Test
    void paddedIdentityIsStoredTrimmedAndStoppable() {
        service = service(new ScriptedContentSource());

        service.startMonitoring(" chat-1 ", " nasa ", List.of());

        assertEquals("nasa", service.activeSubscriptions("chat-1").get(0).sourceIdentity());
        assertEquals(StartResult.CONFLICT, service.startMonitoring("chat-1", "nasa", List.of()));
        assertEquals(1, service.stopMonitoring("chat-1", "nasa").stoppedCount());
    }

    @Test
    void stoppedSubscriptionSendsNothingFurther() throws Exception {
        ScriptedContentSource source = new ScriptedContentSource().always(identity -> item("1", "only once"));
        service = service(source);
        service.startMonitoring("chat-1", "nasa", List.of());
        Waiting.awaitTrue(Duration.ofSeconds(2), () -> sink.deliveries().size() == 1, "first relay");

        service.stopMonitoring("chat-1", "nasa");
        Waiting.awaitTrue(Duration.ofSeconds(2),
                () -> lifecycle.stream().anyMatch(SubscriptionStopped.class::isInstance), "worker exit");
        int fetchesAtStop = source.fetchCount();
        Thread.sleep(100);

        assertEquals(fetchesAtStop, source.fetchCount());
        assertEquals(1, sink.deliveries().size());
    }

    @Test
    void failingSubscriptionDoesNotDisturbOthers() {
        ScriptedContentSource source = new ScriptedContentSource().always(identity -> {
            if (identity.equals("broken")) {
                throw new IllegalStateException("broken upstream");
            }
            if (identity.equals("flaky")) {
                return FetchOutcome.failure("connect timed out", null);
            }
            return item("900", "healthy post");
        });
        service = service(source);

        service.startMonitoring("chat-1", "broken", List.of());
        service.startMonitoring("chat-1", "flaky", List.of());
        service.startMonitoring("chat-2", "healthy", Set.of());

        Waiting.awaitTrue(Duration.ofSeconds(2), () -> !sink.messagesTo("chat-2").isEmpty(), "healthy relay");
        Waiting.awaitTrue(Duration.ofSeconds(2), () -> sink.messagesTo("chat-1").size() >= 4, "repeated diagnostics");

        assertEquals(3, service.activeSubscriptions().size());
        assertEquals(1, sink.messagesTo("chat-2").size());
        assertTrue(sink.messagesTo("chat-1").stream().anyMatch(message -> message.contains("broken upstream")));
        assertTrue(sink.messagesTo("chat-1").stream().anyMatch(message -> message.contains("connect timed out")));
    }

    @Test
    void restartDuringInFlightFetchKeepsDiagnosticsForNewRun() throws Exception {
        CountDownLatch firstFetchEntered = new CountDownLatch(1);
        CountDownLatch releaseFirstFetch = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        ScriptedContentSource source = new ScriptedContentSource().always(identity -> {
            if (calls.incrementAndGet() == 1) {
                firstFetchEntered.countDown();
                try {
                    releaseFirstFetch.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return FetchOutcome.noItem();
        });
        service = service(source);
        RelayDiagnostics diagnostics = new RelayDiagnostics(bus, TestContexts.CLOCK);

        service.startMonitoring("chat-1", "nasa", List.of());
        assertTrue(firstFetchEntered.await(2, TimeUnit.SECONDS));
        service.stopMonitoring("chat-1", "nasa");
        assertEquals(StartResult.STARTED, service.startMonitoring("chat-1", "nasa", List.of()));
        releaseFirstFetch.countDown();

        Waiting.awaitTrue(Duration.ofSeconds(2),
                () -> lifecycle.stream().anyMatch(SubscriptionStopped.class::isInstance), "first run exit");
        assertEquals(1, service.activeSubscriptions("chat-1").size());
        assertTrue(diagnostics.monitorsSnapshot().containsKey("chat-1/nasa"));
    }

    private MonitorService service(ScriptedContentSource source) {
        bus.subscribe(SubscriptionStarted.class, lifecycle::add);
        bus.subscribe(SubscriptionStopped.class, lifecycle::add);
        SubscriptionRegistry registry = new SubscriptionRegistry(SubscriptionRegistry.newWorkerExecutor(), TestContexts.CLOCK);
        return new MonitorService(registry, TestContexts.context(source, sink, bus, Duration.ofMillis(20)));
    }
}
