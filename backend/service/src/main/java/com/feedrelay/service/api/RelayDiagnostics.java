package com.feedrelay.service.api;

import com.feedrelay.core.bus.EventBus;
import com.feedrelay.core.events.AlertRaised;
import com.feedrelay.core.events.ItemRelayed;
import com.feedrelay.core.events.SubscriptionStarted;
import com.feedrelay.core.events.SubscriptionStopped;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class RelayDiagnostics {
    private final Clock clock;
    private final Instant startedAt;
    private final LongAdder subscriptionsStarted = new LongAdder();
    private final LongAdder subscriptionsStopped = new LongAdder();
    private final LongAdder itemsRelayed = new LongAdder();
    private final LongAdder fetchFailures = new LongAdder();
    private final LongAdder deliveryFailures = new LongAdder();
    private final LongAdder workerFaults = new LongAdder();
    private final ConcurrentHashMap<String, MonitorStatus> monitorStatuses = new ConcurrentHashMap<>();

    public RelayDiagnostics(EventBus eventBus, Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        eventBus.subscribe(SubscriptionStarted.class, this::onStarted);
        eventBus.subscribe(SubscriptionStopped.class, this::onStopped);
        eventBus.subscribe(ItemRelayed.class, this::onRelayed);
        eventBus.subscribe(AlertRaised.class, this::onAlert);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("uptimeSeconds", clock.instant().getEpochSecond() - startedAt.getEpochSecond());
        metrics.put("subscriptionsStarted", subscriptionsStarted.longValue());
        metrics.put("subscriptionsStopped", subscriptionsStopped.longValue());
        metrics.put("itemsRelayed", itemsRelayed.longValue());
        metrics.put("fetchFailures", fetchFailures.longValue());
        metrics.put("deliveryFailures", deliveryFailures.longValue());
        metrics.put("workerFaults", workerFaults.longValue());
        metrics.put("monitors", monitorsSnapshot());
        return metrics;
    }

    public Map<String, Object> monitorsSnapshot() {
        Map<String, Object> monitors = new TreeMap<>();
        for (Map.Entry<String, MonitorStatus> entry : monitorStatuses.entrySet()) {
            monitors.put(entry.getKey(), entry.getValue().toMap());
        }
        return monitors;
    }

    private void onStarted(SubscriptionStarted event) {
        subscriptionsStarted.increment();
        monitorStatuses.put(key(event.targetEndpoint(), event.sourceIdentity()), MonitorStatus.started(event.runId()));
    }

    private void onStopped(SubscriptionStopped event) {
        subscriptionsStopped.increment();
        // A restarted key has a newer run; a late stop from the old run must not drop it.
        monitorStatuses.computeIfPresent(
                key(event.targetEndpoint(), event.sourceIdentity()),
                (name, status) -> status.runId() == event.runId() ? null : status
        );
    }

    private void onRelayed(ItemRelayed event) {
        itemsRelayed.increment();
        monitorStatuses.computeIfPresent(
                key(event.targetEndpoint(), event.sourceIdentity()),
                (name, status) -> status.withRelayed(event.itemId(), event.timestamp())
        );
    }

    private void onAlert(AlertRaised event) {
        if (event.category() == null) {
            return;
        }
        switch (event.category()) {
            case AlertRaised.CATEGORY_FETCH:
                fetchFailures.increment();
                break;
            case AlertRaised.CATEGORY_DELIVERY:
                deliveryFailures.increment();
                break;
            case AlertRaised.CATEGORY_WORKER:
                workerFaults.increment();
                break;
            default:
                return;
        }
        if (event.details() == null) {
            return;
        }
        Object endpoint = event.details().get("targetEndpoint");
        Object source = event.details().get("sourceIdentity");
        if (endpoint instanceof String && source instanceof String) {
            monitorStatuses.computeIfPresent(
                    key((String) endpoint, (String) source),
                    (name, status) -> status.withError(event.category() + ": " + event.message(), event.timestamp())
            );
        }
    }

    private static String key(String endpoint, String source) {
        return endpoint + "/" + source;
    }

    private record MonitorStatus(
            long runId,
            String lastItemId,
            Instant lastRelayedAt,
            String lastError,
            Instant lastErrorAt
    ) {
        private static MonitorStatus started(long runId) {
            return new MonitorStatus(runId, null, null, null, null);
        }

        private MonitorStatus withRelayed(String itemId, Instant at) {
            return new MonitorStatus(runId, itemId, at, lastError, lastErrorAt);
        }

        private MonitorStatus withError(String error, Instant at) {
            return new MonitorStatus(runId, lastItemId, lastRelayedAt, error, at);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("runId", runId);
            map.put("lastItemId", lastItemId);
            map.put("lastRelayedAt", lastRelayedAt == null ? null : lastRelayedAt.toString());
            map.put("lastError", lastError);
            map.put("lastErrorAt", lastErrorAt == null ? null : lastErrorAt.toString());
            return map;
        }
    }
}
