package com.feedrelay.service.monitor;

import com.feedrelay.core.events.SubscriptionStarted;
import com.feedrelay.core.events.SubscriptionStopped;
import com.feedrelay.core.model.SubscriptionKey;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for front-ends: turns committed start/stop requests into registry operations.
 */
public final class MonitorService {
    public static final String STOP_ALL = "all";

    private final SubscriptionRegistry registry;
    private final MonitorContext context;
    private final AtomicLong runSequence = new AtomicLong();

    public MonitorService(SubscriptionRegistry registry, MonitorContext context) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.context = Objects.requireNonNull(context, "context is required");
    }

    public StartResult startMonitoring(String targetEndpoint, String sourceIdentity, Collection<String> keywords) {
        Subscription subscription = Subscription.of(targetEndpoint, sourceIdentity, keywords);
        long runId = runSequence.incrementAndGet();
        Optional<CancellationToken> started;
        try {
            // Published under the registry lock, before the worker exists: precedes this run's stop event.
            started = registry.start(subscription.key(), cancellation -> {
                context.eventBus().publish(new SubscriptionStarted(
                        context.clock().instant(),
                        subscription.targetEndpoint(),
                        subscription.sourceIdentity(),
                        runId,
                        subscription.keywords()
                ));
                return new PollingWorker(subscription, runId, cancellation, context);
            });
        } catch (IllegalStateException e) {
            context.eventBus().publish(new SubscriptionStopped(
                    context.clock().instant(),
                    subscription.targetEndpoint(),
                    subscription.sourceIdentity(),
                    runId,
                    0
            ));
            throw e;
        }
        return started.isPresent() ? StartResult.STARTED : StartResult.CONFLICT;
    }

    /**
     * Stops one subscription, or every subscription of the endpoint when {@code sourceIdentityOrAll}
     * is {@value #STOP_ALL} (any case).
     */
    public StopResult stopMonitoring(String targetEndpoint, String sourceIdentityOrAll) {
        Objects.requireNonNull(targetEndpoint, "targetEndpoint is required");
        String target = sourceIdentityOrAll == null ? "" : sourceIdentityOrAll.trim();
        if (target.isEmpty()) {
            return StopResult.NONE;
        }
        if (STOP_ALL.equals(target.toLowerCase(Locale.ROOT))) {
            return new StopResult(registry.stopAll(key -> key.belongsTo(targetEndpoint)));
        }
        return registry.stop(new SubscriptionKey(targetEndpoint, target)) ? new StopResult(1) : StopResult.NONE;
    }

    public List<ActiveSubscription> activeSubscriptions(String targetEndpoint) {
        return registry.snapshot(key -> key.belongsTo(targetEndpoint));
    }

    public List<ActiveSubscription> activeSubscriptions() {
        return registry.snapshot(key -> true);
    }

    public void shutdown() {
        registry.shutdown(context.pollInterval().plus(Duration.ofSeconds(5)));
    }
}
