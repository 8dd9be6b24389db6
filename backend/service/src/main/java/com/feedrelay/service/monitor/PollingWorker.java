package com.feedrelay.service.monitor;

import com.feedrelay.core.events.AlertRaised;
import com.feedrelay.core.events.ItemRelayed;
import com.feedrelay.core.events.SubscriptionStopped;
import com.feedrelay.core.model.FeedItem;
import com.feedrelay.service.notify.DeliveryResult;
import com.feedrelay.sources.api.FetchOutcome;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one subscription's poll loop until its cancellation token fires.
 *
 * <p>{@code lastSeenId} and the poll counter are confined to the thread running {@link #run()}.
 * Only one item, the newest, is inspected per poll; several items published between two polls
 * surface as the newest one alone.
 */
public final class PollingWorker implements Runnable {
    private static final Logger LOGGER = Logger.getLogger(PollingWorker.class.getName());

    private final Subscription subscription;
    private final long runId;
    private final CancellationToken cancellation;
    private final MonitorContext context;

    private volatile WorkerState state = WorkerState.RUNNING;
    private String lastSeenId;
    private long pollCount;

    /**
     * @param runId distinguishes this run from earlier or later runs of the same key in lifecycle events
     */
    public PollingWorker(Subscription subscription, long runId, CancellationToken cancellation, MonitorContext context) {
        this.subscription = Objects.requireNonNull(subscription, "subscription is required");
        this.runId = runId;
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation is required");
        this.context = Objects.requireNonNull(context, "context is required");
    }

    @Override
    public void run() {
        LOGGER.info(() -> "Started monitoring " + subscription.sourceIdentity() + " for " + subscription.targetEndpoint());
        try {
            while (!cancellation.isCancelled()) {
                pollOnce();
                if (cancellation.await(context.pollInterval())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = WorkerState.STOPPED;
            context.eventBus().publish(new SubscriptionStopped(
                    context.clock().instant(),
                    subscription.targetEndpoint(),
                    subscription.sourceIdentity(),
                    runId,
                    pollCount
            ));
            LOGGER.info(() -> "Stopped monitoring " + subscription.sourceIdentity() + " for " + subscription.targetEndpoint());
        }
    }

    void pollOnce() {
        pollCount++;
        try {
            FetchOutcome outcome = context.contentSource().fetch(subscription.sourceIdentity());
            if (cancellation.isCancelled()) {
                return;
            }
            if (outcome.failed()) {
                onFetchFailure(outcome);
                return;
            }

            Evaluation evaluation = context.evaluator().evaluate(outcome.latestItem(), lastSeenId, subscription.keywords());
            if (!evaluation.notifies()) {
                LOGGER.fine(() -> "Poll for " + subscription.key() + " skipped: " + evaluation);
                return;
            }

            FeedItem item = outcome.latestItem().orElseThrow();
            lastSeenId = item.id();
            DeliveryResult delivery = deliver(context.formatter().newItem(subscription.sourceIdentity(), item));
            context.eventBus().publish(new ItemRelayed(
                    context.clock().instant(),
                    subscription.targetEndpoint(),
                    subscription.sourceIdentity(),
                    item.id(),
                    delivery.delivered()
            ));
        } catch (RuntimeException e) {
            onUnexpectedFault(e);
        }
    }

    public WorkerState state() {
        return state;
    }

    public Subscription subscription() {
        return subscription;
    }

    String lastSeenId() {
        return lastSeenId;
    }

    private void onFetchFailure(FetchOutcome outcome) {
        String detail = outcome.errorMessage() == null ? "unknown error" : outcome.errorMessage();
        LOGGER.warning(() -> "Fetch failed for " + subscription.key() + ": " + detail);
        context.eventBus().publish(new AlertRaised(
                context.clock().instant(),
                AlertRaised.CATEGORY_FETCH,
                detail,
                details()
        ));
        deliver(context.formatter().fetchFailure(subscription.sourceIdentity(), detail));
    }

    private void onUnexpectedFault(RuntimeException e) {
        LOGGER.log(Level.SEVERE, "Unexpected failure in monitor " + subscription.key(), e);
        context.eventBus().publish(new AlertRaised(
                context.clock().instant(),
                AlertRaised.CATEGORY_WORKER,
                String.valueOf(e.getMessage()),
                details()
        ));
        deliver(context.formatter().workerFault(subscription.sourceIdentity(), e));
    }

    private DeliveryResult deliver(String message) {
        DeliveryResult result;
        try {
            result = context.notificationSink().deliver(message, subscription.targetEndpoint());
        } catch (RuntimeException e) {
            result = DeliveryResult.failed(-1, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (!result.delivered()) {
            DeliveryResult failed = result;
            LOGGER.warning(() -> "Delivery to " + subscription.targetEndpoint() + " failed: " + failed.detail());
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    AlertRaised.CATEGORY_DELIVERY,
                    String.valueOf(failed.detail()),
                    details()
            ));
        }
        return result;
    }

    private Map<String, Object> details() {
        return Map.of(
                "targetEndpoint", subscription.targetEndpoint(),
                "sourceIdentity", subscription.sourceIdentity()
        );
    }
}
