package com.feedrelay.service.monitor;

import com.feedrelay.core.model.SubscriptionKey;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Tracks which subscriptions have a live worker. Registration, signalling and removal all happen
 * under one lock, so a key is present exactly while its worker has not been asked to stop.
 */
public final class SubscriptionRegistry {
    private static final Logger LOGGER = Logger.getLogger(SubscriptionRegistry.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<SubscriptionKey, Entry> entries = new HashMap<>();
    private final ExecutorService workerExecutor;
    private final Clock clock;

    public SubscriptionRegistry(ExecutorService workerExecutor, Clock clock) {
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public static ExecutorService newWorkerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "monitor-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    /**
     * Registers {@code key} and spawns its worker.
     *
     * @return the worker's cancellation token, or empty if {@code key} is already registered
     */
    public Optional<CancellationToken> start(SubscriptionKey key, WorkerFactory factory) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(factory, "factory is required");
        lock.lock();
        try {
            if (entries.containsKey(key)) {
                return Optional.empty();
            }
            CancellationToken cancellation = new CancellationToken();
            Runnable worker = factory.create(cancellation);
            try {
                workerExecutor.execute(() -> runAndRelease(key, cancellation, worker));
            } catch (RejectedExecutionException e) {
                cancellation.cancel();
                throw new IllegalStateException("Worker executor rejected subscription " + key, e);
            }
            // The worker cannot release its entry before this put: release needs the lock we hold.
            entries.put(key, new Entry(cancellation, clock.instant()));
            return Optional.of(cancellation);
        } finally {
            lock.unlock();
        }
    }

    public boolean stop(SubscriptionKey key) {
        lock.lock();
        try {
            Entry entry = entries.remove(key);
            if (entry == null) {
                return false;
            }
            entry.cancellation().cancel();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int stopAll(Predicate<SubscriptionKey> predicate) {
        lock.lock();
        try {
            int stopped = 0;
            Iterator<Map.Entry<SubscriptionKey, Entry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<SubscriptionKey, Entry> entry = iterator.next();
                if (predicate.test(entry.getKey())) {
                    entry.getValue().cancellation().cancel();
                    iterator.remove();
                    stopped++;
                }
            }
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive(SubscriptionKey key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<ActiveSubscription> snapshot(Predicate<SubscriptionKey> predicate) {
        List<ActiveSubscription> active = new ArrayList<>();
        lock.lock();
        try {
            for (Map.Entry<SubscriptionKey, Entry> entry : entries.entrySet()) {
                if (predicate.test(entry.getKey())) {
                    active.add(new ActiveSubscription(
                            entry.getKey().targetEndpoint(),
                            entry.getKey().sourceIdentity(),
                            entry.getValue().startedAt()
                    ));
                }
            }
        } finally {
            lock.unlock();
        }
        active.sort(Comparator.comparing(ActiveSubscription::targetEndpoint)
                .thenComparing(ActiveSubscription::sourceIdentity));
        return active;
    }

    /**
     * Stops every worker and waits up to {@code timeout} for them to finish; stragglers are interrupted.
     */
    public void shutdown(Duration timeout) {
        int stopped = stopAll(key -> true);
        LOGGER.info(() -> "Shutting down registry, stopped " + stopped + " monitors");
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runAndRelease(SubscriptionKey key, CancellationToken cancellation, Runnable worker) {
        try {
            worker.run();
        } finally {
            release(key, cancellation);
        }
    }

    private void release(SubscriptionKey key, CancellationToken cancellation) {
        lock.lock();
        try {
            Entry current = entries.get(key);
            if (current != null && current.cancellation() == cancellation) {
                entries.remove(key);
                LOGGER.warning(() -> "Worker for " + key + " exited without a stop request; entry released");
            }
        } finally {
            lock.unlock();
        }
    }

    private record Entry(CancellationToken cancellation, Instant startedAt) {
    }
}
