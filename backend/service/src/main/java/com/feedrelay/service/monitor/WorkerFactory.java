package com.feedrelay.service.monitor;

@FunctionalInterface
public interface WorkerFactory {
    Runnable create(CancellationToken cancellation);
}
