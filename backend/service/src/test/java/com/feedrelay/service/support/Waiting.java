package com.feedrelay.service.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Waiting {
    private Waiting() {
    }

    public static void awaitTrue(Duration timeout, BooleanSupplier condition, String description) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for " + description);
            }
        }
        if (!condition.getAsBoolean()) {
            fail("Timed out after " + timeout.toMillis() + "ms waiting for " + description);
        }
    }
}
