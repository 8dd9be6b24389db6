package com.feedrelay.service.notify;

/**
 * Sends a message to a target endpoint. Failures are reported through the result, not thrown.
 */
public interface NotificationSink {
    DeliveryResult deliver(String message, String targetEndpoint);
}
