package com.feedrelay.service.notify;

public record DeliveryResult(boolean delivered, int statusCode, String detail) {
    public static DeliveryResult ok(int statusCode) {
        return new DeliveryResult(true, statusCode, null);
    }

    public static DeliveryResult failed(int statusCode, String detail) {
        return new DeliveryResult(false, statusCode, detail);
    }
}
