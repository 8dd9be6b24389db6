package com.feedrelay.service.monitor;

public enum StartResult {
    STARTED,
    CONFLICT
}
