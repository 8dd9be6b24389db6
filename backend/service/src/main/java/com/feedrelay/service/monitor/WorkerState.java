package com.feedrelay.service.monitor;

public enum WorkerState {
    RUNNING,
    STOPPED
}
