package com.feedrelay.service.monitor;

public enum Evaluation {
    NOTIFY,
    SKIP_NO_ITEM,
    SKIP_ALREADY_SEEN,
    SKIP_FILTERED;

    public boolean notifies() {
        return this == NOTIFY;
    }
}
