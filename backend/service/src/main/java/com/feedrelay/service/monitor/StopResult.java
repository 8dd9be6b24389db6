package com.feedrelay.service.monitor;

public record StopResult(int stoppedCount) {
    public static final StopResult NONE = new StopResult(0);

    public boolean found() {
        return stoppedCount > 0;
    }
}
