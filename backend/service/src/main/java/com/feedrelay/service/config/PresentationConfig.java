package com.feedrelay.service.config;

public record PresentationConfig(String zone, String zoneLabel, String permalinkTemplate) {
    public PresentationConfig {
        zone = zone == null || zone.isBlank() ? "Asia/Kolkata" : zone.trim();
        zoneLabel = zoneLabel == null ? "IST" : zoneLabel.trim();
        permalinkTemplate = permalinkTemplate == null || permalinkTemplate.isBlank()
                ? "https://twitter.com/i/web/status/%s"
                : permalinkTemplate.trim();
    }
}
