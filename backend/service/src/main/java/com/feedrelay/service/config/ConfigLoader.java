package com.feedrelay.service.config;

import com.feedrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    static final String DEFAULTS_RESOURCE = "relay-defaults.json";

    private ConfigLoader() {
    }

    public static RelayConfig load(Path configFile) {
        try (InputStream in = Files.newInputStream(configFile)) {
            return JsonUtils.objectMapper().readValue(in, RelayConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + configFile, e);
        }
    }

    public static RelayConfig loadDefaults() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled config " + DEFAULTS_RESOURCE);
            }
            return JsonUtils.objectMapper().readValue(in, RelayConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading bundled config " + DEFAULTS_RESOURCE, e);
        }
    }

    public static RelayConfig loadOrDefaults(Path configFile) {
        return Files.exists(configFile) ? load(configFile) : loadDefaults();
    }
}
