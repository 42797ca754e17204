package io.cortex.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String STORE_PATH_ENV = "CORTEX_STORE_PATH";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".cortex", "config.json");
    }

    public static Path resolveStorePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".cortex", "memory");
        }
        if (rawPath.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
