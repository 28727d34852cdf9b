package io.lexstream.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String HOME_PROPERTY = "lexstream.home";

    private ConfigPaths() {
    }

    public static Path home() {
        String override = System.getProperty(HOME_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        return userHome().resolve(".lexstream");
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    public static Path defaultHistoryPath() {
        return home().resolve("history").resolve("turns.json");
    }

    public static Path resolveHistory(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultHistoryPath();
        }
        if (rawPath.equals("~")) {
            return userHome();
        }
        if (rawPath.startsWith("~/")) {
            return userHome().resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
