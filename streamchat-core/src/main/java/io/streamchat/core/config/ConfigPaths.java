package io.streamchat.core.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "STREAMCHAT_CONFIG";
    static final String CONFIG_FILE = "config.json";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return home().resolve(".streamchat").resolve(CONFIG_FILE);
    }

    /**
     * The file named by {@code STREAMCHAT_CONFIG}, or the default location. An override that names an existing
     * directory means the config file inside it.
     */
    public static Path fromEnvironment(Map<String, String> environment) {
        String override = environment.get(CONFIG_ENV);
        if (override == null || override.isBlank()) {
            return defaultConfigPath();
        }
        Path path = expandHome(override.trim()).toAbsolutePath().normalize();
        return Files.isDirectory(path) ? path.resolve(CONFIG_FILE) : path;
    }

    static Path expandHome(String raw) {
        if (raw.equals("~")) {
            return home();
        }
        if (raw.startsWith("~/")) {
            return home().resolve(raw.substring(2));
        }
        return Path.of(raw);
    }

    private static Path home() {
        return Path.of(System.getProperty("user.home"));
    }
}
