package io.crewcomposer.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String ROOT_ENV = "CREW_COMPOSER_ROOT";

    private ConfigPaths() {
    }

    public static Path resolveProjectRoot() {
        return resolveProjectRoot(System.getenv());
    }

    static Path resolveProjectRoot(Map<String, String> env) {
        String raw = env.get(ROOT_ENV);
        if (raw == null || raw.isBlank()) {
            return Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize();
        }
        return expandHome(raw.trim()).toAbsolutePath().normalize();
    }

    public static Path configPath(Path projectRoot) {
        return projectRoot.resolve("config").resolve("crew-composer.json");
    }

    public static Path resolve(Path projectRoot, String rawPath) {
        Path path = expandHome(rawPath);
        return path.isAbsolute() ? path : projectRoot.resolve(path).normalize();
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
