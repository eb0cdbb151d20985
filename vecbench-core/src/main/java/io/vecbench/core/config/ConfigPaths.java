package io.vecbench.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String CHECKPOINT_FILE = "recall-benchmark-checkpoint.json";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".vecbench", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of("data");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path checkpointPath(Path dataDir) {
        return dataDir.resolve(CHECKPOINT_FILE);
    }
}
