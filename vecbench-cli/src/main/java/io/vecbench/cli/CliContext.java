package io.vecbench.cli;

import io.vecbench.core.backend.BackendFactory;
import io.vecbench.core.config.ConfigService;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * What the commands share. {@code env} supplies credentials the config file leaves blank.
 */
public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> env,
    BackendProvider backendProvider,
    Clock clock
) {
    public CliContext {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public CliContext(ConfigService configService, Path configPath, Map<String, String> env) {
        this(configService, configPath, env, factoryProvider(env), Clock.systemUTC());
    }

    private static BackendProvider factoryProvider(Map<String, String> env) {
        Map<String, String> snapshot = env == null ? Map.of() : Map.copyOf(env);
        return (type, config) -> new BackendFactory(config.backends().withEnvironment(snapshot), config.benchmark()).create(type);
    }
}
