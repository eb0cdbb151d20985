package io.vecbench.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vecbench.core.config.model.BenchConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    /**
     * Loads the config file merged over {@link BenchConfig#defaults()}, so a partial file only
     * overrides the keys it names.
     */
    public BenchConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return BenchConfig.defaults();
        }

        JsonNode existing = mapper.readTree(Files.readString(configPath));
        if (existing == null || existing.isMissingNode() || existing.isNull()) {
            return BenchConfig.defaults();
        }
        if (!existing.isObject()) {
            throw new IOException("Config root must be a JSON object: " + configPath);
        }
        ObjectNode merged = mapper.valueToTree(BenchConfig.defaults());
        overlay(merged, (ObjectNode) existing);
        return mapper.treeToValue(merged, BenchConfig.class);
    }

    public void save(Path configPath, BenchConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = toPrettyJson(config);
        Path tmp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Writes the config file (defaults when missing or when {@code overwrite} is set, otherwise
     * the existing settings with any newly added keys filled in) and creates the data directory.
     * Credential state in the result includes values supplied through {@code env}.
     */
    public InitResult init(Path configPath, boolean overwrite, Map<String, String> env) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(env, "env must not be null");
        boolean exists = Files.exists(configPath);
        BenchConfig config = exists && !overwrite ? load(configPath) : BenchConfig.defaults();
        save(configPath, config);

        Path dataDir = ConfigPaths.resolveDataDir(config.benchmark().dataDir());
        Files.createDirectories(dataDir);
        if (exists && overwrite) {
            LOG.info("Replaced {} with defaults", configPath);
        }
        return new InitResult(
            configPath,
            dataDir,
            !exists,
            exists && overwrite,
            config.backends().withEnvironment(env),
            Files.exists(ConfigPaths.checkpointPath(dataDir))
        );
    }

    public String toPrettyJson(BenchConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    // Nested sections merge key by key; explicit nulls keep the default.
    private static void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            JsonNode current = target.get(field.getKey());
            if (value.isNull()) {
                continue;
            }
            if (current instanceof ObjectNode section && value.isObject()) {
                overlay(section, (ObjectNode) value);
            } else {
                target.set(field.getKey(), value);
            }
        }
    }
}
