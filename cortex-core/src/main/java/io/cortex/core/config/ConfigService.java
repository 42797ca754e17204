package io.cortex.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cortex.core.config.model.CortexConfig;
import io.cortex.core.config.model.StoreConfig;
import io.cortex.core.storage.StorageOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CortexConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CortexConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(CortexConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, CortexConfig.class);
    }

    /**
     * Loads the config and applies the {@code CORTEX_STORE_PATH} override from {@code environment}.
     */
    public CortexConfig load(Path configPath, Map<String, String> environment) throws IOException {
        CortexConfig config = load(configPath);
        String override = environment == null ? null : environment.get(ConfigPaths.STORE_PATH_ENV);
        if (override == null || override.isBlank()) {
            return config;
        }
        return config.withStore(config.store().withPath(override.trim()));
    }

    public void save(Path configPath, CortexConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the config (defaults when missing or when {@code overwrite} is set, otherwise the existing values
     * merged over the defaults) and creates the store directory.
     */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        CortexConfig config;
        if (created || overwrite) {
            config = CortexConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path storePath = ConfigPaths.resolveStorePath(config.store().path());
        Files.createDirectories(storePath);
        return new InitResult(configPath, storePath, created, overwritten);
    }

    public StorageOptions storageOptions(CortexConfig config, Clock clock) {
        StoreConfig store = config.store() == null ? StoreConfig.defaults() : config.store();
        return new StorageOptions(
            ConfigPaths.resolveStorePath(store.path()),
            store.memoryExtension(),
            store.indexExtension(),
            null,
            null,
            clock,
            Duration.ofSeconds(Math.max(0, store.reindexTimeoutSeconds()))
        );
    }

    public String toPrettyJson(CortexConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
