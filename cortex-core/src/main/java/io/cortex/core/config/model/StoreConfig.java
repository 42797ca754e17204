package io.cortex.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String path,
    String memoryExtension,
    String indexExtension,
    int reindexTimeoutSeconds
) {

    public static StoreConfig defaults() {
        return new StoreConfig("~/.cortex/memory", ".md", ".yaml", 60);
    }

    public StoreConfig withPath(String value) {
        return new StoreConfig(value, memoryExtension, indexExtension, reindexTimeoutSeconds);
    }
}
