package io.cortex.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CortexConfig(StoreConfig store) {

    public static CortexConfig defaults() {
        return new CortexConfig(StoreConfig.defaults());
    }

    public CortexConfig withStore(StoreConfig value) {
        return new CortexConfig(value);
    }
}
