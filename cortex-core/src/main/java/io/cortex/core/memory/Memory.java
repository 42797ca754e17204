package io.cortex.core.memory;

import java.time.Instant;
import java.util.Objects;

public record Memory(MemoryMetadata metadata, String content) {

    public Memory {
        Objects.requireNonNull(metadata, "metadata must not be null");
        content = content == null ? "" : content;
    }

    public boolean isExpired(Instant now) {
        return metadata.isExpired(now);
    }
}
