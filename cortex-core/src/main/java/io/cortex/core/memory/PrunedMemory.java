package io.cortex.core.memory;

import java.time.Instant;

public record PrunedMemory(String path, Instant expiresAt) {
}
