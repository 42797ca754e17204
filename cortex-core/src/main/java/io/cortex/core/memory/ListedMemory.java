package io.cortex.core.memory;

import java.time.Instant;

public record ListedMemory(String path, int tokenEstimate, String summary, Instant expiresAt, boolean expired) {
}
