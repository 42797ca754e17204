package io.cortex.core.memory;

public record RecentMemory(String path, Memory memory, int tokenEstimate) {
}
