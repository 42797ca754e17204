package io.cortex.core.memory;

import java.time.Instant;
import java.util.List;

public record CreateMemoryInput(
    String content,
    List<String> tags,
    String source,
    Instant expiresAt,
    List<String> citations
) {

    public static CreateMemoryInput of(String content, String source) {
        return new CreateMemoryInput(content, List.of(), source, null, List.of());
    }
}
