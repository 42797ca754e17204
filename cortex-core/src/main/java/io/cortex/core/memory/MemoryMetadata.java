package io.cortex.core.memory;

import java.time.Instant;
import java.util.List;

/**
 * Metadata stored in the front matter of a memory file.
 *
 * @param expiresAt instant from which the memory counts as expired, or {@code null} when it never expires
 */
public record MemoryMetadata(
    Instant createdAt,
    Instant updatedAt,
    List<String> tags,
    String source,
    Instant expiresAt,
    List<String> citations
) {

    public MemoryMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
