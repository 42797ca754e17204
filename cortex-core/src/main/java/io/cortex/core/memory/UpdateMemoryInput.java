package io.cortex.core.memory;

import java.util.List;

/**
 * Fields to change on an existing memory. {@code null} content, tags or citations keep the current value.
 */
public record UpdateMemoryInput(String content, List<String> tags, ExpiryUpdate expiry, List<String> citations) {

    public UpdateMemoryInput {
        expiry = expiry == null ? ExpiryUpdate.keep() : expiry;
    }

    public static UpdateMemoryInput content(String content) {
        return new UpdateMemoryInput(content, null, ExpiryUpdate.keep(), null);
    }

    public boolean isEmpty() {
        return content == null && tags == null && expiry.isKeep() && citations == null;
    }
}
