package io.cortex.core.memory;

import java.time.Instant;

/**
 * @param category category to list recursively, {@code null} to start from every top-level category
 */
public record ListOptions(String category, boolean includeExpired, Instant now) {

    public static ListOptions all() {
        return new ListOptions(null, false, null);
    }

    public static ListOptions category(String category) {
        return new ListOptions(category, false, null);
    }
}
