package io.cortex.core.memory;

import java.time.Instant;

public record RecentOptions(String category, int limit, boolean includeExpired, Instant now) {
    public static final int DEFAULT_LIMIT = 5;

    public RecentOptions {
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static RecentOptions defaults() {
        return new RecentOptions(null, DEFAULT_LIMIT, false, null);
    }
}
