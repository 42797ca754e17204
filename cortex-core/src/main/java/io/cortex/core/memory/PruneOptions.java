package io.cortex.core.memory;

import java.time.Instant;

public record PruneOptions(boolean dryRun, Instant now) {

    public static PruneOptions defaults() {
        return new PruneOptions(false, null);
    }
}
