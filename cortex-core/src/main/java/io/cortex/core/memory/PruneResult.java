package io.cortex.core.memory;

import java.util.List;

public record PruneResult(List<PrunedMemory> pruned, boolean dryRun) {

    public PruneResult {
        pruned = pruned == null ? List.of() : List.copyOf(pruned);
    }
}
