package io.cortex.core.index;

import java.util.List;

/**
 * Outcome of a full index rebuild.
 *
 * @param memoryCount memories indexed
 * @param categoryCount category nodes written, the root included
 * @param warnings entries skipped during the scan
 */
public record ReindexResult(int memoryCount, int categoryCount, List<String> warnings) {

    public ReindexResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ReindexResult empty() {
        return new ReindexResult(0, 0, List.of());
    }
}
