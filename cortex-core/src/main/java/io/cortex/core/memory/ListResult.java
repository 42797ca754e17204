package io.cortex.core.memory;

import io.cortex.core.index.IndexSubcategoryEntry;
import java.util.List;

/**
 * @param category listed category, {@code ""} when listing from the root
 * @param memories memories of the category and all its descendants
 * @param subcategories direct subcategories of the listed category
 */
public record ListResult(String category, List<ListedMemory> memories, List<IndexSubcategoryEntry> subcategories) {

    public ListResult {
        memories = memories == null ? List.of() : List.copyOf(memories);
        subcategories = subcategories == null ? List.of() : List.copyOf(subcategories);
    }
}
