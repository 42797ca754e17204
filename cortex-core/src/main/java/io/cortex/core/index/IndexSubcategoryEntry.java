package io.cortex.core.index;

/**
 * A direct child category listed in its parent's index. {@code memoryCount} is the child's own memory count, not a
 * recursive total.
 */
public record IndexSubcategoryEntry(String path, int memoryCount, String description) {

    public IndexSubcategoryEntry(String path, int memoryCount) {
        this(path, memoryCount, null);
    }

    public IndexSubcategoryEntry withDescription(String value) {
        return new IndexSubcategoryEntry(path, memoryCount, value);
    }
}
