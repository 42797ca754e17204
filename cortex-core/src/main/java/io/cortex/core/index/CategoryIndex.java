package io.cortex.core.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Index document of one category node. Both lists are kept sorted by path; every mutator returns a new instance.
 */
public record CategoryIndex(List<IndexMemoryEntry> memories, List<IndexSubcategoryEntry> subcategories) {

    public CategoryIndex {
        memories = memories == null ? List.of() : List.copyOf(memories);
        subcategories = subcategories == null ? List.of() : List.copyOf(subcategories);
    }

    public static CategoryIndex empty() {
        return new CategoryIndex(List.of(), List.of());
    }

    /**
     * Returns a copy whose lists are sorted by path.
     */
    public CategoryIndex sorted() {
        return new CategoryIndex(sortMemories(memories), sortSubcategories(subcategories));
    }

    public CategoryIndex upsertMemory(IndexMemoryEntry entry) {
        List<IndexMemoryEntry> next = new ArrayList<>();
        for (IndexMemoryEntry existing : memories) {
            if (!existing.path().equals(entry.path())) {
                next.add(existing);
            }
        }
        next.add(entry);
        return new CategoryIndex(sortMemories(next), subcategories);
    }

    /**
     * Replaces the entry with the same path. An existing description is kept unless {@code entry} carries its own.
     */
    public CategoryIndex upsertSubcategory(IndexSubcategoryEntry entry) {
        String description = entry.description();
        List<IndexSubcategoryEntry> next = new ArrayList<>();
        for (IndexSubcategoryEntry existing : subcategories) {
            if (existing.path().equals(entry.path())) {
                if (description == null) {
                    description = existing.description();
                }
            } else {
                next.add(existing);
            }
        }
        next.add(new IndexSubcategoryEntry(entry.path(), entry.memoryCount(), description));
        return new CategoryIndex(memories, sortSubcategories(next));
    }

    public CategoryIndex removeSubcategory(String path) {
        List<IndexSubcategoryEntry> next = new ArrayList<>(subcategories);
        next.removeIf(entry -> entry.path().equals(path));
        return new CategoryIndex(memories, next);
    }

    public IndexSubcategoryEntry findSubcategory(String path) {
        for (IndexSubcategoryEntry entry : subcategories) {
            if (entry.path().equals(path)) {
                return entry;
            }
        }
        return null;
    }

    public IndexMemoryEntry findMemory(String path) {
        for (IndexMemoryEntry entry : memories) {
            if (entry.path().equals(path)) {
                return entry;
            }
        }
        return null;
    }

    private static List<IndexMemoryEntry> sortMemories(List<IndexMemoryEntry> entries) {
        List<IndexMemoryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(IndexMemoryEntry::path));
        return sorted;
    }

    private static List<IndexSubcategoryEntry> sortSubcategories(List<IndexSubcategoryEntry> entries) {
        List<IndexSubcategoryEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(IndexSubcategoryEntry::path));
        return sorted;
    }
}
