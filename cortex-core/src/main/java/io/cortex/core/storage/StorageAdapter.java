package io.cortex.core.storage;

import io.cortex.core.error.Result;
import io.cortex.core.index.CategoryIndex;
import io.cortex.core.index.ReindexResult;

/**
 * Raw access to memory files and category index files under a store root. Every method reports anticipated
 * failures through its {@link Result}; none throws for them.
 *
 * <p>Index names and category paths use {@code ""} for the root category and {@code a/b} for nested ones. Memory
 * paths are slug paths such as {@code project/cortex/alpha}.
 */
public interface StorageAdapter {

    /**
     * Reads a memory file. A successful result with a {@code null} value means the file does not exist.
     */
    Result<String> readMemoryFile(String slugPath);

    /**
     * Writes a memory file, creating parent directories, then upserts its entry into the category index tree
     * unless {@link WriteOptions#allowIndexUpdate()} is off.
     */
    Result<Void> writeMemoryFile(String slugPath, String contents, WriteOptions options);

    default Result<Void> writeMemoryFile(String slugPath, String contents) {
        return writeMemoryFile(slugPath, contents, WriteOptions.defaults());
    }

    /**
     * Removes a memory file. Removing a missing file succeeds.
     */
    Result<Void> removeMemoryFile(String slugPath);

    /**
     * Renames a memory file. The destination category directory must already exist.
     */
    Result<Void> moveMemoryFile(String fromSlugPath, String toSlugPath);

    /**
     * Reads an index file. A successful result with a {@code null} value means the index does not exist.
     */
    Result<String> readIndexFile(String name);

    Result<Void> writeIndexFile(String name, String contents);

    /**
     * Reads and parses a category index; a missing index reads as empty.
     */
    Result<CategoryIndex> readCategoryIndex(String name);

    /**
     * Rebuilds every category index from the files under the store root.
     */
    Result<ReindexResult> reindexCategoryIndexes();

    Result<Boolean> categoryExists(String path);

    Result<Void> ensureCategoryDirectory(String path);

    /**
     * Recursively deletes a category directory. Deleting a missing directory succeeds.
     */
    Result<Void> deleteCategoryDirectory(String path);

    /**
     * Registers a category and all its ancestors as subcategory entries up to the root index.
     */
    Result<Void> registerCategory(String path);

    /**
     * Sets or clears ({@code null}) the description of {@code subcategoryPath} in the index of {@code parentPath}.
     */
    Result<Void> updateSubcategoryDescription(String parentPath, String subcategoryPath, String description);

    Result<Void> removeSubcategoryEntry(String parentPath, String subcategoryPath);
}
