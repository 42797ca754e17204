package io.cortex.core.storage.fs;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import io.cortex.core.index.CategoryIndex;
import io.cortex.core.index.IndexSerializer;
import io.cortex.core.path.CategoryPath;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Typed access to the index file of a validated category.
 */
final class IndexFiles {
    private final StoragePaths paths;
    private final IndexSerializer serializer;

    IndexFiles(StoragePaths paths, IndexSerializer serializer) {
        this.paths = paths;
        this.serializer = serializer;
    }

    boolean exists(CategoryPath category) {
        return Files.isRegularFile(paths.indexFile(category));
    }

    /**
     * Reads the index of {@code category}; a missing file reads as an empty index.
     */
    Result<CategoryIndex> read(CategoryPath category) {
        Path file = paths.indexFile(category);
        String raw;
        try {
            raw = AtomicFiles.readIfExists(file);
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.READ_FAILED, "Failed to read index file: " + category.value(), category.value(), e));
        }
        if (raw == null) {
            return Result.ok(CategoryIndex.empty());
        }
        return parse(raw, category.value());
    }

    Result<CategoryIndex> parse(String raw, String name) {
        Result<CategoryIndex> parsed = serializer.parse(raw);
        if (parsed.isErr()) {
            return Result.err(StoreError.wrap(
                parsed.error().code(), "Malformed index file: " + displayName(name), name, parsed.error()));
        }
        return parsed;
    }

    Result<Void> write(CategoryPath category, CategoryIndex index) {
        return write(paths.indexFile(category), category.value(), index);
    }

    Result<Void> write(Path file, String name, CategoryIndex index) {
        Result<String> serialized = serializer.serialize(index);
        if (serialized.isErr()) {
            return serialized.propagate();
        }
        try {
            AtomicFiles.write(file, serialized.value());
            return Result.ok();
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to write index file: " + displayName(name), name, e));
        }
    }

    private static String displayName(String name) {
        return name == null || name.isEmpty() ? "(root)" : name;
    }
}
