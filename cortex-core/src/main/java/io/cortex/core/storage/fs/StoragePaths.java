package io.cortex.core.storage.fs;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.path.CategoryPath;
import io.cortex.core.path.MemoryIdentity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Maps store-relative names to files under the store root and keeps every resolved path inside it.
 */
final class StoragePaths {
    static final String INDEX_BASENAME = "index";

    private final Path root;
    private final String memoryExtension;
    private final String indexExtension;

    StoragePaths(Path root, String memoryExtension, String indexExtension) {
        this.root = root.toAbsolutePath().normalize();
        this.memoryExtension = memoryExtension;
        this.indexExtension = indexExtension;
    }

    Path root() {
        return root;
    }

    String memoryExtension() {
        return memoryExtension;
    }

    String indexFileName() {
        return INDEX_BASENAME + indexExtension;
    }

    Result<Path> memoryFile(String slugPath, ErrorCode failureCode) {
        return resolve(slugPath == null ? "" : slugPath + memoryExtension, slugPath, failureCode);
    }

    Result<Path> indexFile(String name, ErrorCode failureCode) {
        if (name == null || name.isEmpty()) {
            return Result.ok(root.resolve(indexFileName()));
        }
        return resolve(name + "/" + indexFileName(), name, failureCode);
    }

    Result<Path> categoryDirectory(String path, ErrorCode failureCode) {
        return resolve(path == null ? "" : path, path, failureCode);
    }

    Path memoryFile(MemoryIdentity identity) {
        return categoryDirectory(identity.category()).resolve(identity.slug() + memoryExtension);
    }

    Path indexFile(CategoryPath category) {
        return categoryDirectory(category).resolve(indexFileName());
    }

    Path categoryDirectory(CategoryPath category) {
        Path dir = root;
        for (String segment : category.segments()) {
            dir = dir.resolve(segment);
        }
        return dir;
    }

    /**
     * Resolves {@code relative} against the root and rejects the result when it lands outside the root, either
     * lexically or through a symbolic link in an existing ancestor.
     */
    private Result<Path> resolve(String relative, String display, ErrorCode failureCode) {
        Path resolved;
        try {
            resolved = root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            return escapes(display, failureCode);
        }
        Path rel = root.relativize(resolved);
        if (rel.isAbsolute() || rel.startsWith("..")) {
            return escapes(display, failureCode);
        }
        if (!insideRealRoot(resolved)) {
            return escapes(display, failureCode);
        }
        return Result.ok(resolved);
    }

    private boolean insideRealRoot(Path resolved) {
        if (!Files.exists(root)) {
            return true;
        }
        Path existing = resolved;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return false;
        }
        try {
            return existing.toRealPath().startsWith(root.toRealPath());
        } catch (IOException e) {
            return false;
        }
    }

    private static Result<Path> escapes(String display, ErrorCode failureCode) {
        return Result.err(failureCode, "Path escapes storage root: " + display, display);
    }
}
