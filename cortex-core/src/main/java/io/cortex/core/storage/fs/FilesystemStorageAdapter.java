package io.cortex.core.storage.fs;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import io.cortex.core.index.CategoryIndex;
import io.cortex.core.index.ReindexResult;
import io.cortex.core.path.CategoryPath;
import io.cortex.core.path.MemoryIdentity;
import io.cortex.core.path.SlugPaths;
import io.cortex.core.storage.StorageAdapter;
import io.cortex.core.storage.StorageOptions;
import io.cortex.core.storage.WriteOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StorageAdapter} over a directory tree. Memory files live at {@code <root>/<category>/<slug><ext>} next to
 * the category's {@code index<ext>}; the root index sits at {@code <root>/index<ext>}.
 *
 * <p>All mutations, including the index maintenance a memory write triggers, run under one lock per adapter.
 */
public final class FilesystemStorageAdapter implements StorageAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(FilesystemStorageAdapter.class);

    private final StorageOptions options;
    private final StoragePaths paths;
    private final IndexFiles indexes;
    private final CategoryIndexUpdater updater;
    private final IndexRebuilder rebuilder;

    public FilesystemStorageAdapter(StorageOptions options) {
        this.options = options;
        this.paths = new StoragePaths(options.root(), options.memoryExtension(), options.indexExtension());
        this.indexes = new IndexFiles(paths, options.indexSerializer());
        this.updater = new CategoryIndexUpdater(indexes, options.tokenizer());
        this.rebuilder = new IndexRebuilder(
            paths,
            indexes,
            options.tokenizer(),
            options.clock(),
            options.reindexTimeout()
        );
    }

    public FilesystemStorageAdapter(Path root) {
        this(StorageOptions.defaults(root));
    }

    public StorageOptions options() {
        return options;
    }

    public Path root() {
        return paths.root();
    }

    @Override
    public Result<String> readMemoryFile(String slugPath) {
        Result<Path> file = paths.memoryFile(slugPath, ErrorCode.READ_FAILED);
        if (file.isErr()) {
            return file.propagate();
        }
        try {
            return Result.ok(AtomicFiles.readIfExists(file.value()));
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.READ_FAILED, "Failed to read memory file: " + slugPath, slugPath, e));
        }
    }

    @Override
    public synchronized Result<Void> writeMemoryFile(String slugPath, String contents, WriteOptions options) {
        WriteOptions effective = options == null ? WriteOptions.defaults() : options;
        Result<Path> file = paths.memoryFile(slugPath, ErrorCode.WRITE_FAILED);
        if (file.isErr()) {
            return file.propagate();
        }
        Result<MemoryIdentity> identity = SlugPaths.validateSlugPath(slugPath);
        if (identity.isErr()) {
            return identity.propagate();
        }
        if (effective.allowIndexUpdate()
            && !effective.allowIndexCreate()
            && !indexes.exists(identity.value().category())) {
            return Result.err(ErrorCode.INDEX_UPDATE_FAILED,
                "Category index does not exist: " + identity.value().category().value(), slugPath);
        }

        try {
            AtomicFiles.write(paths.memoryFile(identity.value()), contents == null ? "" : contents);
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to write memory file: " + slugPath, slugPath, e));
        }
        LOG.debug("Wrote memory file {}", identity.value().slugPath());

        if (!effective.allowIndexUpdate()) {
            return Result.ok();
        }
        return updater.upsertMemory(identity.value(), contents == null ? "" : contents, effective.allowIndexCreate());
    }

    @Override
    public synchronized Result<Void> removeMemoryFile(String slugPath) {
        Result<Path> file = paths.memoryFile(slugPath, ErrorCode.WRITE_FAILED);
        if (file.isErr()) {
            return file.propagate();
        }
        Result<MemoryIdentity> identity = SlugPaths.validateSlugPath(slugPath);
        if (identity.isErr()) {
            return identity.propagate();
        }
        try {
            if (Files.deleteIfExists(paths.memoryFile(identity.value()))) {
                LOG.debug("Removed memory file {}", identity.value().slugPath());
            }
            return Result.ok();
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to remove memory file: " + slugPath, slugPath, e));
        }
    }

    @Override
    public synchronized Result<Void> moveMemoryFile(String fromSlugPath, String toSlugPath) {
        Result<Path> fromFile = paths.memoryFile(fromSlugPath, ErrorCode.WRITE_FAILED);
        if (fromFile.isErr()) {
            return fromFile.propagate();
        }
        Result<Path> toFile = paths.memoryFile(toSlugPath, ErrorCode.WRITE_FAILED);
        if (toFile.isErr()) {
            return toFile.propagate();
        }
        Result<MemoryIdentity> from = SlugPaths.validateSlugPath(fromSlugPath);
        if (from.isErr()) {
            return from.propagate();
        }
        Result<MemoryIdentity> to = SlugPaths.validateSlugPath(toSlugPath);
        if (to.isErr()) {
            return to.propagate();
        }

        Path source = paths.memoryFile(from.value());
        Path target = paths.memoryFile(to.value());
        if (!Files.isDirectory(target.getParent())) {
            return Result.err(ErrorCode.WRITE_FAILED,
                "Destination category does not exist: " + to.value().category().value(), toSlugPath);
        }
        if (Files.exists(target)) {
            return Result.err(ErrorCode.WRITE_FAILED, "Destination memory file already exists: " + toSlugPath,
                toSlugPath);
        }
        try {
            Files.move(source, target);
            LOG.debug("Moved memory file {} to {}", from.value().slugPath(), to.value().slugPath());
            return Result.ok();
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to move memory file " + fromSlugPath + " to " + toSlugPath,
                fromSlugPath, e));
        }
    }

    @Override
    public Result<String> readIndexFile(String name) {
        Result<Path> file = paths.indexFile(name, ErrorCode.READ_FAILED);
        if (file.isErr()) {
            return file.propagate();
        }
        try {
            return Result.ok(AtomicFiles.readIfExists(file.value()));
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.READ_FAILED, "Failed to read index file: " + name, name, e));
        }
    }

    @Override
    public synchronized Result<Void> writeIndexFile(String name, String contents) {
        Result<Path> file = paths.indexFile(name, ErrorCode.WRITE_FAILED);
        if (file.isErr()) {
            return file.propagate();
        }
        try {
            AtomicFiles.write(file.value(), contents == null ? "" : contents);
            return Result.ok();
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to write index file: " + name, name, e));
        }
    }

    @Override
    public Result<CategoryIndex> readCategoryIndex(String name) {
        Result<String> raw = readIndexFile(name);
        if (raw.isErr()) {
            return raw.propagate();
        }
        if (raw.value() == null) {
            return Result.ok(CategoryIndex.empty());
        }
        return indexes.parse(raw.value(), name);
    }

    @Override
    public synchronized Result<ReindexResult> reindexCategoryIndexes() {
        return rebuilder.rebuild();
    }

    @Override
    public Result<Boolean> categoryExists(String path) {
        Result<Path> dir = paths.categoryDirectory(path, ErrorCode.READ_FAILED);
        if (dir.isErr()) {
            return dir.propagate();
        }
        return Result.ok(Files.isDirectory(dir.value()));
    }

    @Override
    public synchronized Result<Void> ensureCategoryDirectory(String path) {
        Result<Path> dir = paths.categoryDirectory(path, ErrorCode.WRITE_FAILED);
        if (dir.isErr()) {
            return dir.propagate();
        }
        try {
            Files.createDirectories(dir.value());
            return Result.ok();
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to create category directory: " + path, path, e));
        }
    }

    @Override
    public synchronized Result<Void> deleteCategoryDirectory(String path) {
        Result<Path> dir = paths.categoryDirectory(path, ErrorCode.WRITE_FAILED);
        if (dir.isErr()) {
            return dir.propagate();
        }
        if (dir.value().equals(paths.root())) {
            return Result.err(ErrorCode.INVALID_PATH, "Refusing to delete the store root", path);
        }
        try {
            AtomicFiles.deleteRecursively(dir.value());
            LOG.debug("Deleted category directory {}", path);
            return Result.ok();
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to delete category directory: " + path, path, e));
        }
    }

    @Override
    public synchronized Result<Void> registerCategory(String path) {
        Result<Path> dir = paths.categoryDirectory(path, ErrorCode.WRITE_FAILED);
        if (dir.isErr()) {
            return dir.propagate();
        }
        Result<CategoryPath> category = SlugPaths.validateCategoryPath(path);
        if (category.isErr()) {
            return category.propagate();
        }
        try {
            Files.createDirectories(dir.value());
        } catch (IOException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.WRITE_FAILED, "Failed to create category directory: " + path, path, e));
        }
        return updater.registerChain(category.value());
    }

    @Override
    public synchronized Result<Void> updateSubcategoryDescription(
        String parentPath,
        String subcategoryPath,
        String description
    ) {
        Result<CategoryEdge> pair = parentAndChild(parentPath, subcategoryPath);
        if (pair.isErr()) {
            return pair.propagate();
        }
        return updater.setDescription(pair.value().parent(), pair.value().child(), description);
    }

    @Override
    public synchronized Result<Void> removeSubcategoryEntry(String parentPath, String subcategoryPath) {
        Result<CategoryEdge> pair = parentAndChild(parentPath, subcategoryPath);
        if (pair.isErr()) {
            return pair.propagate();
        }
        return updater.removeSubcategory(pair.value().parent(), pair.value().child());
    }

    private Result<CategoryEdge> parentAndChild(String parentPath, String subcategoryPath) {
        Result<Path> dir = paths.categoryDirectory(subcategoryPath, ErrorCode.WRITE_FAILED);
        if (dir.isErr()) {
            return dir.propagate();
        }
        Result<CategoryPath> parent = SlugPaths.validateCategoryOrRoot(parentPath);
        if (parent.isErr()) {
            return parent.propagate();
        }
        Result<CategoryPath> child = SlugPaths.validateCategoryPath(subcategoryPath);
        if (child.isErr()) {
            return child.propagate();
        }
        if (!child.value().parent().equals(parent.value())) {
            return Result.err(ErrorCode.INVALID_PATH,
                subcategoryPath + " is not a direct subcategory of " + (parentPath == null ? "" : parentPath),
                subcategoryPath);
        }
        return Result.ok(new CategoryEdge(parent.value(), child.value()));
    }

    private record CategoryEdge(CategoryPath parent, CategoryPath child) {
    }
}
