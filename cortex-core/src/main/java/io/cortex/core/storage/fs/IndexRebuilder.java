package io.cortex.core.storage.fs;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import io.cortex.core.index.CategoryIndex;
import io.cortex.core.index.IndexMemoryEntry;
import io.cortex.core.index.IndexSubcategoryEntry;
import io.cortex.core.index.ReindexResult;
import io.cortex.core.index.Tokenizer;
import io.cortex.core.path.CategoryPath;
import io.cortex.core.path.MemoryIdentity;
import io.cortex.core.path.SlugPaths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the whole index tree from the files under the store root.
 *
 * <p>New indexes are written to a hidden staging directory first. The commit copies the live index files into a
 * hidden backup directory and then moves each staged file over its live counterpart. Any failure during the commit
 * restores the backups, so the live tree is either the old generation or the new one. Callers hold the store lock.
 */
final class IndexRebuilder {
    private static final Logger LOG = LoggerFactory.getLogger(IndexRebuilder.class);

    static final String STAGING_PREFIX = ".cortex-staging-";
    static final String BACKUP_PREFIX = ".cortex-backup-";

    private final StoragePaths paths;
    private final IndexFiles indexes;
    private final Tokenizer tokenizer;
    private final Clock clock;
    private final Duration timeout;

    IndexRebuilder(StoragePaths paths, IndexFiles indexes, Tokenizer tokenizer, Clock clock, Duration timeout) {
        this.paths = paths;
        this.indexes = indexes;
        this.tokenizer = tokenizer;
        this.clock = clock;
        this.timeout = timeout;
    }

    Result<ReindexResult> rebuild() {
        Path root = paths.root();
        if (!Files.isDirectory(root)) {
            return Result.ok(ReindexResult.empty());
        }
        Instant deadline = clock.instant().plus(timeout);
        List<String> warnings = new ArrayList<>();

        Result<Scan> scanned = scan(root, warnings, deadline);
        if (scanned.isErr()) {
            return scanned.propagate();
        }
        Scan scan = scanned.value();

        Result<Map<CategoryPath, CategoryIndex>> built = build(scan, warnings, deadline);
        if (built.isErr()) {
            return built.propagate();
        }
        Map<CategoryPath, CategoryIndex> tree = built.value();

        String generation = UUID.randomUUID().toString();
        Path staging = root.resolve(STAGING_PREFIX + generation);
        Path backup = root.resolve(BACKUP_PREFIX + generation);
        try {
            Result<Map<Path, Path>> staged = stage(tree, staging);
            if (staged.isErr()) {
                return staged.propagate();
            }
            Result<Void> deadlineCheck = checkDeadline(deadline, "commit");
            if (deadlineCheck.isErr()) {
                return deadlineCheck.propagate();
            }
            Result<Void> committed = commit(staged.value(), scan.liveIndexFiles(), backup);
            if (committed.isErr()) {
                return committed.propagate();
            }
        } finally {
            cleanup(staging);
            cleanup(backup);
        }

        ReindexResult result = new ReindexResult(scan.memories().size(), tree.size(), warnings);
        LOG.info("Reindexed {} memories across {} categories", result.memoryCount(), result.categoryCount());
        return Result.ok(result);
    }

    /**
     * Depth-first walk with an explicit stack. Hidden entries are skipped, and so are directories whose names are
     * not valid category segments (with a warning). A memory file that does not map to a valid identity aborts.
     */
    private Result<Scan> scan(Path root, List<String> warnings, Instant deadline) {
        List<CategoryPath> categories = new ArrayList<>();
        List<MemoryFile> memories = new ArrayList<>();
        List<Path> liveIndexFiles = new ArrayList<>();
        categories.add(CategoryPath.ROOT);

        Deque<Path> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Result<Void> deadlineCheck = checkDeadline(deadline, "scan");
            if (deadlineCheck.isErr()) {
                return deadlineCheck.propagate();
            }
            Path dir = stack.pop();
            List<Path> children;
            try (Stream<Path> listing = Files.list(dir)) {
                children = listing.sorted(Comparator.comparing(Path::toString)).toList();
            } catch (IOException e) {
                return Result.err(StoreError.fromException(
                    ErrorCode.INDEX_UPDATE_FAILED, "Failed to scan directory: " + dir, dir.toString(), e));
            }
            for (Path child : children) {
                String name = child.getFileName().toString();
                if (name.startsWith(".")) {
                    continue;
                }
                if (Files.isSymbolicLink(child)) {
                    warnings.add("Skipped symbolic link: " + relative(root, child));
                    continue;
                }
                if (Files.isDirectory(child)) {
                    Result<CategoryPath> category = SlugPaths.validateCategoryPath(relative(root, child));
                    if (category.isErr() || !category.value().value().equals(relative(root, child))) {
                        warnings.add("Skipped directory with invalid category name: " + relative(root, child));
                        LOG.warn("Skipping directory {} during reindex: not a valid category name", child);
                        continue;
                    }
                    categories.add(category.value());
                    stack.push(child);
                } else if (name.equals(paths.indexFileName())) {
                    liveIndexFiles.add(child);
                } else if (name.endsWith(paths.memoryExtension())) {
                    String slugPath = toSlugPath(relative(root, child));
                    Result<MemoryIdentity> identity = SlugPaths.validateSlugPath(slugPath);
                    if (identity.isErr()) {
                        return Result.err(StoreError.wrap(
                            ErrorCode.INDEX_UPDATE_FAILED,
                            "Memory file does not map to a valid slug path: " + relative(root, child),
                            slugPath,
                            identity.error()
                        ));
                    }
                    if (!identity.value().slugPath().equals(slugPath)) {
                        return Result.err(ErrorCode.INDEX_UPDATE_FAILED,
                            "Memory file does not map to a valid slug path: " + relative(root, child), slugPath);
                    }
                    memories.add(new MemoryFile(identity.value(), child));
                }
            }
        }
        return Result.ok(new Scan(categories, memories, liveIndexFiles));
    }

    private Result<Map<CategoryPath, CategoryIndex>> build(Scan scan, List<String> warnings, Instant deadline) {
        Map<CategoryPath, CategoryIndex> tree = new TreeMap<>(Comparator.comparing(CategoryPath::value));
        for (CategoryPath category : scan.categories()) {
            tree.put(category, CategoryIndex.empty());
        }

        Previous previous = previousGeneration(tree.keySet(), warnings);
        for (MemoryFile memory : scan.memories()) {
            Result<Void> deadlineCheck = checkDeadline(deadline, "build");
            if (deadlineCheck.isErr()) {
                return deadlineCheck.propagate();
            }
            String content;
            try {
                content = AtomicFiles.readIfExists(memory.file());
            } catch (IOException e) {
                return Result.err(StoreError.fromException(
                    ErrorCode.INDEX_UPDATE_FAILED,
                    "Failed to read memory file: " + memory.identity().slugPath(),
                    memory.identity().slugPath(),
                    e
                ));
            }
            IndexMemoryEntry entry = new IndexMemoryEntry(
                memory.identity().slugPath(),
                tokenizer.estimateTokens(content == null ? "" : content),
                previous.summaries().get(memory.identity().slugPath())
            );
            tree.merge(memory.identity().category(), CategoryIndex.empty().upsertMemory(entry),
                (existing, added) -> existing.upsertMemory(entry));
        }

        Map<CategoryPath, CategoryIndex> snapshot = new HashMap<>(tree);
        for (CategoryPath category : snapshot.keySet()) {
            if (category.isRoot()) {
                continue;
            }
            CategoryPath parent = category.parent();
            IndexSubcategoryEntry entry = new IndexSubcategoryEntry(
                category.value(),
                snapshot.get(category).memories().size(),
                previous.descriptions().get(category.value())
            );
            tree.merge(parent, CategoryIndex.empty().upsertSubcategory(entry),
                (existing, added) -> existing.upsertSubcategory(entry));
        }
        return Result.ok(tree);
    }

    /**
     * Subcategory descriptions and memory summaries recorded in the current generation, keyed by path.
     */
    private Previous previousGeneration(Iterable<CategoryPath> categories, List<String> warnings) {
        Map<String, String> descriptions = new HashMap<>();
        Map<String, String> summaries = new HashMap<>();
        for (CategoryPath category : categories) {
            if (!indexes.exists(category)) {
                continue;
            }
            Result<CategoryIndex> previous = indexes.read(category);
            if (previous.isErr()) {
                String name = category.isRoot() ? "(root)" : category.value();
                warnings.add("Could not read previous index of " + name
                    + "; descriptions and summaries not carried over");
                LOG.warn("Ignoring unreadable index of {} during reindex: {}", name, previous.error().describe());
                continue;
            }
            for (IndexSubcategoryEntry entry : previous.value().subcategories()) {
                if (entry.description() != null) {
                    descriptions.put(entry.path(), entry.description());
                }
            }
            for (IndexMemoryEntry entry : previous.value().memories()) {
                if (entry.summary() != null) {
                    summaries.put(entry.path(), entry.summary());
                }
            }
        }
        return new Previous(descriptions, summaries);
    }

    /**
     * Writes every index of the new generation below {@code staging}. Returns staged file to live file.
     */
    private Result<Map<Path, Path>> stage(Map<CategoryPath, CategoryIndex> tree, Path staging) {
        Map<Path, Path> staged = new TreeMap<>();
        for (Map.Entry<CategoryPath, CategoryIndex> node : tree.entrySet()) {
            Path live = paths.indexFile(node.getKey());
            Path stagedFile = staging.resolve(paths.root().relativize(live));
            Result<Void> written = indexes.write(stagedFile, node.getKey().value(), node.getValue());
            if (written.isErr()) {
                return Result.err(StoreError.wrap(
                    ErrorCode.INDEX_UPDATE_FAILED, "Failed to stage rebuilt indexes", null, written.error()));
            }
            staged.put(stagedFile, live);
        }
        return Result.ok(staged);
    }

    private Result<Void> commit(Map<Path, Path> staged, List<Path> liveIndexFiles, Path backup) {
        Map<Path, Path> backups = new HashMap<>();
        List<Path> placed = new ArrayList<>();
        try {
            for (Path live : liveIndexFiles) {
                Path copy = backup.resolve(paths.root().relativize(live));
                Files.createDirectories(copy.getParent());
                Files.copy(live, copy);
                backups.put(live, copy);
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                AtomicFiles.replace(entry.getKey(), entry.getValue());
                placed.add(entry.getValue());
            }
            return Result.ok();
        } catch (IOException e) {
            rollback(placed, backups);
            return Result.err(StoreError.fromException(
                ErrorCode.INDEX_UPDATE_FAILED, "Failed to commit rebuilt indexes; previous indexes restored", null, e));
        }
    }

    private void rollback(List<Path> placed, Map<Path, Path> backups) {
        for (Path file : placed) {
            if (backups.containsKey(file)) {
                continue;
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warn("Failed to remove rebuilt index {} during rollback", file, e);
            }
        }
        for (Map.Entry<Path, Path> entry : backups.entrySet()) {
            try {
                AtomicFiles.replace(entry.getValue(), entry.getKey());
            } catch (IOException e) {
                LOG.warn("Failed to restore index {} during rollback", entry.getKey(), e);
            }
        }
    }

    private void cleanup(Path dir) {
        try {
            AtomicFiles.deleteRecursively(dir);
        } catch (IOException e) {
            LOG.warn("Failed to clean up {}", dir, e);
        }
    }

    private Result<Void> checkDeadline(Instant deadline, String phase) {
        if (clock.instant().isAfter(deadline)) {
            return Result.err(ErrorCode.INDEX_UPDATE_FAILED,
                "Reindex exceeded timeout of " + timeout.toSeconds() + "s during " + phase);
        }
        return Result.ok();
    }

    private static String relative(Path root, Path file) {
        List<String> segments = new ArrayList<>();
        for (Path part : root.relativize(file)) {
            segments.add(part.toString());
        }
        return String.join("/", segments);
    }

    private String toSlugPath(String relativeFile) {
        return relativeFile.substring(0, relativeFile.length() - paths.memoryExtension().length());
    }

    private record MemoryFile(MemoryIdentity identity, Path file) {
    }

    private record Previous(Map<String, String> descriptions, Map<String, String> summaries) {
    }

    private record Scan(List<CategoryPath> categories, List<MemoryFile> memories, List<Path> liveIndexFiles) {
    }
}
