package io.cortex.core.memory;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import io.cortex.core.index.CategoryIndex;
import io.cortex.core.index.IndexMemoryEntry;
import io.cortex.core.index.IndexSubcategoryEntry;
import io.cortex.core.index.ReindexResult;
import io.cortex.core.path.CategoryPath;
import io.cortex.core.path.MemoryIdentity;
import io.cortex.core.path.SlugPaths;
import io.cortex.core.storage.StorageAdapter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memory lifecycle operations over a {@link StorageAdapter}. Every operation validates its input before any I/O and
 * reports anticipated failures through the returned {@link Result}.
 */
public final class MemoryService {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryService.class);

    private final StorageAdapter storage;
    private final MemorySerializer serializer;
    private final Clock clock;

    public MemoryService(StorageAdapter storage, MemorySerializer serializer, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public MemoryService(StorageAdapter storage) {
        this(storage, new FrontmatterMemorySerializer(), Clock.systemUTC());
    }

    /**
     * Writes a new memory, replacing any memory already stored at {@code slugPath}. Parent categories are created
     * on the way.
     */
    public Result<Memory> create(String slugPath, CreateMemoryInput input) {
        Result<MemoryIdentity> identity = identity(slugPath);
        if (identity.isErr()) {
            return identity.propagate();
        }
        if (input == null || input.content() == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Memory content is required", slugPath);
        }
        if (input.source() == null || input.source().isBlank()) {
            return Result.err(ErrorCode.INVALID_INPUT, "Memory source is required", slugPath);
        }
        Result<List<String>> tags = nonBlank(input.tags(), "tags", slugPath);
        if (tags.isErr()) {
            return tags.propagate();
        }
        Result<List<String>> citations = nonBlank(input.citations(), "citations", slugPath);
        if (citations.isErr()) {
            return citations.propagate();
        }

        Instant now = clock.instant();
        Memory memory = new Memory(
            new MemoryMetadata(now, now, tags.value(), input.source().trim(), input.expiresAt(), citations.value()),
            input.content()
        );
        Result<Void> written = write(identity.value(), memory);
        if (written.isErr()) {
            return written.propagate();
        }
        LOG.debug("Created memory {}", identity.value().slugPath());
        return Result.ok(memory);
    }

    public Result<Memory> get(String slugPath, GetOptions options) {
        GetOptions effective = options == null ? GetOptions.defaults() : options;
        Result<MemoryIdentity> identity = identity(slugPath);
        if (identity.isErr()) {
            return identity.propagate();
        }
        Result<Memory> memory = load(identity.value());
        if (memory.isErr()) {
            return memory;
        }
        if (!effective.includeExpired() && memory.value().isExpired(now(effective.now()))) {
            return Result.err(ErrorCode.MEMORY_EXPIRED, "Memory has expired: " + slugPath, slugPath);
        }
        return memory;
    }

    public Result<Memory> get(String slugPath) {
        return get(slugPath, GetOptions.defaults());
    }

    /**
     * Changes the supplied fields of an existing memory and bumps its update time. The creation time and source
     * are kept.
     */
    public Result<Memory> update(String slugPath, UpdateMemoryInput input) {
        Result<MemoryIdentity> identity = identity(slugPath);
        if (identity.isErr()) {
            return identity.propagate();
        }
        if (input == null || input.isEmpty()) {
            return Result.err(ErrorCode.INVALID_INPUT,
                "No updates provided; supply content, tags, expiry or citations", slugPath);
        }
        Result<List<String>> tags = input.tags() == null ? Result.ok(null) : nonBlank(input.tags(), "tags", slugPath);
        if (tags.isErr()) {
            return tags.propagate();
        }
        Result<List<String>> citations = input.citations() == null
            ? Result.ok(null)
            : nonBlank(input.citations(), "citations", slugPath);
        if (citations.isErr()) {
            return citations.propagate();
        }

        Result<Memory> existing = load(identity.value());
        if (existing.isErr()) {
            return existing;
        }
        MemoryMetadata current = existing.value().metadata();
        MemoryMetadata metadata = new MemoryMetadata(
            current.createdAt(),
            clock.instant(),
            tags.value() == null ? current.tags() : tags.value(),
            current.source(),
            input.expiry().apply(current.expiresAt()),
            citations.value() == null ? current.citations() : citations.value()
        );
        Memory updated = new Memory(metadata, input.content() == null ? existing.value().content() : input.content());
        Result<Void> written = write(identity.value(), updated);
        if (written.isErr()) {
            return written.propagate();
        }
        LOG.debug("Updated memory {}", identity.value().slugPath());
        return Result.ok(updated);
    }

    /**
     * Deletes a memory and rebuilds the index tree. Removing an absent memory reports {@code MEMORY_NOT_FOUND}.
     */
    public Result<Void> remove(String slugPath) {
        Result<MemoryIdentity> identity = identity(slugPath);
        if (identity.isErr()) {
            return identity.propagate();
        }
        String path = identity.value().slugPath();
        Result<String> raw = storage.readMemoryFile(path);
        if (raw.isErr()) {
            return raw.propagate();
        }
        if (raw.value() == null) {
            return Result.err(ErrorCode.MEMORY_NOT_FOUND, "Memory not found: " + path, path);
        }
        Result<Void> removed = storage.removeMemoryFile(path);
        if (removed.isErr()) {
            return removed;
        }
        Result<ReindexResult> reindexed = storage.reindexCategoryIndexes();
        if (reindexed.isErr()) {
            return reindexed.propagate();
        }
        LOG.debug("Removed memory {}", path);
        return Result.ok();
    }

    public Result<Void> move(String fromSlugPath, String toSlugPath) {
        Result<MemoryIdentity> from = identity(fromSlugPath);
        if (from.isErr()) {
            return from.propagate();
        }
        Result<MemoryIdentity> to = identity(toSlugPath);
        if (to.isErr()) {
            return to.propagate();
        }
        if (from.value().equals(to.value())) {
            return Result.ok();
        }

        String source = from.value().slugPath();
        String target = to.value().slugPath();
        Result<String> sourceRaw = storage.readMemoryFile(source);
        if (sourceRaw.isErr()) {
            return sourceRaw.propagate();
        }
        if (sourceRaw.value() == null) {
            return Result.err(ErrorCode.MEMORY_NOT_FOUND, "Memory not found: " + source, source);
        }
        Result<String> targetRaw = storage.readMemoryFile(target);
        if (targetRaw.isErr()) {
            return targetRaw.propagate();
        }
        if (targetRaw.value() != null) {
            return Result.err(ErrorCode.DESTINATION_EXISTS, "Destination already exists: " + target, target);
        }

        Result<Void> ensured = storage.ensureCategoryDirectory(to.value().category().value());
        if (ensured.isErr()) {
            return ensured;
        }
        Result<Void> moved = storage.moveMemoryFile(source, target);
        if (moved.isErr()) {
            return moved;
        }
        Result<ReindexResult> reindexed = storage.reindexCategoryIndexes();
        if (reindexed.isErr()) {
            return reindexed.propagate();
        }
        LOG.debug("Moved memory {} to {}", source, target);
        return Result.ok();
    }

    /**
     * Lists memories recursively, either under one category or, without a category, under every top-level
     * category registered in the root index.
     */
    public Result<ListResult> list(ListOptions options) {
        ListOptions effective = options == null ? ListOptions.all() : options;
        Instant now = now(effective.now());

        Result<CategoryPath> start = startCategory(effective.category());
        if (start.isErr()) {
            return start.propagate();
        }
        Result<CategoryIndex> startIndex = storage.readCategoryIndex(start.value().value());
        if (startIndex.isErr()) {
            return startIndex.propagate();
        }

        List<ListedMemory> memories = new ArrayList<>();
        Result<Void> collected = walk(start.value(), startIndex.value(), new HashSet<>(), (entry, memory) -> {
            boolean expired = memory.isExpired(now);
            if (!expired || effective.includeExpired()) {
                memories.add(new ListedMemory(
                    entry.path(),
                    entry.tokenEstimate(),
                    entry.summary(),
                    memory.metadata().expiresAt(),
                    expired
                ));
            }
        });
        if (collected.isErr()) {
            return collected.propagate();
        }
        return Result.ok(new ListResult(start.value().value(), memories, startIndex.value().subcategories()));
    }

    /**
     * Removes every expired memory, or only reports them when {@code dryRun} is set. The index tree is rebuilt once
     * after the removals.
     */
    public Result<PruneResult> prune(PruneOptions options) {
        PruneOptions effective = options == null ? PruneOptions.defaults() : options;
        Instant now = now(effective.now());

        Result<CategoryIndex> rootIndex = storage.readCategoryIndex("");
        if (rootIndex.isErr()) {
            return rootIndex.propagate();
        }
        List<PrunedMemory> expired = new ArrayList<>();
        Result<Void> collected = walk(CategoryPath.ROOT, rootIndex.value(), new HashSet<>(), (entry, memory) -> {
            if (memory.isExpired(now)) {
                expired.add(new PrunedMemory(entry.path(), memory.metadata().expiresAt()));
            }
        });
        if (collected.isErr()) {
            return collected.propagate();
        }
        if (effective.dryRun()) {
            return Result.ok(new PruneResult(expired, true));
        }

        for (PrunedMemory memory : expired) {
            Result<Void> removed = storage.removeMemoryFile(memory.path());
            if (removed.isErr()) {
                return removed.propagate();
            }
        }
        if (!expired.isEmpty()) {
            Result<ReindexResult> reindexed = storage.reindexCategoryIndexes();
            if (reindexed.isErr()) {
                return reindexed.propagate();
            }
            LOG.info("Pruned {} expired memories", expired.size());
        }
        return Result.ok(new PruneResult(expired, false));
    }

    public Result<ReindexResult> reindex() {
        return storage.reindexCategoryIndexes();
    }

    /**
     * Most recently updated memories, newest first.
     */
    public Result<List<RecentMemory>> recent(RecentOptions options) {
        RecentOptions effective = options == null ? RecentOptions.defaults() : options;
        Instant now = now(effective.now());

        Result<CategoryPath> start = startCategory(effective.category());
        if (start.isErr()) {
            return start.propagate();
        }
        Result<CategoryIndex> startIndex = storage.readCategoryIndex(start.value().value());
        if (startIndex.isErr()) {
            return startIndex.propagate();
        }
        List<RecentMemory> found = new ArrayList<>();
        Result<Void> collected = walk(start.value(), startIndex.value(), new HashSet<>(), (entry, memory) -> {
            if (effective.includeExpired() || !memory.isExpired(now)) {
                found.add(new RecentMemory(entry.path(), memory, entry.tokenEstimate()));
            }
        });
        if (collected.isErr()) {
            return collected.propagate();
        }
        found.sort(Comparator.comparing(
            (RecentMemory recent) -> recent.memory().metadata().updatedAt(),
            Comparator.nullsLast(Comparator.reverseOrder())
        ).thenComparing(RecentMemory::path));
        return Result.ok(List.copyOf(found.subList(0, Math.min(effective.limit(), found.size()))));
    }

    /**
     * Visits every readable memory at and below {@code category}. Categories already visited are skipped so a
     * malformed index tree cannot loop.
     */
    private Result<Void> walk(CategoryPath category, CategoryIndex index, Set<String> visited, MemoryVisitor visitor) {
        if (!visited.add(category.value())) {
            return Result.ok();
        }
        for (IndexMemoryEntry entry : index.memories()) {
            Result<MemoryIdentity> identity = SlugPaths.validateSlugPath(entry.path());
            if (identity.isErr() || !identity.value().category().equals(category)) {
                LOG.warn("Skipping index entry {} listed under category '{}'", entry.path(), category.value());
                continue;
            }
            Result<Memory> memory = load(identity.value());
            if (memory.isErr()) {
                LOG.warn("Skipping unreadable memory {}: {}", entry.path(), memory.error().describe());
                continue;
            }
            visitor.visit(entry, memory.value());
        }
        for (IndexSubcategoryEntry subcategory : index.subcategories()) {
            Result<CategoryPath> child = SlugPaths.validateCategoryPath(subcategory.path());
            if (child.isErr()) {
                LOG.warn("Skipping invalid subcategory {} of '{}'", subcategory.path(), category.value());
                continue;
            }
            if (visited.contains(child.value().value())) {
                continue;
            }
            Result<CategoryIndex> childIndex = storage.readCategoryIndex(child.value().value());
            if (childIndex.isErr()) {
                LOG.warn("Skipping category {} with unreadable index: {}", child.value(),
                    childIndex.error().describe());
                continue;
            }
            Result<Void> nested = walk(child.value(), childIndex.value(), visited, visitor);
            if (nested.isErr()) {
                return nested;
            }
        }
        return Result.ok();
    }

    private Result<Memory> load(MemoryIdentity identity) {
        String path = identity.slugPath();
        Result<String> raw = storage.readMemoryFile(path);
        if (raw.isErr()) {
            return raw.propagate();
        }
        if (raw.value() == null) {
            return Result.err(ErrorCode.MEMORY_NOT_FOUND, "Memory not found: " + path, path);
        }
        Result<Memory> parsed = serializer.parse(raw.value());
        if (parsed.isErr()) {
            return Result.err(StoreError.wrap(
                parsed.error().code(), "Malformed memory file " + path + ": " + parsed.error().message(), path,
                parsed.error()));
        }
        return parsed;
    }

    private Result<Void> write(MemoryIdentity identity, Memory memory) {
        String path = identity.slugPath();
        Result<String> serialized = serializer.serialize(memory);
        if (serialized.isErr()) {
            return serialized.propagate();
        }
        Result<Void> written = storage.writeMemoryFile(path, serialized.value());
        if (written.isErr() && written.error().code() == ErrorCode.INDEX_UPDATE_FAILED) {
            return Result.err(StoreError.wrap(
                ErrorCode.STORAGE_ERROR,
                "Memory written but index update failed for " + path + "; run reindex to repair",
                path,
                written.error()
            ));
        }
        return written;
    }

    private Result<MemoryIdentity> identity(String slugPath) {
        Result<MemoryIdentity> identity = SlugPaths.validateSlugPath(slugPath);
        if (identity.isErr()) {
            return Result.err(StoreError.wrap(
                ErrorCode.INVALID_PATH, "Invalid memory path: " + identity.error().message(), slugPath,
                identity.error()));
        }
        return identity;
    }

    private Result<CategoryPath> startCategory(String category) {
        if (category == null || category.isBlank()) {
            return Result.ok(CategoryPath.ROOT);
        }
        Result<CategoryPath> path = SlugPaths.validateCategoryPath(category);
        if (path.isErr()) {
            return Result.err(StoreError.wrap(
                ErrorCode.INVALID_PATH, "Invalid category path: " + path.error().message(), category, path.error()));
        }
        return path;
    }

    private static Result<List<String>> nonBlank(List<String> values, String field, String slugPath) {
        if (values == null) {
            return Result.ok(List.of());
        }
        List<String> cleaned = new ArrayList<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                return Result.err(ErrorCode.INVALID_INPUT, "Memory " + field + " must not be blank", slugPath);
            }
            cleaned.add(value.trim());
        }
        return Result.ok(cleaned);
    }

    private Instant now(Instant override) {
        return override == null ? clock.instant() : override;
    }

    @FunctionalInterface
    private interface MemoryVisitor {
        void visit(IndexMemoryEntry entry, Memory memory);
    }
}
