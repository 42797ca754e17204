package io.cortex.core.storage.fs;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import io.cortex.core.index.CategoryIndex;
import io.cortex.core.index.IndexMemoryEntry;
import io.cortex.core.index.IndexSubcategoryEntry;
import io.cortex.core.index.Tokenizer;
import io.cortex.core.path.CategoryPath;
import io.cortex.core.path.MemoryIdentity;

/**
 * Incremental index maintenance. Callers hold the store lock.
 */
final class CategoryIndexUpdater {
    private final IndexFiles indexes;
    private final Tokenizer tokenizer;

    CategoryIndexUpdater(IndexFiles indexes, Tokenizer tokenizer) {
        this.indexes = indexes;
        this.tokenizer = tokenizer;
    }

    /**
     * Upserts the memory into its category index, then refreshes the subcategory entry of every category on the
     * path from the root down to the memory's category.
     */
    Result<Void> upsertMemory(MemoryIdentity identity, String content, boolean allowIndexCreate) {
        CategoryPath category = identity.category();
        if (!allowIndexCreate && !indexes.exists(category)) {
            return Result.err(ErrorCode.INDEX_UPDATE_FAILED,
                "Category index does not exist: " + category.value(), category.value());
        }

        Result<CategoryIndex> current = indexes.read(category);
        if (current.isErr()) {
            return failed(category, current.error());
        }
        IndexMemoryEntry existing = current.value().findMemory(identity.slugPath());
        IndexMemoryEntry entry = new IndexMemoryEntry(
            identity.slugPath(),
            tokenizer.estimateTokens(content),
            existing == null ? null : existing.summary()
        );
        Result<Void> written = indexes.write(category, current.value().upsertMemory(entry));
        if (written.isErr()) {
            return failed(category, written.error());
        }
        return registerChain(category);
    }

    /**
     * Registers every prefix of {@code category} as a subcategory of its parent, creating missing index files on the
     * way. Existing descriptions are kept.
     */
    Result<Void> registerChain(CategoryPath category) {
        for (int depth = 1; depth <= category.depth(); depth++) {
            CategoryPath child = category.prefix(depth);
            CategoryPath parent = category.prefix(depth - 1);

            Result<CategoryIndex> childIndex = indexes.read(child);
            if (childIndex.isErr()) {
                return failed(child, childIndex.error());
            }
            if (!indexes.exists(child)) {
                Result<Void> created = indexes.write(child, childIndex.value());
                if (created.isErr()) {
                    return failed(child, created.error());
                }
            }

            Result<CategoryIndex> parentIndex = indexes.read(parent);
            if (parentIndex.isErr()) {
                return failed(parent, parentIndex.error());
            }
            IndexSubcategoryEntry entry = new IndexSubcategoryEntry(child.value(), childIndex.value().memories().size());
            Result<Void> written = indexes.write(parent, parentIndex.value().upsertSubcategory(entry));
            if (written.isErr()) {
                return failed(parent, written.error());
            }
        }
        return Result.ok();
    }

    Result<Void> setDescription(CategoryPath parent, CategoryPath child, String description) {
        Result<CategoryIndex> parentIndex = indexes.read(parent);
        if (parentIndex.isErr()) {
            return failed(parent, parentIndex.error());
        }
        IndexSubcategoryEntry entry = parentIndex.value().findSubcategory(child.value());
        if (entry == null) {
            Result<CategoryIndex> childIndex = indexes.read(child);
            if (childIndex.isErr()) {
                return failed(child, childIndex.error());
            }
            entry = new IndexSubcategoryEntry(child.value(), childIndex.value().memories().size());
        }
        CategoryIndex updated = parentIndex.value()
            .removeSubcategory(child.value())
            .upsertSubcategory(entry.withDescription(description));
        Result<Void> written = indexes.write(parent, updated);
        return written.isErr() ? failed(parent, written.error()) : written;
    }

    Result<Void> removeSubcategory(CategoryPath parent, CategoryPath child) {
        if (!indexes.exists(parent)) {
            return Result.ok();
        }
        Result<CategoryIndex> parentIndex = indexes.read(parent);
        if (parentIndex.isErr()) {
            return failed(parent, parentIndex.error());
        }
        if (parentIndex.value().findSubcategory(child.value()) == null) {
            return Result.ok();
        }
        Result<Void> written = indexes.write(parent, parentIndex.value().removeSubcategory(child.value()));
        return written.isErr() ? failed(parent, written.error()) : written;
    }

    private static Result<Void> failed(CategoryPath category, StoreError reason) {
        String name = category.isRoot() ? "(root)" : category.value();
        return Result.err(StoreError.wrap(
            ErrorCode.INDEX_UPDATE_FAILED, "Failed to update category index: " + name, category.value(), reason));
    }
}
