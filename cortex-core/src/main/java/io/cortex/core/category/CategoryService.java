package io.cortex.core.category;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import io.cortex.core.path.CategoryPath;
import io.cortex.core.path.SlugPaths;
import io.cortex.core.storage.StorageAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category operations: explicit creation, deletion and descriptions.
 */
public final class CategoryService {
    private static final Logger LOG = LoggerFactory.getLogger(CategoryService.class);

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private final StorageAdapter storage;

    public CategoryService(StorageAdapter storage) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
    }

    /**
     * Creates the category directory and registers it, with its ancestors, in the index tree. An existing category
     * is left untouched.
     */
    public Result<CreateCategoryResult> createCategory(String path) {
        Result<CategoryPath> category = category(path);
        if (category.isErr()) {
            return category.propagate();
        }
        String value = category.value().value();
        Result<Boolean> exists = storage.categoryExists(value);
        if (exists.isErr()) {
            return exists.propagate();
        }
        if (exists.value()) {
            return Result.ok(new CreateCategoryResult(value, false));
        }
        Result<Void> registered = storage.registerCategory(value);
        if (registered.isErr()) {
            return registered.propagate();
        }
        LOG.debug("Created category {}", value);
        return Result.ok(new CreateCategoryResult(value, true));
    }

    /**
     * Deletes the category directory with every memory and subcategory below it and drops its entry from the
     * parent index.
     */
    public Result<DeleteCategoryResult> deleteCategory(String path) {
        Result<CategoryPath> category = existingCategory(path);
        if (category.isErr()) {
            return category.propagate();
        }
        String value = category.value().value();
        Result<Void> deleted = storage.deleteCategoryDirectory(value);
        if (deleted.isErr()) {
            return deleted.propagate();
        }
        Result<Void> unregistered = storage.removeSubcategoryEntry(category.value().parent().value(), value);
        if (unregistered.isErr()) {
            return unregistered.propagate();
        }
        LOG.debug("Deleted category {}", value);
        return Result.ok(new DeleteCategoryResult(value, true));
    }

    /**
     * Sets the description shown on the category's entry in its parent index. A blank description clears it.
     */
    public Result<SetDescriptionResult> setDescription(String path, String description) {
        String trimmed = description == null ? "" : description.trim();
        if (trimmed.length() > MAX_DESCRIPTION_LENGTH) {
            return Result.err(ErrorCode.DESCRIPTION_TOO_LONG,
                "Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters", path);
        }
        Result<CategoryPath> category = existingCategory(path);
        if (category.isErr()) {
            return category.propagate();
        }
        String value = category.value().value();
        String stored = trimmed.isEmpty() ? null : trimmed;
        Result<Void> updated = storage.updateSubcategoryDescription(category.value().parent().value(), value, stored);
        if (updated.isErr()) {
            return updated.propagate();
        }
        return Result.ok(new SetDescriptionResult(value, stored));
    }

    private Result<CategoryPath> existingCategory(String path) {
        Result<CategoryPath> category = category(path);
        if (category.isErr()) {
            return category;
        }
        Result<Boolean> exists = storage.categoryExists(category.value().value());
        if (exists.isErr()) {
            return exists.propagate();
        }
        if (!exists.value()) {
            return Result.err(ErrorCode.CATEGORY_NOT_FOUND, "Category not found: " + category.value(),
                category.value().value());
        }
        return category;
    }

    private static Result<CategoryPath> category(String path) {
        Result<CategoryPath> category = SlugPaths.validateCategoryPath(path);
        if (category.isErr()) {
            return Result.err(StoreError.wrap(
                ErrorCode.INVALID_PATH, "Invalid category path: " + category.error().message(), path,
                category.error()));
        }
        return category;
    }
}
