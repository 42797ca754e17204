package io.cortex.core.path;

import java.util.Objects;

/**
 * Validated address of one memory: its immediate category plus the terminal slug.
 */
public record MemoryIdentity(CategoryPath category, String slug) {

    public MemoryIdentity {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(slug, "slug must not be null");
        if (category.isRoot()) {
            throw new IllegalArgumentException("memory must live under at least one category");
        }
    }

    public String slugPath() {
        return category.value() + "/" + slug;
    }

    @Override
    public String toString() {
        return slugPath();
    }
}
