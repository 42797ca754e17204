package io.cortex.core.path;

import java.util.List;

/**
 * Validated category path. The root category has no segments and renders as the empty string.
 */
public record CategoryPath(List<String> segments) {
    public static final CategoryPath ROOT = new CategoryPath(List.of());

    public CategoryPath {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public String value() {
        return String.join("/", segments);
    }

    /**
     * Parent category; the parent of a top-level category is {@link #ROOT}. The root has no parent.
     */
    public CategoryPath parent() {
        if (isRoot()) {
            throw new IllegalStateException("Root category has no parent");
        }
        return new CategoryPath(segments.subList(0, segments.size() - 1));
    }

    /**
     * Prefix of this path with {@code length} segments.
     */
    public CategoryPath prefix(int length) {
        return new CategoryPath(segments.subList(0, length));
    }

    @Override
    public String toString() {
        return value();
    }
}
