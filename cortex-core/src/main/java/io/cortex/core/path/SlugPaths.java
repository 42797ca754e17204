package io.cortex.core.path;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pure validation of slug paths and category paths. Nothing here touches the filesystem.
 */
public final class SlugPaths {
    public static final String RESERVED_SLUG = "index";

    private static final Pattern SLUG = Pattern.compile("[a-z0-9-]+");

    private SlugPaths() {
    }

    public static boolean isValidSlug(String segment) {
        return segment != null && SLUG.matcher(segment).matches();
    }

    /**
     * Splits on {@code /}, trims every segment and drops the empty ones.
     */
    public static List<String> normalizeSegments(String raw) {
        List<String> segments = new ArrayList<>();
        if (raw == null) {
            return segments;
        }
        for (String part : raw.split("/", -1)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }
        return segments;
    }

    public static Result<MemoryIdentity> validateSlugPath(String raw) {
        List<String> segments = normalizeSegments(raw);
        if (segments.size() < 2) {
            return Result.err(
                ErrorCode.INVALID_PATH,
                "Memory slug path must include at least one category and a slug",
                raw
            );
        }
        for (String segment : segments) {
            if (!isValidSlug(segment)) {
                return Result.err(ErrorCode.INVALID_SLUG, "Invalid slug segment: " + segment, raw);
            }
        }
        String slug = segments.get(segments.size() - 1);
        if (RESERVED_SLUG.equals(slug)) {
            return Result.err(ErrorCode.INVALID_SLUG, "Slug '" + RESERVED_SLUG + "' is reserved", raw);
        }
        CategoryPath category = new CategoryPath(segments.subList(0, segments.size() - 1));
        return Result.ok(new MemoryIdentity(category, slug));
    }

    public static Result<CategoryPath> validateCategoryPath(String raw) {
        List<String> segments = normalizeSegments(raw);
        if (segments.isEmpty()) {
            return Result.err(ErrorCode.INVALID_PATH, "Category path must include at least one segment", raw);
        }
        for (String segment : segments) {
            if (!isValidSlug(segment)) {
                return Result.err(ErrorCode.INVALID_SLUG, "Invalid category segment: " + segment, raw);
            }
        }
        return Result.ok(new CategoryPath(segments));
    }

    /**
     * Like {@link #validateCategoryPath(String)} but accepts the empty path as the root category.
     */
    public static Result<CategoryPath> validateCategoryOrRoot(String raw) {
        if (normalizeSegments(raw).isEmpty()) {
            return Result.ok(CategoryPath.ROOT);
        }
        return validateCategoryPath(raw);
    }
}
