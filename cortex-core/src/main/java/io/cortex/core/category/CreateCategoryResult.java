package io.cortex.core.category;

public record CreateCategoryResult(String path, boolean created) {
}
