package io.cortex.core.category;

public record DeleteCategoryResult(String path, boolean deleted) {
}
