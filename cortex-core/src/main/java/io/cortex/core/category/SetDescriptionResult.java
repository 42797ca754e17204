package io.cortex.core.category;

/**
 * @param description stored description, {@code null} when it was cleared
 */
public record SetDescriptionResult(String path, String description) {
}
