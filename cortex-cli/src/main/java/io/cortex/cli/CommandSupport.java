package io.cortex.cli;

import io.cortex.core.error.StoreError;
import io.cortex.core.memory.Memory;
import io.cortex.core.memory.MemoryMetadata;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Output and argument helpers shared by the commands.
 */
final class CommandSupport {

    private CommandSupport() {
    }

    static int fail(StoreError error) {
        return fail(error.code().name(), error.describe());
    }

    static int fail(String code, String message) {
        System.err.println("Error [" + code + "]: " + message);
        return 1;
    }

    static Instant parseInstant(String raw, String option) {
        String trimmed = raw.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(trimmed).toInstant();
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Invalid " + option + " value (expected ISO-8601): " + raw, nested);
            }
        }
    }

    /**
     * Flattens repeated and comma-separated values, dropping blanks.
     */
    static List<String> splitValues(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
            .flatMap(value -> List.of(value.split(",")).stream())
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
    }

    static void printMemory(String path, Memory memory) {
        MemoryMetadata metadata = memory.metadata();
        System.out.println("path: " + path);
        System.out.println("created_at: " + metadata.createdAt());
        System.out.println("updated_at: " + metadata.updatedAt());
        System.out.println("source: " + metadata.source());
        if (!metadata.tags().isEmpty()) {
            System.out.println("tags: " + String.join(", ", metadata.tags()));
        }
        if (metadata.expiresAt() != null) {
            System.out.println("expires_at: " + metadata.expiresAt());
        }
        if (!metadata.citations().isEmpty()) {
            System.out.println("citations: " + String.join(", ", metadata.citations()));
        }
        System.out.println();
        System.out.println(memory.content());
    }
}
