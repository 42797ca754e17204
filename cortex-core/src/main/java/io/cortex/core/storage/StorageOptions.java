package io.cortex.core.storage;

import io.cortex.core.index.HeuristicTokenizer;
import io.cortex.core.index.IndexSerializer;
import io.cortex.core.index.Tokenizer;
import io.cortex.core.index.YamlIndexSerializer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record StorageOptions(
    Path root,
    String memoryExtension,
    String indexExtension,
    IndexSerializer indexSerializer,
    Tokenizer tokenizer,
    Clock clock,
    Duration reindexTimeout
) {
    public static final String DEFAULT_MEMORY_EXTENSION = ".md";
    public static final String DEFAULT_INDEX_EXTENSION = ".yaml";
    public static final Duration DEFAULT_REINDEX_TIMEOUT = Duration.ofSeconds(60);

    public StorageOptions {
        Objects.requireNonNull(root, "root must not be null");
        root = root.toAbsolutePath().normalize();
        memoryExtension = normalizeExtension(memoryExtension, DEFAULT_MEMORY_EXTENSION);
        indexExtension = normalizeExtension(indexExtension, DEFAULT_INDEX_EXTENSION);
        if (memoryExtension.equals(indexExtension)) {
            throw new IllegalArgumentException("memory and index extensions must differ: " + memoryExtension);
        }
        indexSerializer = indexSerializer == null ? new YamlIndexSerializer() : indexSerializer;
        tokenizer = tokenizer == null ? new HeuristicTokenizer() : tokenizer;
        clock = clock == null ? Clock.systemUTC() : clock;
        reindexTimeout = reindexTimeout == null || reindexTimeout.isNegative() || reindexTimeout.isZero()
            ? DEFAULT_REINDEX_TIMEOUT
            : reindexTimeout;
    }

    public static StorageOptions defaults(Path root) {
        return new StorageOptions(root, null, null, null, null, null, null);
    }

    public StorageOptions withClock(Clock value) {
        return new StorageOptions(root, memoryExtension, indexExtension, indexSerializer, tokenizer, value, reindexTimeout);
    }

    public StorageOptions withReindexTimeout(Duration value) {
        return new StorageOptions(root, memoryExtension, indexExtension, indexSerializer, tokenizer, clock, value);
    }

    /**
     * Trims the extension and adds the leading dot when missing. Blank falls back to {@code fallback}.
     */
    public static String normalizeExtension(String extension, String fallback) {
        if (extension == null || extension.isBlank()) {
            return fallback;
        }
        String trimmed = extension.trim();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }
}
