package io.cortex.core.memory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.error.StoreError;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Memory files as YAML front matter followed by the markdown body:
 *
 * <pre>
 * ---
 * created_at: 2025-01-01T10:00:00Z
 * updated_at: 2025-01-01T10:00:00Z
 * tags: [preference]
 * source: user
 * expires_at: 2025-02-01T00:00:00Z
 * citations: [docs/setup.md]
 * ---
 * The body.
 * </pre>
 */
public final class FrontmatterMemorySerializer implements MemorySerializer {
    private static final String FENCE = "---";

    private final ObjectMapper yamlMapper;

    public FrontmatterMemorySerializer() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build();
        yamlMapper = new ObjectMapper(factory);
        yamlMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    @Override
    public Result<Memory> parse(String raw) {
        if (raw == null) {
            return Result.err(ErrorCode.MISSING_FRONTMATTER, "Memory file is empty");
        }
        List<String> lines = Arrays.asList(raw.split("\n", -1));
        if (lines.isEmpty() || !lines.get(0).trim().equals(FENCE)) {
            return Result.err(ErrorCode.MISSING_FRONTMATTER, "Memory file must start with a front matter fence");
        }
        int closing = -1;
        for (int i = 1; i < lines.size(); i++) {
            if (lines.get(i).trim().equals(FENCE)) {
                closing = i;
                break;
            }
        }
        if (closing < 0) {
            return Result.err(ErrorCode.MISSING_FRONTMATTER, "Front matter is not closed");
        }

        String frontmatter = String.join("\n", lines.subList(1, closing));
        String body = String.join("\n", lines.subList(closing + 1, lines.size()));

        JsonNode node;
        try {
            node = yamlMapper.readTree(frontmatter);
        } catch (JsonProcessingException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.INVALID_FRONTMATTER, "Front matter is not valid YAML: " + e.getOriginalMessage(), null, e));
        }
        if (node == null || !node.isObject()) {
            return Result.err(ErrorCode.INVALID_FRONTMATTER, "Front matter must be a mapping");
        }

        Result<Instant> createdAt = requiredTimestamp(node, "created_at");
        if (createdAt.isErr()) {
            return createdAt.propagate();
        }
        Result<Instant> updatedAt = requiredTimestamp(node, "updated_at");
        if (updatedAt.isErr()) {
            return updatedAt.propagate();
        }
        Result<List<String>> tags = stringList(node, "tags", ErrorCode.INVALID_TAGS);
        if (tags.isErr()) {
            return tags.propagate();
        }
        Result<String> source = source(node);
        if (source.isErr()) {
            return source.propagate();
        }
        Result<Instant> expiresAt = optionalTimestamp(node, "expires_at");
        if (expiresAt.isErr()) {
            return expiresAt.propagate();
        }
        Result<List<String>> citations = stringList(node, "citations", ErrorCode.INVALID_CITATIONS);
        if (citations.isErr()) {
            return citations.propagate();
        }

        MemoryMetadata metadata = new MemoryMetadata(
            createdAt.value(),
            updatedAt.value(),
            tags.value(),
            source.value(),
            expiresAt.value(),
            citations.value()
        );
        return Result.ok(new Memory(metadata, body));
    }

    @Override
    public Result<String> serialize(Memory memory) {
        MemoryMetadata metadata = memory.metadata();
        if (metadata.createdAt() == null) {
            return Result.err(ErrorCode.MISSING_FIELD, "Memory metadata requires created_at");
        }
        if (metadata.updatedAt() == null) {
            return Result.err(ErrorCode.MISSING_FIELD, "Memory metadata requires updated_at");
        }
        if (metadata.source() == null || metadata.source().isBlank()) {
            return Result.err(ErrorCode.INVALID_SOURCE, "Memory source must not be blank");
        }
        if (containsBlank(metadata.tags())) {
            return Result.err(ErrorCode.INVALID_TAGS, "Memory tags must not be blank");
        }
        if (containsBlank(metadata.citations())) {
            return Result.err(ErrorCode.INVALID_CITATIONS, "Memory citations must not be blank");
        }

        ObjectNode node = yamlMapper.createObjectNode();
        node.put("created_at", metadata.createdAt().toString());
        node.put("updated_at", metadata.updatedAt().toString());
        ArrayNode tags = node.putArray("tags");
        metadata.tags().forEach(tags::add);
        node.put("source", metadata.source());
        if (metadata.expiresAt() != null) {
            node.put("expires_at", metadata.expiresAt().toString());
        }
        if (!metadata.citations().isEmpty()) {
            ArrayNode citations = node.putArray("citations");
            metadata.citations().forEach(citations::add);
        }

        String yaml;
        try {
            yaml = yamlMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return Result.err(StoreError.fromException(
                ErrorCode.INVALID_FRONTMATTER, "Failed to serialize front matter", null, e));
        }
        if (!yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        String content = memory.content();
        StringBuilder out = new StringBuilder(FENCE).append('\n').append(yaml).append(FENCE);
        if (!content.isEmpty()) {
            out.append('\n').append(content);
        }
        return Result.ok(out.toString());
    }

    private static Result<Instant> requiredTimestamp(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Result.err(ErrorCode.MISSING_FIELD, "Front matter is missing " + field);
        }
        return timestamp(value, field);
    }

    private static Result<Instant> optionalTimestamp(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Result.ok(null);
        }
        return timestamp(value, field);
    }

    private static Result<Instant> timestamp(JsonNode value, String field) {
        if (!value.isValueNode()) {
            return Result.err(ErrorCode.INVALID_TIMESTAMP, "Front matter field " + field + " must be a timestamp");
        }
        String text = value.asText().trim();
        try {
            return Result.ok(Instant.parse(text));
        } catch (DateTimeParseException e) {
            try {
                return Result.ok(OffsetDateTime.parse(text).toInstant());
            } catch (DateTimeParseException ignored) {
                return Result.err(StoreError.fromException(
                    ErrorCode.INVALID_TIMESTAMP, "Invalid timestamp for " + field + ": " + text, null, e));
            }
        }
    }

    private static Result<String> source(JsonNode node) {
        JsonNode value = node.get("source");
        if (value == null || value.isNull()) {
            return Result.err(ErrorCode.MISSING_FIELD, "Front matter is missing source");
        }
        if (!value.isValueNode() || value.asText().isBlank()) {
            return Result.err(ErrorCode.INVALID_SOURCE, "Front matter source must be a non-empty string");
        }
        return Result.ok(value.asText().trim());
    }

    private static Result<List<String>> stringList(JsonNode node, String field, ErrorCode invalidCode) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Result.ok(List.of());
        }
        if (!value.isArray()) {
            return Result.err(invalidCode, "Front matter field " + field + " must be a list");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isValueNode() || item.isNull() || item.asText().isBlank()) {
                return Result.err(invalidCode, "Front matter field " + field + " must contain non-empty strings");
            }
            items.add(item.asText().trim());
        }
        return Result.ok(items);
    }

    private static boolean containsBlank(List<String> values) {
        for (String value : values) {
            if (value == null || value.isBlank()) {
                return true;
            }
        }
        return false;
    }
}
