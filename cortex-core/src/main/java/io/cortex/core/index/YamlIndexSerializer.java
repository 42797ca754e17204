package io.cortex.core.index;

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
import java.util.ArrayList;
import java.util.List;

/**
 * Index documents as YAML:
 *
 * <pre>
 * memories:
 *   - path: project/alpha
 *     token_estimate: 12
 * subcategories:
 *   - path: project/cortex
 *     memory_count: 3
 *     description: Notes on the store
 * </pre>
 */
public final class YamlIndexSerializer implements IndexSerializer {
    private final ObjectMapper yamlMapper;

    public YamlIndexSerializer() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build();
        yamlMapper = new ObjectMapper(factory);
        yamlMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    @Override
    public Result<CategoryIndex> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Result.ok(CategoryIndex.empty());
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return Result.err(StoreError.fromException(ErrorCode.INVALID_INDEX, "Index is not valid YAML", null, e));
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return Result.ok(CategoryIndex.empty());
        }
        if (!root.isObject()) {
            return Result.err(ErrorCode.INVALID_INDEX, "Index document must be a mapping");
        }

        List<IndexMemoryEntry> memories = new ArrayList<>();
        JsonNode memoriesNode = root.get("memories");
        if (isPresent(memoriesNode)) {
            if (!memoriesNode.isArray()) {
                return Result.err(ErrorCode.INVALID_INDEX, "Index field 'memories' must be a list");
            }
            for (JsonNode node : memoriesNode) {
                String path = text(node, "path");
                Integer tokens = integer(node, "token_estimate");
                if (path == null || tokens == null) {
                    return Result.err(ErrorCode.INVALID_INDEX, "Index memory entry requires path and token_estimate");
                }
                memories.add(new IndexMemoryEntry(path, tokens, text(node, "summary")));
            }
        }

        List<IndexSubcategoryEntry> subcategories = new ArrayList<>();
        JsonNode subcategoriesNode = root.get("subcategories");
        if (isPresent(subcategoriesNode)) {
            if (!subcategoriesNode.isArray()) {
                return Result.err(ErrorCode.INVALID_INDEX, "Index field 'subcategories' must be a list");
            }
            for (JsonNode node : subcategoriesNode) {
                String path = text(node, "path");
                Integer count = integer(node, "memory_count");
                if (path == null || count == null) {
                    return Result.err(ErrorCode.INVALID_INDEX, "Index subcategory entry requires path and memory_count");
                }
                subcategories.add(new IndexSubcategoryEntry(path, count, text(node, "description")));
            }
        }
        return Result.ok(new CategoryIndex(memories, subcategories).sorted());
    }

    @Override
    public Result<String> serialize(CategoryIndex index) {
        CategoryIndex sorted = index.sorted();
        ObjectNode root = yamlMapper.createObjectNode();
        ArrayNode memories = root.putArray("memories");
        for (IndexMemoryEntry entry : sorted.memories()) {
            ObjectNode node = memories.addObject();
            node.put("path", entry.path());
            node.put("token_estimate", entry.tokenEstimate());
            if (entry.summary() != null) {
                node.put("summary", entry.summary());
            }
        }
        ArrayNode subcategories = root.putArray("subcategories");
        for (IndexSubcategoryEntry entry : sorted.subcategories()) {
            ObjectNode node = subcategories.addObject();
            node.put("path", entry.path());
            node.put("memory_count", entry.memoryCount());
            if (entry.description() != null) {
                node.put("description", entry.description());
            }
        }
        try {
            return Result.ok(yamlMapper.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            return Result.err(StoreError.fromException(ErrorCode.INVALID_INDEX, "Failed to serialize index", null, e));
        }
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!isPresent(value) || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            return null;
        }
        int parsed = value.intValue();
        return parsed < 0 ? null : parsed;
    }
}
