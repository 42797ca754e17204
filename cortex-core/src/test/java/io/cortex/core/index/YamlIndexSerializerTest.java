package io.cortex.core.index;

import static org.assertj.core.api.Assertions.assertThat;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import java.util.List;
import org.junit.jupiter.api.Test;

class YamlIndexSerializerTest {

    private final YamlIndexSerializer serializer = new YamlIndexSerializer();

    @Test
    void shouldWriteSnakeCaseDocument() {
        CategoryIndex index = new CategoryIndex(
            List.of(new IndexMemoryEntry("project/alpha", 12)),
            List.of(new IndexSubcategoryEntry("project/cortex", 3, "Store notes"))
        );

        String yaml = serializer.serialize(index).value();

        assertThat(yaml).doesNotStartWith("---");
        assertThat(yaml).contains("memories:", "path: project/alpha", "token_estimate: 12");
        assertThat(yaml).contains("subcategories:", "path: project/cortex", "memory_count: 3", "description: Store notes");
    }

    @Test
    void shouldReadWhatItWrites() {
        CategoryIndex index = new CategoryIndex(
            List.of(new IndexMemoryEntry("p/b", 2), new IndexMemoryEntry("p/a", 1, "first")),
            List.of(new IndexSubcategoryEntry("p/2024", 0))
        );

        CategoryIndex parsed = serializer.parse(serializer.serialize(index).value()).value();

        assertThat(parsed).isEqualTo(index.sorted());
    }

    @Test
    void shouldTreatBlankDocumentAsEmptyIndex() {
        assertThat(serializer.parse("").value()).isEqualTo(CategoryIndex.empty());
        assertThat(serializer.parse("memories: []\nsubcategories: []\n").value()).isEqualTo(CategoryIndex.empty());
    }

    @Test
    void shouldRejectMalformedDocuments() {
        assertThat(code("memories: {path: a}")).isEqualTo(ErrorCode.INVALID_INDEX);
        assertThat(code("memories:\n  - path: a/b\n")).isEqualTo(ErrorCode.INVALID_INDEX);
        assertThat(code("subcategories:\n  - path: a\n    memory_count: many\n")).isEqualTo(ErrorCode.INVALID_INDEX);
        assertThat(code("- just\n- a list\n")).isEqualTo(ErrorCode.INVALID_INDEX);
        assertThat(code("memories: [\n")).isEqualTo(ErrorCode.INVALID_INDEX);
    }

    private ErrorCode code(String raw) {
        Result<CategoryIndex> result = serializer.parse(raw);
        assertThat(result.isErr()).as(raw).isTrue();
        return result.error().code();
    }
}
