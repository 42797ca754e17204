package io.cortex.core.path;

import static org.assertj.core.api.Assertions.assertThat;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import java.util.List;
import org.junit.jupiter.api.Test;

class SlugPathsTest {

    @Test
    void shouldSplitSlugPathIntoCategoryAndSlug() {
        Result<MemoryIdentity> result = SlugPaths.validateSlugPath("project/cortex/alpha");

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().category().segments()).containsExactly("project", "cortex");
        assertThat(result.value().slug()).isEqualTo("alpha");
        assertThat(result.value().slugPath()).isEqualTo("project/cortex/alpha");
    }

    @Test
    void shouldDropEmptyAndWhitespaceSegments() {
        Result<MemoryIdentity> result = SlugPaths.validateSlugPath(" project // alpha-1 / ");

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().slugPath()).isEqualTo("project/alpha-1");
    }

    @Test
    void shouldRequireCategoryAndSlug() {
        assertThat(SlugPaths.validateSlugPath("alpha").error().code()).isEqualTo(ErrorCode.INVALID_PATH);
        assertThat(SlugPaths.validateSlugPath("  / ").error().code()).isEqualTo(ErrorCode.INVALID_PATH);
        assertThat(SlugPaths.validateSlugPath(null).error().code()).isEqualTo(ErrorCode.INVALID_PATH);
    }

    @Test
    void shouldRejectSegmentsOutsideSlugGrammar() {
        for (String raw : List.of("Project/alpha", "project/al pha", "project/../alpha", "project/alpha_1")) {
            Result<MemoryIdentity> result = SlugPaths.validateSlugPath(raw);
            assertThat(result.isErr()).as(raw).isTrue();
            assertThat(result.error().code()).as(raw).isEqualTo(ErrorCode.INVALID_SLUG);
        }
    }

    @Test
    void shouldReserveIndexSlug() {
        Result<MemoryIdentity> result = SlugPaths.validateSlugPath("project/index");

        assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_SLUG);
        assertThat(result.error().message()).contains("reserved");
    }

    @Test
    void shouldValidateCategoryPaths() {
        assertThat(SlugPaths.validateCategoryPath("project/cortex").value().value()).isEqualTo("project/cortex");
        assertThat(SlugPaths.validateCategoryPath("").error().code()).isEqualTo(ErrorCode.INVALID_PATH);
        assertThat(SlugPaths.validateCategoryPath("project/Cortex").error().code()).isEqualTo(ErrorCode.INVALID_SLUG);
        assertThat(SlugPaths.validateCategoryOrRoot("").value().isRoot()).isTrue();
    }

    @Test
    void shouldWalkCategoryAncestry() {
        CategoryPath path = SlugPaths.validateCategoryPath("a/b/c").value();

        assertThat(path.parent().value()).isEqualTo("a/b");
        assertThat(path.prefix(1).value()).isEqualTo("a");
        assertThat(path.prefix(0).isRoot()).isTrue();
        assertThat(path.prefix(1).parent()).isEqualTo(CategoryPath.ROOT);
    }
}
