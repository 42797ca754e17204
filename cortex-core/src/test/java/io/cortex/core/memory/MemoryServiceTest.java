package io.cortex.core.memory;

import static org.assertj.core.api.Assertions.assertThat;

import io.cortex.core.error.ErrorCode;
import io.cortex.core.error.Result;
import io.cortex.core.index.IndexSubcategoryEntry;
import io.cortex.core.storage.StorageOptions;
import io.cortex.core.storage.fs.FilesystemStorageAdapter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryServiceTest {
    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FilesystemStorageAdapter storage;
    private MemoryService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        storage = new FilesystemStorageAdapter(StorageOptions.defaults(tempDir.resolve("store")).withClock(clock));
        service = new MemoryService(storage, new FrontmatterMemorySerializer(), clock);
    }

    @Test
    void shouldCreateAndGetMemory() {
        Result<Memory> created = service.create("project/alpha", new CreateMemoryInput(
            "hello", List.of("greeting"), "user", null, List.of("docs/intro.md")));

        assertThat(created.isOk()).isTrue();
        Memory memory = service.get("project/alpha").value();
        assertThat(memory.content()).isEqualTo("hello");
        assertThat(memory.metadata().tags()).containsExactly("greeting");
        assertThat(memory.metadata().source()).isEqualTo("user");
        assertThat(memory.metadata().citations()).containsExactly("docs/intro.md");
        assertThat(memory.metadata().createdAt()).isEqualTo(START);
        assertThat(memory.metadata().updatedAt()).isEqualTo(START);
    }

    @Test
    void shouldRejectInvalidPathsBeforeAnyIo() {
        Result<Memory> result = service.create("alpha", CreateMemoryInput.of("x", "user"));

        assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_PATH);
        assertThat(service.create("project/Alpha", CreateMemoryInput.of("x", "user")).error().code())
            .isEqualTo(ErrorCode.INVALID_PATH);
        assertThat(service.create("project/Alpha", CreateMemoryInput.of("x", "user")).error().reason().code())
            .isEqualTo(ErrorCode.INVALID_SLUG);
        assertThat(service.get("../etc/passwd").error().code()).isEqualTo(ErrorCode.INVALID_PATH);
        assertThat(Files.exists(tempDir.resolve("store"))).isFalse();
    }

    @Test
    void shouldValidateCreateInput() {
        assertThat(service.create("project/alpha", CreateMemoryInput.of("x", " ")).error().code())
            .isEqualTo(ErrorCode.INVALID_INPUT);
        assertThat(service.create("project/alpha", CreateMemoryInput.of(null, "user")).error().code())
            .isEqualTo(ErrorCode.INVALID_INPUT);
        assertThat(service.create("project/alpha", new CreateMemoryInput("x", List.of(" "), "user", null, null))
            .error().code()).isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    void shouldOverwriteExistingMemoryOnCreate() {
        service.create("project/alpha", CreateMemoryInput.of("first", "user"));
        service.create("project/alpha", CreateMemoryInput.of("second", "user"));

        assertThat(service.get("project/alpha").value().content()).isEqualTo("second");
        assertThat(storage.readCategoryIndex("project").value().memories()).hasSize(1);
    }

    @Test
    void shouldReportMissingAndExpiredMemories() {
        assertThat(service.get("project/missing").error().code()).isEqualTo(ErrorCode.MEMORY_NOT_FOUND);

        service.create("project/alpha", new CreateMemoryInput("x", null, "user", START.plusSeconds(60), null));

        assertThat(service.get("project/alpha").isOk()).isTrue();
        assertThat(service.get("project/alpha", new GetOptions(false, START.plusSeconds(60))).error().code())
            .isEqualTo(ErrorCode.MEMORY_EXPIRED);
        assertThat(service.get("project/alpha", new GetOptions(true, START.plusSeconds(60))).isOk()).isTrue();
    }

    @Test
    void shouldUpdateOnlySuppliedFields() {
        service.create("project/alpha", new CreateMemoryInput(
            "original", List.of("a"), "user", START.plusSeconds(3600), List.of("c1")));
        clock.advance(Duration.ofMinutes(5));

        Memory updated = service.update("project/alpha",
            new UpdateMemoryInput(null, List.of("b", "c"), ExpiryUpdate.keep(), null)).value();

        assertThat(updated.content()).isEqualTo("original");
        assertThat(updated.metadata().tags()).containsExactly("b", "c");
        assertThat(updated.metadata().expiresAt()).isEqualTo(START.plusSeconds(3600));
        assertThat(updated.metadata().citations()).containsExactly("c1");
        assertThat(updated.metadata().source()).isEqualTo("user");
        assertThat(updated.metadata().createdAt()).isEqualTo(START);
        assertThat(updated.metadata().updatedAt()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(service.get("project/alpha").value()).isEqualTo(updated);
    }

    @Test
    void shouldDistinguishClearingFromKeepingExpiry() {
        service.create("project/alpha", new CreateMemoryInput("x", null, "user", START.plusSeconds(10), null));

        Memory kept = service.update("project/alpha", UpdateMemoryInput.content("y")).value();
        assertThat(kept.metadata().expiresAt()).isEqualTo(START.plusSeconds(10));

        Memory cleared = service.update("project/alpha",
            new UpdateMemoryInput(null, null, ExpiryUpdate.clear(), null)).value();
        assertThat(cleared.metadata().expiresAt()).isNull();

        Memory set = service.update("project/alpha",
            new UpdateMemoryInput(null, null, ExpiryUpdate.at(START.plusSeconds(99)), null)).value();
        assertThat(set.metadata().expiresAt()).isEqualTo(START.plusSeconds(99));
    }

    @Test
    void shouldRejectEmptyUpdateAndMissingMemory() {
        assertThat(service.update("project/alpha", new UpdateMemoryInput(null, null, null, null)).error().code())
            .isEqualTo(ErrorCode.INVALID_INPUT);
        assertThat(service.update("project/alpha", UpdateMemoryInput.content("x")).error().code())
            .isEqualTo(ErrorCode.MEMORY_NOT_FOUND);
    }

    @Test
    void shouldRefreshTokenEstimateOnUpdate() {
        service.create("project/alpha", CreateMemoryInput.of("abcd", "user"));
        int before = storage.readCategoryIndex("project").value().findMemory("project/alpha").tokenEstimate();

        service.update("project/alpha", UpdateMemoryInput.content("a much longer body than before"));

        int after = storage.readCategoryIndex("project").value().findMemory("project/alpha").tokenEstimate();
        assertThat(after).isGreaterThan(before);
    }

    @Test
    void shouldRemoveMemoryAndRebuildIndexes() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        service.create("project/beta", CreateMemoryInput.of("b", "user"));

        assertThat(service.remove("project/alpha").isOk()).isTrue();

        assertThat(service.get("project/alpha").error().code()).isEqualTo(ErrorCode.MEMORY_NOT_FOUND);
        assertThat(storage.readCategoryIndex("").value().subcategories())
            .containsExactly(new IndexSubcategoryEntry("project", 1));
        assertThat(service.remove("project/alpha").error().code()).isEqualTo(ErrorCode.MEMORY_NOT_FOUND);
    }

    @Test
    void shouldMoveMemoryIntoNewCategory() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));

        assertThat(service.move("project/alpha", "archive/2025/alpha").isOk()).isTrue();

        assertThat(service.get("project/alpha").error().code()).isEqualTo(ErrorCode.MEMORY_NOT_FOUND);
        assertThat(service.get("archive/2025/alpha").value().content()).isEqualTo("a");
        assertThat(storage.readCategoryIndex("").value().subcategories()).containsExactly(
            new IndexSubcategoryEntry("archive", 0),
            new IndexSubcategoryEntry("project", 0)
        );
        assertThat(storage.readCategoryIndex("archive").value().subcategories())
            .containsExactly(new IndexSubcategoryEntry("archive/2025", 1));
    }

    @Test
    void shouldTreatSelfMoveAsNoOp() throws Exception {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        String before = Files.readString(tempDir.resolve("store/project/alpha.md"));

        assertThat(service.move("project/alpha", " project / alpha ").isOk()).isTrue();

        assertThat(Files.readString(tempDir.resolve("store/project/alpha.md"))).isEqualTo(before);
    }

    @Test
    void shouldRefuseMoveOntoExistingDestination() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        service.create("project/beta", CreateMemoryInput.of("b", "user"));

        assertThat(service.move("project/alpha", "project/beta").error().code())
            .isEqualTo(ErrorCode.DESTINATION_EXISTS);
        assertThat(service.get("project/alpha").value().content()).isEqualTo("a");
        assertThat(service.get("project/beta").value().content()).isEqualTo("b");
        assertThat(service.move("project/missing", "project/other").error().code())
            .isEqualTo(ErrorCode.MEMORY_NOT_FOUND);
    }

    @Test
    void shouldListRecursivelyFromRootOrCategory() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        service.create("project/cortex/beta", CreateMemoryInput.of("b", "user"));
        service.create("notes/gamma", CreateMemoryInput.of("c", "user"));

        ListResult all = service.list(ListOptions.all()).value();
        assertThat(all.category()).isEmpty();
        assertThat(all.memories()).extracting(ListedMemory::path)
            .containsExactlyInAnyOrder("project/alpha", "project/cortex/beta", "notes/gamma");
        assertThat(all.subcategories()).extracting(IndexSubcategoryEntry::path).containsExactly("notes", "project");

        ListResult project = service.list(ListOptions.category("project")).value();
        assertThat(project.memories()).extracting(ListedMemory::path)
            .containsExactlyInAnyOrder("project/alpha", "project/cortex/beta");
        assertThat(project.subcategories()).containsExactly(new IndexSubcategoryEntry("project/cortex", 1));

        assertThat(service.list(ListOptions.category("missing")).value().memories()).isEmpty();
        assertThat(service.list(ListOptions.category("Bad Category")).error().code())
            .isEqualTo(ErrorCode.INVALID_PATH);
    }

    @Test
    void shouldFilterExpiredMemoriesFromList() {
        service.create("project/alpha", new CreateMemoryInput("a", null, "user", START.plusSeconds(1), null));
        service.create("project/beta", CreateMemoryInput.of("b", "user"));
        Instant later = START.plusSeconds(5);

        assertThat(service.list(new ListOptions(null, false, later)).value().memories())
            .extracting(ListedMemory::path).containsExactly("project/beta");
        List<ListedMemory> withExpired = service.list(new ListOptions(null, true, later)).value().memories();
        assertThat(withExpired).extracting(ListedMemory::path).containsExactly("project/alpha", "project/beta");
        assertThat(withExpired.get(0).expired()).isTrue();
    }

    @Test
    void shouldSkipUnreadableMemoriesWhenListing() throws Exception {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        service.create("project/beta", CreateMemoryInput.of("b", "user"));
        Files.writeString(tempDir.resolve("store/project/beta.md"), "no front matter");

        assertThat(service.list(ListOptions.all()).value().memories())
            .extracting(ListedMemory::path).containsExactly("project/alpha");
    }

    @Test
    void shouldSkipCategoriesWithMalformedIndex() throws Exception {
        Instant expiresAt = START.plusSeconds(30);
        service.create("project/alpha", new CreateMemoryInput("hello", null, "user", expiresAt, null));
        service.create("notes/beta", CreateMemoryInput.of("b", "user"));
        Files.writeString(tempDir.resolve("store/notes/index.yaml"), "memories: [unterminated");

        ListResult listed = service.list(new ListOptions(null, true, expiresAt.plusMillis(1))).value();
        assertThat(listed.memories()).extracting(ListedMemory::path).containsExactly("project/alpha");

        PruneResult pruned = service.prune(new PruneOptions(false, expiresAt.plusMillis(1))).value();
        assertThat(pruned.pruned()).extracting(PrunedMemory::path).containsExactly("project/alpha");
        assertThat(Files.exists(tempDir.resolve("store/project/alpha.md"))).isFalse();
        assertThat(service.get("notes/beta").isOk()).isTrue();
    }

    @Test
    void shouldNotLoopOnCyclicIndexTree() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        storage.writeIndexFile("project", """
            memories:
              - path: project/alpha
                token_estimate: 1
            subcategories:
              - path: project
                memory_count: 1
            """);

        ListResult result = service.list(ListOptions.all()).value();

        assertThat(result.memories()).extracting(ListedMemory::path).containsExactly("project/alpha");
    }

    @Test
    void shouldPruneExpiredMemoriesAndKeepEmptyCategory() {
        Instant expiresAt = START.plusSeconds(30);
        service.create("project/alpha", new CreateMemoryInput("hello", null, "user", expiresAt, null));

        ListResult listed = service.list(ListOptions.all()).value();
        assertThat(listed.memories()).extracting(ListedMemory::path).containsExactly("project/alpha");
        assertThat(listed.subcategories()).containsExactly(new IndexSubcategoryEntry("project", 1));

        Instant afterExpiry = expiresAt.plusMillis(1);
        PruneResult dryRun = service.prune(new PruneOptions(true, afterExpiry)).value();
        assertThat(dryRun.dryRun()).isTrue();
        assertThat(dryRun.pruned()).containsExactly(new PrunedMemory("project/alpha", expiresAt));
        assertThat(service.get("project/alpha", new GetOptions(true, afterExpiry)).isOk()).isTrue();

        PruneResult pruned = service.prune(new PruneOptions(false, afterExpiry)).value();
        assertThat(pruned.pruned()).extracting(PrunedMemory::path).containsExactly("project/alpha");
        assertThat(service.get("project/alpha", new GetOptions(true, afterExpiry)).error().code())
            .isEqualTo(ErrorCode.MEMORY_NOT_FOUND);

        ListResult after = service.list(ListOptions.all()).value();
        assertThat(after.memories()).isEmpty();
        assertThat(after.subcategories()).containsExactly(new IndexSubcategoryEntry("project", 0));
    }

    @Test
    void shouldPruneNothingWhenNoMemoryExpired() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));

        PruneResult result = service.prune(PruneOptions.defaults()).value();

        assertThat(result.pruned()).isEmpty();
        assertThat(service.get("project/alpha").isOk()).isTrue();
    }

    @Test
    void shouldMatchRebuiltTreeAfterMixedOperations() throws Exception {
        service.create("project/alpha", CreateMemoryInput.of("alpha", "user"));
        service.create("project/cortex/beta", CreateMemoryInput.of("beta body", "user"));
        service.create("notes/gamma", new CreateMemoryInput("g", null, "user", START.plusSeconds(1), null));
        service.update("project/alpha", UpdateMemoryInput.content("alpha, revised"));
        service.move("project/cortex/beta", "notes/beta");
        service.prune(new PruneOptions(false, START.plusSeconds(2)));
        String rootBefore = storage.readIndexFile("").value();
        String notesBefore = storage.readIndexFile("notes").value();
        String projectBefore = storage.readIndexFile("project").value();

        service.reindex();

        assertThat(storage.readIndexFile("").value()).isEqualTo(rootBefore);
        assertThat(storage.readIndexFile("notes").value()).isEqualTo(notesBefore);
        assertThat(storage.readIndexFile("project").value()).isEqualTo(projectBefore);
    }

    @Test
    void shouldReturnMostRecentlyUpdatedFirst() {
        service.create("project/alpha", CreateMemoryInput.of("a", "user"));
        clock.advance(Duration.ofMinutes(1));
        service.create("project/beta", CreateMemoryInput.of("b", "user"));
        clock.advance(Duration.ofMinutes(1));
        service.create("notes/gamma", CreateMemoryInput.of("c", "user"));
        clock.advance(Duration.ofMinutes(1));
        service.update("project/alpha", UpdateMemoryInput.content("a2"));

        List<RecentMemory> recent = service.recent(new RecentOptions(null, 2, false, null)).value();

        assertThat(recent).extracting(RecentMemory::path).containsExactly("project/alpha", "notes/gamma");
        assertThat(recent.get(0).memory().content()).isEqualTo("a2");
        assertThat(recent.get(0).tokenEstimate()).isEqualTo(1);
        assertThat(service.recent(new RecentOptions("project", 0, false, null)).value())
            .extracting(RecentMemory::path).containsExactly("project/alpha", "project/beta");
    }

    @Test
    void shouldKeepEveryEntryUnderConcurrentCreates() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Result<Memory>>> futures = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                String path = "project/memory-" + i;
                futures.add(executor.submit(() -> service.create(path, CreateMemoryInput.of("body " + path, "user"))));
            }
            for (Future<Result<Memory>> future : futures) {
                assertThat(future.get().isOk()).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(storage.readCategoryIndex("project").value().memories()).hasSize(24);
        assertThat(service.list(ListOptions.all()).value().subcategories())
            .containsExactly(new IndexSubcategoryEntry("project", 24));
    }

    private static final class MutableClock extends Clock {
        private volatile Instant current;

        MutableClock(Instant start) {
            this.current = start;
        }

        void advance(Duration duration) {
            current = current.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }
    }
}
