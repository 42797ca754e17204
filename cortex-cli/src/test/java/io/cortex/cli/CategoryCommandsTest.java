package io.cortex.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.cortex.core.category.CategoryService;
import io.cortex.core.config.ConfigService;
import io.cortex.core.config.model.CortexConfig;
import io.cortex.core.index.IndexSubcategoryEntry;
import io.cortex.core.memory.MemoryService;
import io.cortex.core.storage.fs.FilesystemStorageAdapter;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CategoryCommandsTest {

    @TempDir
    Path tempDir;

    private Path root;
    private FilesystemStorageAdapter storage;
    private CliContext context;
    private CommandLine category;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("store");
        storage = new FilesystemStorageAdapter(root);
        context = new CliContext(
            new MemoryService(storage),
            new CategoryService(storage),
            new ConfigService(),
            tempDir.resolve(".cortex/config.json")
        );
        category = new CommandLine(new CategoryCommand());
        category.addSubcommand("create", new CategoryCreateCommand(context));
        category.addSubcommand("delete", new CategoryDeleteCommand(context));
        category.addSubcommand("describe", new CategoryDescribeCommand(context));

        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void shouldCreateDescribeAndDeleteCategory() {
        assertThat(category.execute("create", "project/cortex")).isEqualTo(0);
        assertThat(category.execute("create", "project/cortex")).isEqualTo(0);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Created category project/cortex.")
            .contains("Category project/cortex already exists.");

        assertThat(category.execute("describe", "project", "Project notes")).isEqualTo(0);
        assertThat(storage.readCategoryIndex("").value().subcategories())
            .containsExactly(new IndexSubcategoryEntry("project", 0, "Project notes"));

        assertThat(category.execute("delete", "project/cortex")).isEqualTo(0);
        assertThat(Files.exists(root.resolve("project/cortex"))).isFalse();
        assertThat(storage.readCategoryIndex("project").value().subcategories()).isEmpty();
    }

    @Test
    void shouldReportCategoryErrors() {
        assertThat(category.execute("delete", "missing")).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error [CATEGORY_NOT_FOUND]");

        category.execute("create", "project");
        assertThat(category.execute("describe", "project", "x".repeat(501))).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error [DESCRIPTION_TOO_LONG]");
    }

    @Test
    void initShouldWriteConfigAndStatusShouldReportIt() throws Exception {
        ConfigService configService = context.configService();
        configService.save(context.configPath(), CortexConfig.defaults()
            .withStore(CortexConfig.defaults().store().withPath(root.toString())));

        assertThat(new CommandLine(new InitCommand(context)).execute()).isEqualTo(0);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Refreshed config with new defaults")
            .contains("Store ready: " + root);
        assertThat(Files.isDirectory(root)).isTrue();

        out.reset();
        assertThat(new CommandLine(new StatusCommand(context)).execute()).isEqualTo(0);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Config exists: true")
            .contains("Memory extension: .md")
            .contains("Index extension: .yaml");
    }
}
