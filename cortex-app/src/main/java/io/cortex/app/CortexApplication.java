package io.cortex.app;

import io.cortex.cli.AddCommand;
import io.cortex.cli.CategoryCommand;
import io.cortex.cli.CategoryCreateCommand;
import io.cortex.cli.CategoryDeleteCommand;
import io.cortex.cli.CategoryDescribeCommand;
import io.cortex.cli.CliContext;
import io.cortex.cli.CortexCliCommand;
import io.cortex.cli.InitCommand;
import io.cortex.cli.ListCommand;
import io.cortex.cli.MoveCommand;
import io.cortex.cli.PruneCommand;
import io.cortex.cli.RecentCommand;
import io.cortex.cli.ReindexCommand;
import io.cortex.cli.RemoveCommand;
import io.cortex.cli.ShowCommand;
import io.cortex.cli.StatusCommand;
import io.cortex.cli.UpdateCommand;
import io.cortex.core.category.CategoryService;
import io.cortex.core.config.ConfigPaths;
import io.cortex.core.config.ConfigService;
import io.cortex.core.config.model.CortexConfig;
import io.cortex.core.memory.FrontmatterMemorySerializer;
import io.cortex.core.memory.MemoryService;
import io.cortex.core.storage.fs.FilesystemStorageAdapter;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CortexApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CortexApplication.class);

    private CortexApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        CortexConfig config = loadConfig(configService, configPath);

        Clock clock = Clock.systemUTC();
        FilesystemStorageAdapter storage = new FilesystemStorageAdapter(configService.storageOptions(config, clock));
        MemoryService memoryService = new MemoryService(storage, new FrontmatterMemorySerializer(), clock);
        CategoryService categoryService = new CategoryService(storage);
        CliContext context = new CliContext(memoryService, categoryService, configService, configPath);

        CommandLine category = new CommandLine(new CategoryCommand());
        category.addSubcommand("create", new CategoryCreateCommand(context));
        category.addSubcommand("delete", new CategoryDeleteCommand(context));
        category.addSubcommand("describe", new CategoryDescribeCommand(context));

        CommandLine commandLine = new CommandLine(new CortexCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("add", new AddCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("update", new UpdateCommand(context));
        commandLine.addSubcommand("remove", new RemoveCommand(context));
        commandLine.addSubcommand("move", new MoveCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("prune", new PruneCommand(context));
        commandLine.addSubcommand("reindex", new ReindexCommand(context));
        commandLine.addSubcommand("recent", new RecentCommand(context));
        commandLine.addSubcommand("category", category);

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static CortexConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath, System.getenv());
        } catch (Exception e) {
            LOG.warn("Failed to load config {}, using defaults: {}", configPath, e.getMessage());
            return CortexConfig.defaults();
        }
    }
}
