package io.cortex.cli;

import io.cortex.core.config.ConfigPaths;
import io.cortex.core.config.model.CortexConfig;
import io.cortex.core.config.model.StoreConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CortexConfig config = context.configService().load(context.configPath(), System.getenv());
            StoreConfig store = config.store();
            Path storePath = ConfigPaths.resolveStorePath(store.path());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store path: " + storePath);
            System.out.println("Store exists: " + Files.isDirectory(storePath));
            System.out.println("Memory extension: " + store.memoryExtension());
            System.out.println("Index extension: " + store.indexExtension());
            System.out.println("Reindex timeout: " + store.reindexTimeoutSeconds() + "s");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
