package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.memory.RecentMemory;
import io.cortex.core.memory.RecentOptions;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "recent", description = "Show the most recently updated memories")
public final class RecentCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-C", "--category"}, description = "Only memories under this category")
    String category;

    @Option(names = {"-n", "--limit"}, defaultValue = "5", description = "Number of memories (default: ${DEFAULT-VALUE})")
    int limit;

    @Option(names = {"-x", "--include-expired"}, description = "Include expired memories")
    boolean includeExpired;

    public RecentCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<List<RecentMemory>> recent = context.memoryService()
            .recent(new RecentOptions(category, limit, includeExpired, null));
        if (recent.isErr()) {
            return CommandSupport.fail(recent.error());
        }
        if (recent.value().isEmpty()) {
            System.out.println("No memories.");
            return 0;
        }
        boolean first = true;
        for (RecentMemory memory : recent.value()) {
            if (!first) {
                System.out.println("---");
            }
            first = false;
            CommandSupport.printMemory(memory.path(), memory.memory());
        }
        return 0;
    }
}
