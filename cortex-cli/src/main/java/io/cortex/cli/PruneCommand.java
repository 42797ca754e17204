package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.memory.PruneOptions;
import io.cortex.core.memory.PruneResult;
import io.cortex.core.memory.PrunedMemory;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "prune", description = "Delete expired memories")
public final class PruneCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--dry-run", description = "Report expired memories without deleting them")
    boolean dryRun;

    public PruneCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<PruneResult> pruned = context.memoryService().prune(new PruneOptions(dryRun, null));
        if (pruned.isErr()) {
            return CommandSupport.fail(pruned.error());
        }
        PruneResult result = pruned.value();
        if (result.pruned().isEmpty()) {
            System.out.println("No expired memories.");
            return 0;
        }
        String verb = result.dryRun() ? "Would prune" : "Pruned";
        for (PrunedMemory memory : result.pruned()) {
            System.out.println(verb + " " + memory.path() + " (expired " + memory.expiresAt() + ")");
        }
        return 0;
    }
}
