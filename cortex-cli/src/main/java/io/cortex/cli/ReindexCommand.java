package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.index.ReindexResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "reindex", description = "Rebuild every category index from the memory files on disk")
public final class ReindexCommand implements Callable<Integer> {
    private final CliContext context;

    public ReindexCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<ReindexResult> reindexed = context.memoryService().reindex();
        if (reindexed.isErr()) {
            return CommandSupport.fail(reindexed.error());
        }
        ReindexResult result = reindexed.value();
        System.out.println("Reindexed " + result.memoryCount() + " memories across "
            + result.categoryCount() + " categories.");
        for (String warning : result.warnings()) {
            System.out.println("Warning: " + warning);
        }
        return 0;
    }
}
