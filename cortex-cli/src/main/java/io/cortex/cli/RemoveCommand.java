package io.cortex.cli;

import io.cortex.core.error.Result;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Delete a memory")
public final class RemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory path")
    String path;

    public RemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<Void> removed = context.memoryService().remove(path);
        if (removed.isErr()) {
            return CommandSupport.fail(removed.error());
        }
        System.out.println("Removed memory " + path.trim() + ".");
        return 0;
    }
}
