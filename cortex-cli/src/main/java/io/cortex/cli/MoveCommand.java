package io.cortex.cli;

import io.cortex.core.error.Result;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "move", description = "Move a memory to a new path")
public final class MoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Source memory path")
    String from;

    @Parameters(index = "1", arity = "1", description = "Destination memory path")
    String to;

    public MoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<Void> moved = context.memoryService().move(from, to);
        if (moved.isErr()) {
            return CommandSupport.fail(moved.error());
        }
        System.out.println("Moved memory " + from.trim() + " to " + to.trim() + ".");
        return 0;
    }
}
