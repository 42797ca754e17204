package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.memory.GetOptions;
import io.cortex.core.memory.Memory;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Print a memory with its metadata")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory path")
    String path;

    @Option(names = {"-x", "--include-expired"}, description = "Show the memory even when it has expired")
    boolean includeExpired;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<Memory> memory = context.memoryService().get(path, new GetOptions(includeExpired, null));
        if (memory.isErr()) {
            return CommandSupport.fail(memory.error());
        }
        CommandSupport.printMemory(path.trim(), memory.value());
        return 0;
    }
}
