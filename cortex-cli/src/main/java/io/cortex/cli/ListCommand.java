package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.index.IndexSubcategoryEntry;
import io.cortex.core.memory.ListOptions;
import io.cortex.core.memory.ListResult;
import io.cortex.core.memory.ListedMemory;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "list", description = "List memories recursively, from one category or the whole store")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Category path (lists everything when omitted)")
    String category;

    @Option(names = {"-x", "--include-expired"}, description = "Include expired memories")
    boolean includeExpired;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<ListResult> listed = context.memoryService().list(new ListOptions(category, includeExpired, null));
        if (listed.isErr()) {
            return CommandSupport.fail(listed.error());
        }
        ListResult result = listed.value();
        if (result.memories().isEmpty()) {
            System.out.println("No memories.");
        }
        for (ListedMemory memory : result.memories()) {
            StringBuilder line = new StringBuilder(memory.path())
                .append("  (").append(memory.tokenEstimate()).append(" tokens)");
            if (memory.expired()) {
                line.append("  [expired]");
            }
            if (memory.summary() != null) {
                line.append("  ").append(memory.summary());
            }
            System.out.println(line);
        }
        if (!result.subcategories().isEmpty()) {
            System.out.println("Subcategories:");
            for (IndexSubcategoryEntry subcategory : result.subcategories()) {
                StringBuilder line = new StringBuilder("  ").append(subcategory.path())
                    .append("  (").append(subcategory.memoryCount()).append(" memories)");
                if (subcategory.description() != null) {
                    line.append("  ").append(subcategory.description());
                }
                System.out.println(line);
            }
        }
        return 0;
    }
}
