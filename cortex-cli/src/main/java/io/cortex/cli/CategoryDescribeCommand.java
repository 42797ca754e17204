package io.cortex.cli;

import io.cortex.core.category.SetDescriptionResult;
import io.cortex.core.error.Result;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "describe", description = "Set or clear the description of a category")
public final class CategoryDescribeCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Category path")
    String path;

    @Parameters(index = "1", arity = "0..1", description = "Description (omit to clear)")
    String description;

    public CategoryDescribeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<SetDescriptionResult> described = context.categoryService().setDescription(path, description);
        if (described.isErr()) {
            return CommandSupport.fail(described.error());
        }
        SetDescriptionResult result = described.value();
        System.out.println(result.description() == null
            ? "Cleared description of " + result.path() + "."
            : "Described " + result.path() + ": " + result.description());
        return 0;
    }
}
