package io.cortex.cli;

import io.cortex.core.category.CreateCategoryResult;
import io.cortex.core.error.Result;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "create", description = "Create a category and register it in the index tree")
public final class CategoryCreateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Category path")
    String path;

    public CategoryCreateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<CreateCategoryResult> created = context.categoryService().createCategory(path);
        if (created.isErr()) {
            return CommandSupport.fail(created.error());
        }
        CreateCategoryResult result = created.value();
        System.out.println(result.created()
            ? "Created category " + result.path() + "."
            : "Category " + result.path() + " already exists.");
        return 0;
    }
}
