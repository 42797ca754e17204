package io.cortex.cli;

import io.cortex.core.category.DeleteCategoryResult;
import io.cortex.core.error.Result;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete a category with every memory and subcategory below it")
public final class CategoryDeleteCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Category path")
    String path;

    public CategoryDeleteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Result<DeleteCategoryResult> deleted = context.categoryService().deleteCategory(path);
        if (deleted.isErr()) {
            return CommandSupport.fail(deleted.error());
        }
        System.out.println("Deleted category " + deleted.value().path() + ".");
        return 0;
    }
}
