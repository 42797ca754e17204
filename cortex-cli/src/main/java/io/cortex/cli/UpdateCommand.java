package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.memory.ExpiryUpdate;
import io.cortex.core.memory.Memory;
import io.cortex.core.memory.UpdateMemoryInput;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "update", description = "Change the content, tags, expiry or citations of a memory")
public final class UpdateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory path")
    String path;

    @Option(names = {"-c", "--content"}, description = "Replacement content")
    String content;

    @Option(names = {"-f", "--file"}, description = "Read replacement content from a file")
    Path file;

    @Option(names = {"-t", "--tags"}, description = "Replacement tags, comma-separated or repeated")
    List<String> tags;

    @Option(names = {"-e", "--expires-at"}, description = "New expiration instant (ISO-8601)")
    String expiresAt;

    @Option(names = "--clear-expiry", description = "Remove the expiration")
    boolean clearExpiry;

    @Option(names = "--citation", description = "Replacement citation, repeatable")
    List<String> citations;

    public UpdateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (clearExpiry && expiresAt != null) {
            return CommandSupport.fail("INVALID_INPUT", "Use either --expires-at or --clear-expiry, not both");
        }
        ContentInput input;
        ExpiryUpdate expiry = ExpiryUpdate.keep();
        try {
            input = ContentInput.resolve(content, file, context.stdin(), false);
            if (clearExpiry) {
                expiry = ExpiryUpdate.clear();
            } else if (expiresAt != null) {
                expiry = ExpiryUpdate.at(CommandSupport.parseInstant(expiresAt, "--expires-at"));
            }
        } catch (IllegalArgumentException e) {
            return CommandSupport.fail("INVALID_INPUT", e.getMessage());
        } catch (Exception e) {
            System.err.println("Update failed: " + e.getMessage());
            return 1;
        }

        Result<Memory> updated = context.memoryService().update(path, new UpdateMemoryInput(
            input == null ? null : input.content(),
            tags == null ? null : CommandSupport.splitValues(tags),
            expiry,
            citations
        ));
        if (updated.isErr()) {
            return CommandSupport.fail(updated.error());
        }
        System.out.println("Updated memory " + path.trim() + ".");
        return 0;
    }
}
