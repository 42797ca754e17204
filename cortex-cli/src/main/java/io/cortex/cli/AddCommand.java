package io.cortex.cli;

import io.cortex.core.error.Result;
import io.cortex.core.memory.CreateMemoryInput;
import io.cortex.core.memory.Memory;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "add", description = "Create a memory from --content, --file or standard input")
public final class AddCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Memory path, e.g. project/tech-stack")
    String path;

    @Option(names = {"-c", "--content"}, description = "Memory content as inline text")
    String content;

    @Option(names = {"-f", "--file"}, description = "Read content from a file")
    Path file;

    @Option(names = {"-t", "--tags"}, description = "Tags, comma-separated or repeated")
    List<String> tags;

    @Option(names = {"-e", "--expires-at"}, description = "Expiration instant (ISO-8601)")
    String expiresAt;

    @Option(names = "--citation", description = "Citation, repeatable")
    List<String> citations;

    public AddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ContentInput input;
        Instant expiry;
        try {
            input = ContentInput.resolve(content, file, context.stdin(), true);
            expiry = expiresAt == null ? null : CommandSupport.parseInstant(expiresAt, "--expires-at");
        } catch (IllegalArgumentException e) {
            return CommandSupport.fail("INVALID_INPUT", e.getMessage());
        } catch (Exception e) {
            System.err.println("Add failed: " + e.getMessage());
            return 1;
        }
        if (input == null || input.content().isBlank()) {
            return CommandSupport.fail("MISSING_CONTENT", "Memory content is required via --content, --file, or stdin");
        }

        Result<Memory> created = context.memoryService().create(path, new CreateMemoryInput(
            input.content(),
            CommandSupport.splitValues(tags),
            input.source(),
            expiry,
            citations == null ? List.of() : citations
        ));
        if (created.isErr()) {
            return CommandSupport.fail(created.error());
        }
        System.out.println("Added memory " + path.trim() + " (" + input.source() + ").");
        return 0;
    }
}
