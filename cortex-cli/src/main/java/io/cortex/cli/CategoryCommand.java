package io.cortex.cli;

import picocli.CommandLine.Command;

@Command(name = "category", mixinStandardHelpOptions = true, description = "Create, delete and describe categories")
public final class CategoryCommand implements Runnable {

    @Override
    public void run() {
        // Shows help when no subcommand is provided.
    }
}
