package io.cortex.cli;

import picocli.CommandLine.Command;

@Command(name = "cortex", mixinStandardHelpOptions = true, description = "Cortex hierarchical memory store")
public final class CortexCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
