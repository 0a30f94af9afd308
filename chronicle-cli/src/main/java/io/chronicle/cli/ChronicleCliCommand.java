package io.chronicle.cli;

import picocli.CommandLine.Command;

@Command(name = "chronicle", mixinStandardHelpOptions = true, description = "Chronicle session history store")
public final class ChronicleCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
