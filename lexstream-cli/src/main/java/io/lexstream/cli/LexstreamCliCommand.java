package io.lexstream.cli;

import picocli.CommandLine.Command;

@Command(name = "lexstream", mixinStandardHelpOptions = true, description = "Grounded legal research answers, streamed")
public final class LexstreamCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
