package io.lexstream.app;

import io.lexstream.cli.AskCommand;
import io.lexstream.cli.CliContext;
import io.lexstream.cli.HistoryCommand;
import io.lexstream.cli.LexstreamCliCommand;
import io.lexstream.cli.OnboardCommand;
import io.lexstream.cli.ResolveCommand;
import io.lexstream.cli.StatusCommand;
import io.lexstream.core.config.ConfigPaths;
import io.lexstream.core.config.ConfigService;
import picocli.CommandLine;

public final class LexstreamApplication {

    private LexstreamApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(new ConfigService(), ConfigPaths.defaultConfigPath());

        CommandLine commandLine = new CommandLine(new LexstreamCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("resolve", new ResolveCommand(context));
        commandLine.addSubcommand("history", new HistoryCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
