package io.lexstream.cli;

import io.lexstream.core.config.ConfigPaths;
import io.lexstream.core.config.model.LexstreamConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LexstreamConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Gemini configured: " + config.gemini().configured());
            System.out.println("API base: " + config.gemini().apiBase());
            System.out.println("Primary model: " + config.gemini().primaryModel());
            System.out.println("Fallback model: " + config.gemini().fallbackModel());
            System.out.println("Citation probe enabled: " + config.citations().probeEnabled());
            System.out.println("History: " + ConfigPaths.resolveHistory(config.storage().historyPath()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
