package io.lexstream.cli;

import io.lexstream.core.config.ConfigPaths;
import io.lexstream.core.session.AnswerTurn;
import io.lexstream.core.session.FileTurnStore;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "history", description = "List recently answered questions")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-n", "--limit"}, description = "Number of turns to show", defaultValue = "10")
    int limit;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            FileTurnStore store = new FileTurnStore(
                ConfigPaths.resolveHistory(context.loadConfig().storage().historyPath())
            );
            List<AnswerTurn> turns = store.list();
            int from = Math.max(0, turns.size() - Math.max(0, limit));
            for (AnswerTurn turn : turns.subList(from, turns.size())) {
                System.out.println(turn.createdAt() + " [" + turn.model() + "] " + turn.prompt()
                    + " (" + turn.sources().size() + " sources)");
            }
            if (turns.isEmpty()) {
                System.out.println("No answers stored yet");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
