package io.lexstream.cli;

import io.lexstream.core.model.Source;
import io.lexstream.core.pipeline.PresentationSink;
import java.io.PrintStream;
import java.util.List;

final class ConsoleSink implements PresentationSink {
    private final PrintStream out;
    private int printed;

    ConsoleSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public synchronized void revealed(String textSoFar) {
        if (textSoFar.length() > printed) {
            out.print(textSoFar.substring(printed));
            out.flush();
            printed = textSoFar.length();
        }
    }

    @Override
    public synchronized void completed(List<Source> sources, List<String> followUpQuestions) {
        out.println();
        if (!sources.isEmpty()) {
            out.println();
            out.println("Sources:");
            for (int i = 0; i < sources.size(); i++) {
                Source source = sources.get(i);
                out.println("[" + (i + 1) + "] " + source.title() + " - " + source.url());
            }
        }
        if (!followUpQuestions.isEmpty()) {
            out.println();
            out.println("Follow-up questions:");
            followUpQuestions.forEach(question -> out.println("- " + question));
        }
        out.flush();
    }
}
