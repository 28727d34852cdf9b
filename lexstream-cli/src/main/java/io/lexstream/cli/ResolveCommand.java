package io.lexstream.cli;

import io.lexstream.core.citation.CitationResolver;
import io.lexstream.core.pipeline.LexstreamRuntime;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "resolve", description = "Resolve citation redirect links to the pages they point to")
public final class ResolveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Links to resolve")
    List<String> urls;

    @Option(names = "--offline", description = "Only use URL heuristics, never contact the link")
    boolean offline;

    public ResolveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LexstreamRuntime runtime = context.openRuntime()) {
            CitationResolver resolver = runtime.resolver();
            for (String url : urls) {
                String resolved = offline ? resolver.resolveOffline(url).orElse(url) : resolver.resolveUrl(url);
                System.out.println(url + " -> " + resolved);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Resolve failed: " + e.getMessage());
            return 1;
        }
    }
}
