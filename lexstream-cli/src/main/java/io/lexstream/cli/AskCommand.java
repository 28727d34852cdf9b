package io.lexstream.cli;

import io.lexstream.core.pipeline.AnswerPipeline;
import io.lexstream.core.pipeline.AnswerTurnHandle;
import io.lexstream.core.pipeline.LexstreamRuntime;
import io.lexstream.core.provider.ChatMode;
import io.lexstream.core.provider.ModelTier;
import io.lexstream.core.provider.QuotaExhaustedException;
import io.lexstream.core.provider.UpstreamException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Ask a question and stream the grounded answer")
public final class AskCommand implements Callable<Integer> {
    static final int QUOTA_EXIT_CODE = 2;
    private static final Duration PLAYBACK_TIMEOUT = Duration.ofMinutes(10);

    private final CliContext context;

    @Parameters(arity = "1..*", description = "Question to ask")
    List<String> prompt;

    @Option(names = {"-m", "--mode"}, description = "general, contracts, case-law or regulations", defaultValue = "general")
    String mode;

    @Option(names = "--fallback-on-quota", description = "Retry once on the fallback model when the primary is out of quota")
    boolean fallbackOnQuota;

    @Option(names = "--instant", description = "Print the whole answer at once instead of pacing it")
    boolean instant;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LexstreamRuntime runtime = context.openRuntime()) {
            AnswerPipeline pipeline = runtime.pipeline();
            ChatMode chatMode = ChatMode.parse(mode);
            String question = String.join(" ", prompt);
            ConsoleSink sink = new ConsoleSink(System.out);

            AnswerTurnHandle handle;
            try {
                handle = pipeline.ask(question, chatMode, sink);
            } catch (QuotaExhaustedException e) {
                if (!fallbackOnQuota || pipeline.models().activeTier() == ModelTier.FALLBACK) {
                    System.err.println(e.getMessage() + ". Re-run with --fallback-on-quota to use "
                        + runtime.config().gemini().fallbackModel() + ".");
                    return QUOTA_EXIT_CODE;
                }
                pipeline.models().markExhausted();
                System.err.println("Primary model out of quota, retrying with " + pipeline.models().activeModel());
                handle = pipeline.ask(question, chatMode, sink);
            }

            if (instant) {
                handle.cancel();
            }
            if (!handle.awaitPlayback(PLAYBACK_TIMEOUT)) {
                handle.cancel();
            }
            return 0;
        } catch (QuotaExhaustedException e) {
            System.err.println(e.getMessage());
            return QUOTA_EXIT_CODE;
        } catch (UpstreamException e) {
            System.err.println("Ask failed: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Ask interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Ask failed: " + e.getMessage());
            return 1;
        }
    }
}
