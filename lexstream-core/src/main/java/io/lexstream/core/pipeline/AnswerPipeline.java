package io.lexstream.core.pipeline;

import io.lexstream.core.citation.CitationResolver;
import io.lexstream.core.citation.SourceFilter;
import io.lexstream.core.model.AssembledResponse;
import io.lexstream.core.model.Source;
import io.lexstream.core.playback.PlaybackScheduler;
import io.lexstream.core.playback.PlaybackSession;
import io.lexstream.core.provider.ChatMode;
import io.lexstream.core.provider.ConversationHistory;
import io.lexstream.core.provider.GeminiStreamClient;
import io.lexstream.core.provider.ModelFallbackController;
import io.lexstream.core.provider.UpstreamException;
import io.lexstream.core.response.CitationMarkerInjector;
import io.lexstream.core.response.InlineSourceExtractor;
import io.lexstream.core.response.ResponseSanitizer;
import io.lexstream.core.response.ResponseSplitter;
import io.lexstream.core.response.SplitResponse;
import io.lexstream.core.session.AnswerTurn;
import io.lexstream.core.session.TurnStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AnswerPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(AnswerPipeline.class);

    private final GeminiStreamClient client;
    private final ModelFallbackController models;
    private final ConversationHistory history;
    private final CitationResolver resolver;
    private final SourceFilter filter;
    private final PlaybackScheduler playback;
    private final TurnStore store;
    private final Clock clock;
    private final ResponseSplitter splitter = new ResponseSplitter();
    private final ResponseSanitizer sanitizer = new ResponseSanitizer();
    private final InlineSourceExtractor inlineSources = new InlineSourceExtractor();
    private final CitationMarkerInjector markers = new CitationMarkerInjector();

    public AnswerPipeline(
        GeminiStreamClient client,
        ModelFallbackController models,
        ConversationHistory history,
        CitationResolver resolver,
        SourceFilter filter,
        PlaybackScheduler playback,
        TurnStore store
    ) {
        this(client, models, history, resolver, filter, playback, store, Clock.systemUTC());
    }

    public AnswerPipeline(
        GeminiStreamClient client,
        ModelFallbackController models,
        ConversationHistory history,
        CitationResolver resolver,
        SourceFilter filter,
        PlaybackScheduler playback,
        TurnStore store,
        Clock clock
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        this.playback = Objects.requireNonNull(playback, "playback must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs one turn on the calling thread up to the start of playback.
     *
     * <p>Whatever fails before playback starts takes the prompt back out of the history, so
     * the caller can issue it again.
     *
     * @throws UpstreamException when the request fails
     * @throws EmptyAnswerException when the answer has no main text
     */
    public AnswerTurnHandle ask(String prompt, ChatMode mode, PresentationSink sink) throws UpstreamException {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(sink, "sink must not be null");
        ChatMode effectiveMode = mode == null ? ChatMode.GENERAL : mode;
        String model = models.activeModel();

        history.appendUser(prompt);
        AssembledResponse assembled;
        PlaybackSession session;
        try {
            AssembledResponse answer = assemble(model, effectiveMode);
            session = playback.start(
                answer.fullText(),
                sink::revealed,
                finished -> finishTurn(prompt, model, answer, sink)
            );
            assembled = answer;
        } catch (UpstreamException | RuntimeException e) {
            history.removeLastUser();
            throw e;
        }
        history.appendModel(assembled.fullText());
        return new AnswerTurnHandle(assembled, session, model);
    }

    private AssembledResponse assemble(String model, ChatMode mode) throws UpstreamException {
        AssembledResponse streamed = client.stream(model, mode.systemInstruction(), history.snapshot());

        SplitResponse split = splitter.split(streamed.fullText());
        String mainText = sanitizer.sanitize(split.mainText());
        if (mainText.isBlank()) {
            throw new EmptyAnswerException(model);
        }

        List<Source> sources = filter.filter(resolver.resolveAll(streamed.sources()));
        if (sources.isEmpty()) {
            sources = filter.filter(inlineSources.extract(split.mainText()));
            if (!sources.isEmpty()) {
                LOG.debug("Derived {} source(s) from the answer text", sources.size());
            }
        }
        mainText = markers.inject(mainText, sources.size());
        AssembledResponse assembled = new AssembledResponse(mainText, sources, split.followUpQuestions());
        LOG.info(
            "Answer from {}: {} chars, {} source(s), {} follow-up(s)",
            model,
            mainText.length(),
            sources.size(),
            assembled.followUpQuestions().size()
        );
        return assembled;
    }

    public void reset() {
        playback.cancelCurrent();
        history.clear();
        models.reset();
    }

    public ModelFallbackController models() {
        return models;
    }

    private void finishTurn(String prompt, String model, AssembledResponse assembled, PresentationSink sink) {
        AnswerTurn turn = new AnswerTurn(
            Instant.now(clock),
            prompt,
            assembled.fullText(),
            assembled.sources(),
            assembled.followUpQuestions(),
            model
        );
        try {
            store.append(turn);
        } catch (IOException e) {
            LOG.warn("Failed to store answer turn: {}", e.getMessage(), e);
        }
        sink.completed(assembled.sources(), assembled.followUpQuestions());
    }
}
