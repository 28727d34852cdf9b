package io.lexstream.core.pipeline;

import io.lexstream.core.citation.CitationResolver;
import io.lexstream.core.citation.HttpRedirectProbe;
import io.lexstream.core.citation.RedirectMarkers;
import io.lexstream.core.citation.RedirectProbe;
import io.lexstream.core.citation.SourceFilter;
import io.lexstream.core.config.ConfigPaths;
import io.lexstream.core.config.model.CitationsConfig;
import io.lexstream.core.config.model.LexstreamConfig;
import io.lexstream.core.playback.PlaybackScheduler;
import io.lexstream.core.provider.ConversationHistory;
import io.lexstream.core.provider.GeminiStreamClient;
import io.lexstream.core.provider.ModelFallbackController;
import io.lexstream.core.session.FileTurnStore;
import io.lexstream.core.session.TurnStore;
import java.time.Duration;

public final class LexstreamRuntime implements AutoCloseable {
    private final LexstreamConfig config;
    private final CitationResolver resolver;
    private final PlaybackScheduler playback;
    private final TurnStore store;
    private final AnswerPipeline pipeline;

    private LexstreamRuntime(
        LexstreamConfig config,
        CitationResolver resolver,
        PlaybackScheduler playback,
        TurnStore store,
        AnswerPipeline pipeline
    ) {
        this.config = config;
        this.resolver = resolver;
        this.playback = playback;
        this.store = store;
        this.pipeline = pipeline;
    }

    public static LexstreamRuntime create(LexstreamConfig config) {
        CitationsConfig citations = config.citations();
        RedirectMarkers markers = new RedirectMarkers(citations.redirectMarkers());
        RedirectProbe probe = citations.probeEnabled()
            ? new HttpRedirectProbe(markers, Duration.ofSeconds(citations.probeTimeoutSeconds()), citations.userAgent())
            : RedirectProbe.disabled();
        CitationResolver resolver = new CitationResolver(
            markers,
            probe,
            citations.maxConcurrentProbes(),
            Duration.ofSeconds(citations.resolveTimeoutSeconds())
        );
        PlaybackScheduler playback = new PlaybackScheduler(config.playback().toSettings());
        TurnStore store = new FileTurnStore(ConfigPaths.resolveHistory(config.storage().historyPath()));
        AnswerPipeline pipeline = new AnswerPipeline(
            new GeminiStreamClient(config.gemini()),
            new ModelFallbackController(config.gemini().primaryModel(), config.gemini().fallbackModel()),
            new ConversationHistory(),
            resolver,
            new SourceFilter(citations.denylist()),
            playback,
            store
        );
        return new LexstreamRuntime(config, resolver, playback, store, pipeline);
    }

    public LexstreamConfig config() {
        return config;
    }

    public AnswerPipeline pipeline() {
        return pipeline;
    }

    public CitationResolver resolver() {
        return resolver;
    }

    public TurnStore store() {
        return store;
    }

    @Override
    public void close() {
        playback.close();
        resolver.close();
    }
}
