package io.lexstream.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lexstream.core.citation.CitationResolver;
import io.lexstream.core.citation.RedirectMarkers;
import io.lexstream.core.citation.RedirectProbe;
import io.lexstream.core.citation.SourceFilter;
import io.lexstream.core.config.model.GeminiConfig;
import io.lexstream.core.model.Source;
import io.lexstream.core.playback.PlaybackScheduler;
import io.lexstream.core.playback.PlaybackSettings;
import io.lexstream.core.provider.ChatMode;
import io.lexstream.core.provider.ConversationHistory;
import io.lexstream.core.provider.GeminiStreamClient;
import io.lexstream.core.provider.HistoryEntry;
import io.lexstream.core.provider.ModelFallbackController;
import io.lexstream.core.provider.QuotaExhaustedException;
import io.lexstream.core.session.AnswerTurn;
import io.lexstream.core.session.FileTurnStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnswerPipelineTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private static final Duration WAIT = Duration.ofSeconds(5);

    private static final String GROUNDED_SSE = """
        data: {"candidates":[{"content":{"parts":[{"text":"Employers may fire at will [1]."}]}}]}

        data: {"candidates":[{"content":{"parts":[{"text":"\\n\\n---FOLLOW_UP_QUESTIONS---\\nWhat are the exceptions to at-will?\\nDoes Montana follow at-will?"}]}}]}

        data: {"candidates":[{"content":{"parts":[]},"groundingMetadata":{"groundingChunks":[
        data: {"web":{"uri":"https://vertexaisearch.cloud.google.com/grounding-api-redirect/abc?url=https%3A%2F%2Fwww.nolo.com%2Fat-will","title":"nolo.com"}},
        data: {"web":{"uri":"https://www.oracle.com/legal","title":"Oracle Docs"}}
        data: ]}}]}

        """;

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ConversationHistory history;
    private ModelFallbackController models;
    private CitationResolver resolver;
    private PlaybackScheduler playback;
    private FileTurnStore store;
    private AnswerPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        GeminiConfig config = new GeminiConfig("key", server.url("/v1beta").toString(), null, null, 0.7, 0.95, 40, 8192, 5, 5);
        history = new ConversationHistory();
        models = new ModelFallbackController(GeminiConfig.DEFAULT_PRIMARY_MODEL, GeminiConfig.DEFAULT_FALLBACK_MODEL);
        resolver = new CitationResolver(RedirectMarkers.defaults(), RedirectProbe.disabled(), 2, Duration.ofSeconds(2));
        playback = new PlaybackScheduler(PlaybackSettings.immediate());
        store = new FileTurnStore(tempDir.resolve("history/turns.json"));
        pipeline = new AnswerPipeline(
            new GeminiStreamClient(config, new OkHttpClient(), new ObjectMapper()),
            models,
            history,
            resolver,
            SourceFilter.defaults(),
            playback,
            store,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        playback.close();
        resolver.close();
        server.shutdown();
    }

    @Test
    void shouldAnswerWithResolvedSourcesAndCommitTurnOnce() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(GROUNDED_SSE));
        RecordingSink sink = new RecordingSink();

        AnswerTurnHandle handle = pipeline.ask("Can my employer fire me?", ChatMode.GENERAL, sink);
        assertThat(handle.awaitPlayback(WAIT)).isTrue();

        assertThat(handle.model()).isEqualTo("gemini-2.5-flash");
        assertThat(handle.response().fullText()).isEqualTo("Employers may fire at will [1].");
        assertThat(handle.response().sources()).extracting(Source::url).containsExactly("https://www.nolo.com/at-will");
        assertThat(handle.response().followUpQuestions()).containsExactly(
            "What are the exceptions to at-will?",
            "Does Montana follow at-will?"
        );

        assertThat(sink.lastRevealed()).isEqualTo("Employers may fire at will [1].");
        assertThat(sink.completions()).isEqualTo(1);
        assertThat(sink.sources()).extracting(Source::title).containsExactly("nolo.com");

        List<AnswerTurn> turns = store.list();
        assertThat(turns).hasSize(1);
        assertThat(turns.get(0).createdAt()).isEqualTo(NOW);
        assertThat(turns.get(0).prompt()).isEqualTo("Can my employer fire me?");
        assertThat(turns.get(0).followUpQuestions()).hasSize(2);

        assertThat(history.snapshot()).containsExactly(
            HistoryEntry.user("Can my employer fire me?"),
            HistoryEntry.model("Employers may fire at will [1].")
        );
    }

    @Test
    void shouldTakePromptBackOnQuotaAndServeRetryFromFallback() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody(
            "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Fallback answer\"}]}}]}\n\n"
        ));
        RecordingSink sink = new RecordingSink();

        assertThatThrownBy(() -> pipeline.ask("Question", ChatMode.CONTRACTS, sink))
            .isInstanceOf(QuotaExhaustedException.class);
        assertThat(history.size()).isZero();

        models.markExhausted();
        AnswerTurnHandle handle = pipeline.ask("Question", ChatMode.CONTRACTS, sink);
        assertThat(handle.awaitPlayback(WAIT)).isTrue();

        assertThat(handle.model()).isEqualTo("gemini-2.5-flash-lite");
        assertThat(server.takeRequest().getPath()).contains("gemini-2.5-flash:");
        assertThat(server.takeRequest().getPath()).contains("gemini-2.5-flash-lite:");
        assertThat(history.snapshot()).extracting(HistoryEntry::text).containsExactly("Question", "Fallback answer");
        assertThat(store.list()).extracting(AnswerTurn::model).containsExactly("gemini-2.5-flash-lite");
    }

    @Test
    void shouldRejectTurnWithoutMainAnswer() {
        server.enqueue(new MockResponse().setBody(
            "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"---FOLLOW_UP_QUESTIONS---\\nWhat else should I know?\"}]}}]}\n\n"
        ));
        RecordingSink sink = new RecordingSink();

        assertThatThrownBy(() -> pipeline.ask("Question", ChatMode.GENERAL, sink))
            .isInstanceOf(EmptyAnswerException.class);
        assertThat(history.size()).isZero();
        assertThat(playback.current()).isEmpty();
        assertThat(sink.completions()).isZero();
    }

    @Test
    void shouldDeriveSourcesFromTextWhenNoneWereCited() throws Exception {
        server.enqueue(new MockResponse().setBody(
            "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Filing rules are at https://www.eeoc.gov/filing.\\n\\nSources:\\nEEOC\"}]}}]}\n\n"
        ));
        RecordingSink sink = new RecordingSink();

        AnswerTurnHandle handle = pipeline.ask("How do I file?", ChatMode.REGULATIONS, sink);
        assertThat(handle.awaitPlayback(WAIT)).isTrue();

        assertThat(handle.response().fullText()).isEqualTo("Filing rules are at https://www.eeoc.gov/filing.[1]");
        assertThat(handle.response().sources()).extracting(Source::url).containsExactly("https://www.eeoc.gov/filing");
    }

    @Test
    void shouldTakePromptBackWhenPlaybackCannotStart() {
        server.enqueue(new MockResponse().setBody(
            "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Short answer\"}]}}]}\n\n"
        ));
        playback.close();
        RecordingSink sink = new RecordingSink();

        assertThatThrownBy(() -> pipeline.ask("Question", ChatMode.GENERAL, sink))
            .isInstanceOf(RejectedExecutionException.class);
        assertThat(history.size()).isZero();
        assertThat(sink.completions()).isZero();
    }

    @Test
    void shouldStopPlaybackAndForgetConversationOnReset() throws Exception {
        server.enqueue(new MockResponse().setBody(
            "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Short answer\"}]}}]}\n\n"
        ));
        AnswerTurnHandle handle = pipeline.ask("Question", ChatMode.GENERAL, new RecordingSink());
        models.markExhausted();

        pipeline.reset();

        assertThat(handle.awaitPlayback(WAIT)).isTrue();
        assertThat(history.size()).isZero();
        assertThat(models.activeModel()).isEqualTo("gemini-2.5-flash");
    }

    private static final class RecordingSink implements PresentationSink {
        private final List<String> revealed = new ArrayList<>();
        private List<Source> sources = List.of();
        private int completions;

        @Override
        public synchronized void revealed(String textSoFar) {
            revealed.add(textSoFar);
        }

        @Override
        public synchronized void completed(List<Source> sources, List<String> followUpQuestions) {
            this.sources = sources;
            completions++;
        }

        synchronized String lastRevealed() {
            return revealed.isEmpty() ? "" : revealed.get(revealed.size() - 1);
        }

        synchronized int completions() {
            return completions;
        }

        synchronized List<Source> sources() {
            return sources;
        }
    }
}
