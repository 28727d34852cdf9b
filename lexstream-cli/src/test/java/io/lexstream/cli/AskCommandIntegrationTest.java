package io.lexstream.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.lexstream.core.config.ConfigService;
import io.lexstream.core.pipeline.LexstreamRuntime;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class AskCommandIntegrationTest {

    private static final String ANSWER_SSE = """
        data: {"candidates":[{"content":{"parts":[{"text":"Title VII bars discrimination [1].\\n---FOLLOW_UP_QUESTIONS---\\nWho enforces Title VII?"}]}}]}

        data: {"candidates":[{"content":{"parts":[]},"groundingMetadata":{"groundingChunks":[{"web":{"uri":"https://vertexaisearch.cloud.google.com/grounding-api-redirect/x?originalUrl=https%3A%2F%2Fwww.eeoc.gov%2Flaws","title":"EEOC"}}]}}]}

        """;

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPrintAnswerSourcesAndFollowUps() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(ANSWER_SSE));

        Result result = run(new AskCommand(context()), "What", "is", "Title", "VII?");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("Title VII bars discrimination [1].")
            .contains("[1] EEOC - https://www.eeoc.gov/laws")
            .contains("- Who enforces Title VII?")
            .doesNotContain("FOLLOW_UP_QUESTIONS");
        assertThat(Files.readString(tempDir.resolve("history/turns.json"))).contains("What is Title VII?");

        Result history = run(new HistoryCommand(context()));
        assertThat(history.code()).isEqualTo(0);
        assertThat(history.out()).contains("[gemini-2.5-flash] What is Title VII? (1 sources)");
    }

    @Test
    void shouldExitWithQuotaCodeWhenPrimaryIsExhausted() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429));

        Result result = run(new AskCommand(context()), "--mode", "case-law", "question");

        assertThat(result.code()).isEqualTo(AskCommand.QUOTA_EXIT_CODE);
        assertThat(result.err()).contains("--fallback-on-quota").contains("gemini-2.5-flash-lite");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRetryOnFallbackModelWhenAsked() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setBody(ANSWER_SSE));

        Result result = run(new AskCommand(context()), "--fallback-on-quota", "--instant", "question");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains("Title VII bars discrimination [1].");
        assertThat(server.takeRequest().getPath()).contains("/gemini-2.5-flash:");
        assertThat(server.takeRequest().getPath()).contains("/gemini-2.5-flash-lite:");
    }

    @Test
    void shouldReportUpstreamFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("backend error"));

        Result result = run(new AskCommand(context()), "question");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Ask failed: HTTP 500: backend error");
    }

    @Test
    void shouldResolveLinksOffline() throws Exception {
        Result result = run(
            new ResolveCommand(context()),
            "--offline",
            "https://vertexaisearch.cloud.google.com/grounding-api-redirect/x?url=https%3A%2F%2Fwww.dol.gov%2Fflsa"
        );

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains("-> https://www.dol.gov/flsa");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldReportConfigurationStatus() throws Exception {
        Result result = run(new StatusCommand(context()));

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("Gemini configured: true")
            .contains("Primary model: gemini-2.5-flash")
            .contains("Citation probe enabled: false");
    }

    private CliContext context() throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "gemini": {
                "apiKey": "g-test",
                "apiBase": "%s"
              },
              "citations": {
                "probeEnabled": false
              },
              "playback": {
                "wordDelayMillis": 0,
                "whitespaceDelayMillis": 0
              },
              "storage": {
                "historyPath": "%s"
              }
            }
            """.formatted(
                server.url("/v1beta").toString(),
                tempDir.resolve("history/turns.json").toString().replace("\\", "\\\\")
            ), StandardCharsets.UTF_8);
        return new CliContext(new ConfigService(), configPath, Map.of(), LexstreamRuntime::create);
    }

    private static Result run(Object command, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
        return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private record Result(int code, String out, String err) {
    }
}
