package io.lexstream.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lexstream.core.config.model.GeminiConfig;
import io.lexstream.core.model.AssembledResponse;
import io.lexstream.core.stream.ChunkDecoder;
import io.lexstream.core.stream.Frame;
import io.lexstream.core.stream.FrameReader;
import io.lexstream.core.stream.ResponseAccumulator;
import io.lexstream.core.wire.GenerateContentChunk;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GeminiStreamClient {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiStreamClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final long READ_CHUNK_BYTES = 8192;

    private final GeminiConfig config;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ChunkDecoder decoder;

    public GeminiStreamClient(GeminiConfig config) {
        this(config, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(config.connectTimeoutSeconds()))
            .readTimeout(Duration.ofSeconds(config.readTimeoutSeconds()))
            .writeTimeout(Duration.ofSeconds(config.connectTimeoutSeconds()))
            .build(), new ObjectMapper());
    }

    public GeminiStreamClient(GeminiConfig config, OkHttpClient client, ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.apiBase = HttpUrl.get(config.apiBase());
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.decoder = new ChunkDecoder(mapper);
    }

    public AssembledResponse stream(String model, String systemInstruction, List<HistoryEntry> contents)
        throws UpstreamException {
        return stream(model, systemInstruction, contents, null);
    }

    public AssembledResponse stream(
        String model,
        String systemInstruction,
        List<HistoryEntry> contents,
        Consumer<String> onText
    ) throws UpstreamException {
        Objects.requireNonNull(model, "model must not be null");
        if (!config.configured()) {
            throw new UpstreamTransportException("Missing Gemini API key", null);
        }

        Request request;
        try {
            request = buildRequest(model, systemInstruction, contents);
        } catch (IOException e) {
            throw new UpstreamTransportException("Failed to encode request: " + e.getMessage(), e);
        }

        LOG.debug("Streaming {} turn(s) to {}", contents.size(), model);
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body == null ? "" : body.string();
                if (response.code() == 429) {
                    throw new QuotaExhaustedException(model, errorBody);
                }
                throw new UpstreamTransportException(response.code(), errorBody);
            }
            if (body == null) {
                return new ResponseAccumulator().finish();
            }
            return consume(body.source(), onText);
        } catch (IOException e) {
            throw new UpstreamTransportException("Error calling " + model + ": " + e.getMessage(), e);
        }
    }

    private AssembledResponse consume(BufferedSource source, Consumer<String> onText) throws IOException {
        FrameReader reader = new FrameReader();
        ResponseAccumulator accumulator = new ResponseAccumulator();
        Buffer buffer = new Buffer();
        int frames = 0;
        while (source.read(buffer, READ_CHUNK_BYTES) != -1) {
            for (Frame frame : reader.ingest(buffer.readByteArray())) {
                frames++;
                apply(frame, accumulator, onText);
            }
        }
        Optional<Frame> trailing = reader.finish();
        if (trailing.isPresent()) {
            frames++;
            apply(trailing.get(), accumulator, onText);
        }
        LOG.debug("Stream ended after {} frame(s), {} applied", frames, accumulator.appliedDeltas());
        return accumulator.finish();
    }

    private void apply(Frame frame, ResponseAccumulator accumulator, Consumer<String> onText) {
        Optional<GenerateContentChunk> chunk = decoder.parse(frame);
        if (chunk.isEmpty()) {
            return;
        }
        int before = accumulator.text().length();
        accumulator.apply(chunk.get());
        if (onText != null && accumulator.text().length() > before) {
            onText.accept(accumulator.text());
        }
    }

    private Request buildRequest(String model, String systemInstruction, List<HistoryEntry> contents)
        throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (systemInstruction != null && !systemInstruction.isBlank()) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", systemInstruction))));
        }
        payload.put("contents", toWireContents(contents));

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("temperature", config.temperature());
        generationConfig.put("topP", config.topP());
        generationConfig.put("topK", config.topK());
        generationConfig.put("maxOutputTokens", config.maxOutputTokens());
        payload.put("generationConfig", generationConfig);
        payload.put("tools", List.of(Map.of("google_search", Map.of())));

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(streamUrl(model))
            .post(body)
            .header("x-goog-api-key", config.apiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream")
            .build();
    }

    private HttpUrl streamUrl(String model) {
        return apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(model + ":streamGenerateContent")
            .addQueryParameter("alt", "sse")
            .build();
    }

    private List<Map<String, Object>> toWireContents(List<HistoryEntry> contents) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (HistoryEntry entry : contents) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", entry.role().wireValue());
            row.put("parts", List.of(Map.of("text", entry.text())));
            wire.add(row);
        }
        return wire;
    }
}
