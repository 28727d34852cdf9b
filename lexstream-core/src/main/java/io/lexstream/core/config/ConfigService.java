package io.lexstream.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lexstream.core.config.model.GeminiConfig;
import io.lexstream.core.config.model.LexstreamConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    public static final String API_KEY_ENV = "GEMINI_API_KEY";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public LexstreamConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return LexstreamConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(LexstreamConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, LexstreamConfig.class);
    }

    public void save(Path configPath, LexstreamConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        LexstreamConfig config;
        if (created || overwrite) {
            config = LexstreamConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path history = ConfigPaths.resolveHistory(config.storage().historyPath());
        Path historyDir = history.toAbsolutePath().getParent();
        if (historyDir != null) {
            Files.createDirectories(historyDir);
        }
        return new OnboardResult(configPath, history, created, overwritten, Files.isRegularFile(history));
    }

    // A key in the file always wins over the environment.
    public LexstreamConfig applyEnvironment(LexstreamConfig config, Map<String, String> environment) {
        GeminiConfig gemini = config.gemini();
        String fromEnv = environment.get(API_KEY_ENV);
        if (gemini.configured() || fromEnv == null || fromEnv.isBlank()) {
            return config;
        }
        return config.withGemini(gemini.withApiKey(fromEnv.trim()));
    }

    public String toPrettyJson(LexstreamConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
