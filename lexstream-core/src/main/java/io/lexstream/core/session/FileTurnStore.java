package io.lexstream.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FileTurnStore implements TurnStore {
    private final Path path;
    private final ObjectMapper mapper;

    public FileTurnStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(AnswerTurn turn) throws IOException {
        Objects.requireNonNull(turn, "turn must not be null");
        List<AnswerTurn> existing = new ArrayList<>(list());
        existing.add(turn);
        save(existing);
    }

    @Override
    public synchronized List<AnswerTurn> list() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        return mapper.readValue(Files.readString(path), new TypeReference<List<AnswerTurn>>() {
        });
    }

    public Path path() {
        return path;
    }

    private void save(List<AnswerTurn> turns) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(turns);
        Files.writeString(path, json + System.lineSeparator());
    }
}
