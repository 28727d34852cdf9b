package io.lexstream.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.lexstream.core.model.Source;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileTurnStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListNothingBeforeFirstAppend() throws Exception {
        assertThat(new FileTurnStore(tempDir.resolve("turns.json")).list()).isEmpty();
    }

    @Test
    void shouldAppendTurnsInOrderAcrossInstances() throws Exception {
        Path path = tempDir.resolve("nested/turns.json");
        Source source = new Source("s-1", "EEOC", "https://www.eeoc.gov/laws", "Federal laws", null);
        AnswerTurn first = new AnswerTurn(
            Instant.parse("2026-01-05T10:00:00Z"),
            "What is Title VII?",
            "Title VII prohibits discrimination [1].",
            List.of(source),
            List.of("Who enforces Title VII?"),
            "gemini-2.5-flash"
        );
        AnswerTurn second = new AnswerTurn(Instant.parse("2026-01-05T10:05:00Z"), "Next", "Answer", null, null, "m");

        new FileTurnStore(path).append(first);
        new FileTurnStore(path).append(second);

        List<AnswerTurn> turns = new FileTurnStore(path).list();
        assertThat(turns).containsExactly(first, second);
        assertThat(turns.get(0).sources().get(0).id()).isEqualTo("s-1");
        assertThat(Files.readString(path)).contains("2026-01-05T10:00:00Z");
    }
}
