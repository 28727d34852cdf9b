package io.lexstream.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.lexstream.core.model.Source;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnswerTurn(
    Instant createdAt,
    String prompt,
    String answer,
    List<Source> sources,
    List<String> followUpQuestions,
    String model
) {

    public AnswerTurn {
        sources = sources == null ? List.of() : List.copyOf(sources);
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
    }
}
