package io.lexstream.core.stream;

import io.lexstream.core.model.CitationFragment;
import java.util.List;

public record ResponseDelta(String text, List<CitationFragment> citations) {

    public ResponseDelta {
        text = text == null ? "" : text;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public boolean isEmpty() {
        return text.isEmpty() && citations.isEmpty();
    }
}
