package io.lexstream.core.model;

import java.util.List;

public record AssembledResponse(String fullText, List<Source> sources, List<String> followUpQuestions) {
    public static final int MAX_FOLLOW_UPS = 5;

    public AssembledResponse {
        fullText = fullText == null ? "" : fullText;
        sources = sources == null ? List.of() : List.copyOf(sources);
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
        if (followUpQuestions.size() > MAX_FOLLOW_UPS) {
            throw new IllegalArgumentException("at most " + MAX_FOLLOW_UPS + " follow-up questions are allowed");
        }
    }

    public AssembledResponse withSources(List<Source> newSources) {
        return new AssembledResponse(fullText, newSources, followUpQuestions);
    }
}
