package io.lexstream.core.response;

import java.util.List;

public record SplitResponse(String mainText, List<String> followUpQuestions) {

    public SplitResponse {
        mainText = mainText == null ? "" : mainText;
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
    }
}
