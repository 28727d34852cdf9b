package io.lexstream.core.response;

import io.lexstream.core.model.AssembledResponse;
import java.util.List;

public final class ResponseSplitter {
    public static final String SENTINEL = "---FOLLOW_UP_QUESTIONS---";
    public static final int MIN_QUESTION_LENGTH = 10;

    public SplitResponse split(String fullText) {
        String text = fullText == null ? "" : fullText;
        int at = text.indexOf(SENTINEL);
        if (at < 0) {
            return new SplitResponse(text, List.of());
        }

        String main = text.substring(0, at).strip();
        String section = text.substring(at + SENTINEL.length());
        int end = section.indexOf(SENTINEL);
        if (end >= 0) {
            section = section.substring(0, end);
        }

        List<String> questions = section.strip().lines()
            .map(String::strip)
            .filter(line -> line.length() > MIN_QUESTION_LENGTH)
            .limit(AssembledResponse.MAX_FOLLOW_UPS)
            .toList();
        return new SplitResponse(main, questions);
    }
}
