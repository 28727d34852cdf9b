package io.lexstream.core.response;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class CitationMarkerInjector {
    private static final Pattern MARKER = Pattern.compile("\\[\\d+]");
    private static final String PARAGRAPH_BREAK = "\n\n";

    public String inject(String text, int sourceCount) {
        if (text == null || text.isBlank() || sourceCount <= 0 || MARKER.matcher(text).find()) {
            return text;
        }

        List<String> paragraphs = new ArrayList<>();
        for (String paragraph : text.split(PARAGRAPH_BREAK)) {
            if (!paragraph.isBlank()) {
                paragraphs.add(paragraph);
            }
        }

        int perParagraph = Math.max(1, sourceCount / paragraphs.size());
        int next = 1;
        List<String> marked = new ArrayList<>(paragraphs.size());
        for (String paragraph : paragraphs) {
            int last = Math.min(next + perParagraph - 1, sourceCount);
            if (next > last) {
                marked.add(paragraph);
                continue;
            }
            marked.add(insertAfterLastSentence(paragraph, markers(next, last)));
            next = last + 1;
        }

        String result = String.join(PARAGRAPH_BREAK, marked);
        return next <= sourceCount ? result + markers(next, sourceCount) : result;
    }

    private static String insertAfterLastSentence(String paragraph, String markers) {
        int end = Math.max(paragraph.lastIndexOf('.'), Math.max(paragraph.lastIndexOf('!'), paragraph.lastIndexOf('?')));
        if (end < 0) {
            return paragraph + markers;
        }
        return paragraph.substring(0, end + 1) + markers + paragraph.substring(end + 1);
    }

    private static String markers(int from, int to) {
        StringBuilder builder = new StringBuilder();
        for (int i = from; i <= to; i++) {
            builder.append('[').append(i).append(']');
        }
        return builder.toString();
    }
}
