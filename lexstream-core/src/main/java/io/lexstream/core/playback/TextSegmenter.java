package io.lexstream.core.playback;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits answer text into playback tokens. A bracketed citation such as {@code [3]} is always
 * one token, and each marker of a run like {@code [1][2]} is its own token. Consecutive
 * whitespace collapses into a single token. A {@code [} without a closing bracket is plain
 * word text.
 */
public final class TextSegmenter {

    public List<PlaybackToken> segment(String text) {
        List<PlaybackToken> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }

        StringBuilder word = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '[' && text.indexOf(']', i + 1) >= 0) {
                flushWord(word, tokens);
                while (i < text.length() && text.charAt(i) == '[') {
                    int close = text.indexOf(']', i + 1);
                    if (close < 0) {
                        break;
                    }
                    tokens.add(PlaybackToken.citation(text.substring(i, close + 1)));
                    i = close + 1;
                }
            } else if (Character.isWhitespace(c)) {
                flushWord(word, tokens);
                int start = i;
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                tokens.add(PlaybackToken.whitespace(text.substring(start, i)));
            } else {
                word.append(c);
                i++;
            }
        }
        flushWord(word, tokens);
        return tokens;
    }

    private void flushWord(StringBuilder word, List<PlaybackToken> tokens) {
        if (word.length() > 0) {
            tokens.add(PlaybackToken.word(word.toString()));
            word.setLength(0);
        }
    }
}
