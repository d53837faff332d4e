package com.phillippitts.livetranslate.service.translation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into sentences after {@code .}, {@code ?}, {@code !} and the Arabic question
 * mark {@code ؟}. Blank pieces are dropped; each sentence is trimmed.
 */
final class SentenceSplitter {

    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.?!؟])\\s*");

    private SentenceSplitter() {}

    static List<String> split(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String piece : BOUNDARY.split(text)) {
            String s = piece.trim();
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }
}
