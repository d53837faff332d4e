package com.phillippitts.livetranslate.service.stt;

import java.util.regex.Pattern;

/**
 * Normalizes raw engine text before it is shown or translated.
 *
 * <ul>
 *   <li>runs of two or more {@code /} become a space</li>
 *   <li>whitespace runs collapse to one space</li>
 *   <li>spaces before {@code . , ! ? ; :} are removed</li>
 * </ul>
 * The result is trimmed; null becomes "".
 */
public final class TranscriptCleaner {

    private static final Pattern SLASH_RUNS = Pattern.compile("/{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("\\s+([.,!?;:])");

    private TranscriptCleaner() {}

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String s = SLASH_RUNS.matcher(text).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        s = SPACE_BEFORE_PUNCT.matcher(s).replaceAll("$1");
        return s.trim();
    }
}
