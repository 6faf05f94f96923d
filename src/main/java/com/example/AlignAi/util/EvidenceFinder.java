package com.example.AlignAi.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Locates short excerpts of a text that mention a term: the first sentence containing it, otherwise a
 * fixed window around the first occurrence.
 */
public final class EvidenceFinder {

    public static final int MAX_EVIDENCE_CHARS = 200;
    public static final int WINDOW_RADIUS = 50;
    public static final int MIN_SNIPPET_CHARS = 20;

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final String ELLIPSIS = "...";

    private EvidenceFinder() {}

    /**
     * Evidence for a detected skill. Empty when the term never occurs literally.
     */
    public static String evidence(String text, String term) {
        if (isBlank(text) || isBlank(term)) return "";
        String needle = term.toLowerCase(Locale.ROOT);
        for (String sentence : SENTENCE_END.split(text)) {
            if (sentence.toLowerCase(Locale.ROOT).contains(needle)) {
                return truncate(sentence.strip());
            }
        }
        return window(text, term);
    }

    /**
     * Like {@link #evidence} but only accepts sentences between 20 and 200 characters, so that very
     * short fragments and run-on paragraphs fall through to the window.
     */
    public static String snippet(String text, String term) {
        if (isBlank(text) || isBlank(term)) return "";
        String needle = term.toLowerCase(Locale.ROOT);
        for (String sentence : SENTENCE_END.split(text)) {
            String cleaned = sentence.strip();
            if (cleaned.toLowerCase(Locale.ROOT).contains(needle)
                    && cleaned.length() >= MIN_SNIPPET_CHARS && cleaned.length() <= MAX_EVIDENCE_CHARS) {
                return cleaned;
            }
        }
        return window(text, term);
    }

    /**
     * Case-insensitive search whose result indexes {@code text} itself. Lower-casing can change the
     * length of a string, so positions found in a lower-cased copy do not carry over.
     */
    public static int indexOfIgnoreCase(String text, String term) {
        if (text == null || term == null || term.isEmpty()) return -1;
        int last = text.length() - term.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) return i;
        }
        return -1;
    }

    public static String truncate(String s) {
        if (s == null) return "";
        if (s.length() <= MAX_EVIDENCE_CHARS) return s;
        return s.substring(0, MAX_EVIDENCE_CHARS - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String window(String text, String term) {
        int pos = indexOfIgnoreCase(text, term);
        if (pos < 0) return "";
        int start = Math.max(0, pos - WINDOW_RADIUS);
        int end = Math.min(text.length(), pos + term.length() + WINDOW_RADIUS);
        return truncate(text.substring(start, end).strip());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
