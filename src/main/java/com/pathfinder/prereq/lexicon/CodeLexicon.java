package com.pathfinder.prereq.lexicon;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Course code normalization. {@code "cs 135"}, {@code "CS-135"} and {@code "CS135"} all map to {@code CS135}.
 */
public final class CodeLexicon {
    /** Department letters (2-5) followed by a 2-3 digit level and an optional suffix letter. */
    public static final Pattern CODE_PATTERN = Pattern.compile("\\b([A-Z]{2,5})\\s*-?\\s*(\\d{2,3}[A-Z]?)\\b");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LETTERS_THEN_DIGITS = Pattern.compile("[A-Z]+\\d+");

    private CodeLexicon() {
    }

    public static Optional<String> canonicalize(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String code = WHITESPACE.matcher(text.toUpperCase(Locale.ROOT)).replaceAll("").replace("-", "");
        return LETTERS_THEN_DIGITS.matcher(code).find() ? Optional.of(code) : Optional.empty();
    }

    /** First code occurring in the text, e.g. {@code "CS 136 LAB,LEC 0.50"} gives {@code CS136}. */
    public static Optional<String> extract(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher m = CODE_PATTERN.matcher(text);
        return m.find() ? Optional.of(join(m)) : Optional.empty();
    }

    /** Canonical code for a match of {@link #CODE_PATTERN}. */
    public static String join(Matcher match) {
        return (match.group(1) + match.group(2)).toUpperCase(Locale.ROOT);
    }
}
