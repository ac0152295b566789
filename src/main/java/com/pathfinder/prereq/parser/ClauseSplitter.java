package com.pathfinder.prereq.parser;

import java.util.*;

/**
 * Splits prerequisite prose at top level only; nothing inside parentheses is ever split.
 */
public final class ClauseSplitter {
    public static final String SEMICOLON = ";";
    public static final String COMMA = ",";
    public static final String AND_WORD = " and ";

    private ClauseSplitter() {
    }

    /**
     * Splits on {@code separator} where the parenthesis depth is zero. Single characters match exactly,
     * longer separators match case-insensitively. Parts are trimmed and empty parts dropped.
     */
    public static List<String> splitOutsideParens(String text, String separator) {
        if (text == null || text.isEmpty()) return List.of();
        if (separator == null || separator.isEmpty()) return part(text.trim());

        String lower = text.toLowerCase(Locale.ROOT);
        String sep = separator.toLowerCase(Locale.ROOT);
        List<String> parts = new ArrayList<>();
        StringBuilder buf = new StringBuilder();
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && lower.startsWith(sep, i)) {
                flush(buf, parts);
                i += sep.length();
                continue;
            }
            buf.append(ch);
            i++;
        }
        flush(buf, parts);
        return parts;
    }

    /** Start and end (exclusive) offsets of each outermost parenthesized segment. */
    public static List<int[]> topLevelParenSegments(String text) {
        List<int[]> segments = new ArrayList<>();
        int depth = 0;
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                if (depth == 0) start = i;
                depth++;
            } else if (ch == ')' && depth > 0) {
                depth--;
                if (depth == 0 && start >= 0) {
                    segments.add(new int[]{start, i + 1});
                    start = -1;
                }
            }
        }
        return segments;
    }

    private static void flush(StringBuilder buf, List<String> parts) {
        String part = buf.toString().trim();
        if (!part.isEmpty()) parts.add(part);
        buf.setLength(0);
    }

    private static List<String> part(String text) {
        return text.isEmpty() ? List.of() : List.of(text);
    }
}
