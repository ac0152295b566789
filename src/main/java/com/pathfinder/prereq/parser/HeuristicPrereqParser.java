package com.pathfinder.prereq.parser;

import com.pathfinder.prereq.domain.DomainModels.PrereqClause;
import com.pathfinder.prereq.domain.DomainModels.PrereqExpression;
import com.pathfinder.prereq.domain.DomainModels.PrereqItem;
import com.pathfinder.prereq.lexicon.CodeLexicon;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.pathfinder.prereq.parser.ClauseSplitter.*;

@Component
public class HeuristicPrereqParser {
    private static final Pattern GRADE_PATTERN = Pattern.compile(
            "with (?:a )?grade of at least\\s*(\\d{1,3})\\s*%|with at least\\s*(\\d{1,3})\\s*%",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OR_WORD = Pattern.compile("\\bor\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    static final int GRADE_LOOKAHEAD = 90;

    public PrereqExpression parse(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return PrereqExpression.empty();

        List<PrereqClause> distributed = distributeParenthesizedAlternative(normalized);
        if (!distributed.isEmpty()) return new PrereqExpression(distributed);

        return new PrereqExpression(toClauses(splitClauses(normalized)));
    }

    /** Semicolons first, then commas, then the word "and"; the first strategy giving several parts wins. */
    List<String> splitClauses(String text) {
        List<String> parts = splitOutsideParens(text, SEMICOLON);
        if (parts.size() <= 1) parts = splitOutsideParens(text, COMMA);
        if (parts.size() <= 1) parts = splitOutsideParens(text, AND_WORD);
        return parts;
    }

    /**
     * {@code (A) or (B1; B2) ...} becomes {@code (A or B1) and (A or B2) ...}. Text after the second
     * segment is parsed on its own and appended. Returns an empty list when the pattern does not apply.
     */
    private List<PrereqClause> distributeParenthesizedAlternative(String text) {
        List<int[]> segments = topLevelParenSegments(text);
        if (segments.size() < 2) return List.of();

        int[] first = segments.get(0);
        int[] second = segments.get(1);
        if (!OR_WORD.matcher(text.substring(first[1], second[0])).find()) return List.of();

        List<PrereqItem> left = new ArrayList<>();
        toClauses(splitClauses(inner(text, first))).forEach(c -> left.addAll(c.items()));
        List<PrereqClause> right = parse(inner(text, second)).clauses();

        List<PrereqClause> out = new ArrayList<>();
        if (!left.isEmpty()) {
            for (PrereqClause r : right) {
                List<PrereqItem> combined = new ArrayList<>(left);
                combined.addAll(r.items());
                out.add(new PrereqClause(combined));
            }
        }
        out.addAll(toClauses(splitClauses(text.substring(second[1]))));
        return out;
    }

    private List<PrereqClause> toClauses(List<String> candidates) {
        List<PrereqClause> clauses = new ArrayList<>();
        for (String candidate : candidates) {
            List<PrereqItem> items = extractItems(candidate);
            if (!items.isEmpty()) clauses.add(new PrereqClause(items));
        }
        return clauses;
    }

    /** Every code in the clause, each with the grade phrase found before the next code (if any). */
    List<PrereqItem> extractItems(String clause) {
        List<MatchResultSpan> matches = new ArrayList<>();
        Matcher m = CodeLexicon.CODE_PATTERN.matcher(clause);
        while (m.find()) {
            matches.add(new MatchResultSpan(CodeLexicon.join(m), m.start(), m.end()));
        }

        List<PrereqItem> items = new ArrayList<>();
        for (int i = 0; i < matches.size(); i++) {
            MatchResultSpan match = matches.get(i);
            int limit = Math.min(clause.length(), match.end() + GRADE_LOOKAHEAD);
            if (i + 1 < matches.size()) limit = Math.min(limit, matches.get(i + 1).start());
            items.add(PrereqItem.of(match.code(), gradeIn(clause.substring(match.end(), limit))));
        }
        return items;
    }

    private Integer gradeIn(String window) {
        Matcher g = GRADE_PATTERN.matcher(window);
        if (!g.find()) return null;
        String value = g.group(1) != null ? g.group(1) : g.group(2);
        return Integer.parseInt(value);
    }

    private static String normalize(String text) {
        if (text == null) return "";
        String t = WHITESPACE.matcher(text).replaceAll(" ").trim();
        while (t.endsWith(".")) t = t.substring(0, t.length() - 1).trim();
        return t;
    }

    private static String inner(String text, int[] segment) {
        return text.substring(segment[0] + 1, segment[1] - 1);
    }

    private record MatchResultSpan(String code, int start, int end) {}
}
