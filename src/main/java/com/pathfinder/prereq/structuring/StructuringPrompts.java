package com.pathfinder.prereq.structuring;

import com.pathfinder.prereq.structuring.StructuringModels.ChatTurn;
import com.pathfinder.prereq.structuring.StructuringModels.WorkedExample;

import java.util.*;

final class StructuringPrompts {
    static final String SYSTEM_PROMPT = """
            You are a data normalizer for university course prerequisites.
            Convert prerequisite prose into CNF: an AND of OR-clauses.

            OUTPUT:
            Return JSON only, with this schema:
            { "groups": Clause[], "constraints": string[], "confidence": number }
            Clause := CourseAlt[]    CourseAlt := { "code": string, "min_grade"?: integer }

            RULES:
            1. Use only course codes from the provided whitelist, written without spaces (e.g. CS135).
            2. Parenthesized groups and "one of" lists are OR-clauses.
            3. Semicolons and the word "and" separate AND-clauses.
            4. A phrase like "with at least N%" or "with a grade of at least N%" applies to the nearest preceding course only.
            5. Non-course conditions (program restrictions, averages, levels) go into constraints.
            6. confidence is your certainty in [0, 1] that groups capture the prose exactly.
            """;

    static final String STRICT_SUFFIX = """

            Return VALID JSON only. If uncertain, return {"groups":[],"constraints":[],"confidence":0.3}.""";

    static final List<WorkedExample> EXAMPLES = List.of(
            new WorkedExample(
                    "(One of CS 116, CS 136, CS 146) or (CS 114 with at least 60%; CS 115 or CS 135); "
                            + "One of MATH 106 with at least 70%, MATH 136 or MATH 146; MATH 237 or MATH 247.",
                    List.of("CS116", "CS136", "CS146", "CS114", "CS115", "CS135",
                            "MATH106", "MATH136", "MATH146", "MATH237", "MATH247"),
                    """
                            {"groups":[\
                            [{"code":"CS116"},{"code":"CS136"},{"code":"CS146"},{"code":"CS114","min_grade":60}],\
                            [{"code":"CS116"},{"code":"CS136"},{"code":"CS146"},{"code":"CS115"},{"code":"CS135"}],\
                            [{"code":"MATH106","min_grade":70},{"code":"MATH136"},{"code":"MATH146"}],\
                            [{"code":"MATH237"},{"code":"MATH247"}]\
                            ],"constraints":[],"confidence":0.9}"""),
            new WorkedExample(
                    "One of PHYS 112, PHYS 122; One of STAT 202, STAT 206, STAT 231.",
                    List.of("PHYS112", "PHYS122", "STAT202", "STAT206", "STAT231"),
                    """
                            {"groups":[\
                            [{"code":"PHYS112"},{"code":"PHYS122"}],\
                            [{"code":"STAT202"},{"code":"STAT206"},{"code":"STAT231"}]\
                            ],"constraints":[],"confidence":0.9}"""),
            new WorkedExample(
                    "MATH 137 or MATH 147 and (STAT 220 with a grade of at least 70% or STAT 230). "
                            + "Honours Mathematics students only.",
                    List.of("MATH137", "MATH147", "STAT220", "STAT230"),
                    """
                            {"groups":[\
                            [{"code":"MATH137"},{"code":"MATH147"}],\
                            [{"code":"STAT220","min_grade":70},{"code":"STAT230"}]\
                            ],"constraints":["Honours Mathematics students only"],"confidence":0.85}"""),
            new WorkedExample(
                    "One of AFM 274/AFM 371, ACTSC 372 or ECON 372.",
                    List.of("AFM274", "AFM371", "ACTSC372", "ECON372"),
                    """
                            {"groups":[\
                            [{"code":"AFM274"},{"code":"AFM371"},{"code":"ACTSC372"},{"code":"ECON372"}]\
                            ],"constraints":[],"confidence":0.8}""")
    );

    private StructuringPrompts() {
    }

    static String userMessage(String rawText, String codesHint) {
        return "Text:\n" + (rawText == null ? "" : rawText.strip()) + "\n\nCodes:\n" + codesHint + "\n\nReturn JSON only.";
    }

    /** System instruction, every worked example as a user/assistant exchange, then the request. */
    static List<ChatTurn> conversation(String userMessage) {
        List<ChatTurn> turns = new ArrayList<>();
        turns.add(ChatTurn.system(SYSTEM_PROMPT));
        EXAMPLES.forEach(e -> addExample(turns, e));
        turns.add(ChatTurn.user(userMessage));
        return turns;
    }

    /** Shorter retry conversation demanding valid JSON or the explicit empty result. */
    static List<ChatTurn> strictConversation(String userMessage) {
        List<ChatTurn> turns = new ArrayList<>();
        turns.add(ChatTurn.system(SYSTEM_PROMPT));
        addExample(turns, EXAMPLES.get(0));
        turns.add(ChatTurn.user(userMessage + STRICT_SUFFIX));
        return turns;
    }

    static String codesHint(Collection<String> whitelist, int limit) {
        String joined = String.join(", ", new TreeSet<>(whitelist));
        return joined.length() > limit ? joined.substring(0, limit) : joined;
    }

    private static void addExample(List<ChatTurn> turns, WorkedExample example) {
        turns.add(ChatTurn.user(userMessage(example.text(), String.join(", ", example.codes()))));
        turns.add(ChatTurn.assistant(example.expectedJson()));
    }
}
