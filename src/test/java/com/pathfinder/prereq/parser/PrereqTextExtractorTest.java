package com.pathfinder.prereq.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrereqTextExtractorTest {
    private final PrereqTextExtractor extractor = new PrereqTextExtractor();

    @Test
    void picksPrerequisiteParagraphAndCutsAtCorequisites() {
        String text = extractor.extract(List.of(
                "Introduction to data structures.",
                "Prereq: CS 136 or CS 146. Coreq: MATH 136.",
                "Antireq: CS 138"));
        assertEquals("CS 136 or CS 146.", text);
    }

    @Test
    void emptyWhenNoParagraphMentionsPrerequisites() {
        assertEquals("", extractor.extract(List.of("Lecture, tutorial", "Offered in fall")));
    }

    @Test
    void trimsCourseHeaderAndLaterSections() {
        String text = extractor.trimToPrerequisites("CS 335 prerequisites\nCS 245 or CS 240\n\nAntirequisites: CS 330");
        assertEquals("CS 245 or CS 240", text);
        assertEquals("", extractor.trimToPrerequisites(null));
    }
}
