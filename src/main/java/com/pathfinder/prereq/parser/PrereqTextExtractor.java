package com.pathfinder.prereq.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pulls the prerequisite sentence out of calendar or course-page text. */
@Component
public class PrereqTextExtractor {
    private static final Pattern PREREQ_MENTION = Pattern.compile("\\bprereq", Pattern.CASE_INSENSITIVE);
    private static final Pattern LABEL = Pattern.compile("^(Prereq(?:uisite(?:\\(s\\))?s?)?)\\s*:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern STOP_HEADING = Pattern.compile(
            "\\b(coreq|co-?requisites?|antireq|anti-?requisites?|notes?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION_HEADING = Pattern.compile(
            "\\b(coreq|corequisites?|antireq|antirequisites?|notes?|restrictions?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COURSE_HEADER = Pattern.compile(
            "^[A-Z]{2,5}\\s*\\d{2,3}[A-Z]?\\s+prerequisites\\s*\\n?", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    /**
     * Text after the label of the first paragraph mentioning prerequisites, cut before any
     * corequisite, antirequisite or notes heading. Empty when no paragraph qualifies.
     */
    public String extract(List<String> paragraphs) {
        for (String paragraph : paragraphs) {
            if (paragraph == null || !PREREQ_MENTION.matcher(paragraph).find()) continue;
            String text = LABEL.matcher(paragraph.strip()).replaceFirst("");
            Matcher stop = STOP_HEADING.matcher(text);
            if (stop.find()) text = text.substring(0, stop.start());
            return text.strip();
        }
        return "";
    }

    /** Keeps the first paragraph of a prerequisites block, without its "CS 335 prerequisites" header. */
    public String trimToPrerequisites(String text) {
        if (text == null) return "";
        String t = text.replace("\r", "");
        Matcher section = SECTION_HEADING.matcher(t);
        if (section.find()) t = t.substring(0, section.start());
        t = COURSE_HEADER.matcher(t).replaceAll("");
        for (String paragraph : t.split("\\n\\s*\\n")) {
            if (!paragraph.isBlank()) return paragraph.strip();
        }
        return t.strip();
    }
}
