package com.example.AlignAi.service;

import com.example.AlignAi.model.DocumentMetadata;
import com.example.AlignAi.model.DocumentSection;
import com.example.AlignAi.util.Sha256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans raw document text and splits resumes into named sections.
 */
@Component
public class TextProcessor {

    private static final Logger log = LoggerFactory.getLogger(TextProcessor.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");
    private static final Pattern BULLET_LINE = Pattern.compile("(?m)^\\h*[\\-*+]\\h+");
    private static final Pattern INLINE_BULLET = Pattern.compile("\\h*•\\h*");
    private static final Pattern HORIZONTAL_WS = Pattern.compile("\\h+");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");
    // lookarounds keep chains like "a - b - c" stable in a single pass
    private static final Pattern SPACED_HYPHEN = Pattern.compile("(?<=[a-z])\\h*-\\h*(?=[a-z])");
    private static final Pattern SENTENCE_GAP = Pattern.compile("([.!?])\\h*(?=[A-Z])");

    private static final Pattern LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern ALNUM = Pattern.compile("[a-zA-Z0-9]");

    private static final String HEADER_PREFIX = "^(?:[•\\-*+]\\h*|\\d+[.)]\\h*)?(?:";
    private static final String HEADER_SUFFIX = ")\\b(.*)$";
    private static final Pattern INLINE_CONTENT = Pattern.compile("^\\h*[:|\\-]\\h*(.+)$");

    private record HeaderRule(Pattern pattern, String section) {
        static HeaderRule of(String keywords, String section) {
            return new HeaderRule(Pattern.compile(HEADER_PREFIX + keywords + HEADER_SUFFIX, Pattern.CASE_INSENSITIVE), section);
        }
    }

    private static final List<HeaderRule> HEADER_RULES = List.of(
            HeaderRule.of("SUMMARY|PROFILE|OBJECTIVE|ABOUT|INTRODUCTION", "summary"),
            HeaderRule.of("EXPERIENCE|WORK HISTORY|EMPLOYMENT|CAREER|PROFESSIONAL", "experience"),
            HeaderRule.of("EDUCATION|ACADEMIC|QUALIFICATIONS|DEGREES", "education"),
            HeaderRule.of("SKILLS|TECHNOLOGIES|TOOLS|COMPETENCIES|EXPERTISE", "skills"),
            HeaderRule.of("PROJECTS|PORTFOLIO|ACHIEVEMENTS|ACCOMPLISHMENTS", "projects"),
            HeaderRule.of("CERTIFICATIONS|CERTIFICATES|TRAINING", "certifications"),
            HeaderRule.of("LANGUAGES|LANGUAGE SKILLS", "languages"),
            HeaderRule.of("INTERESTS|HOBBIES|ACTIVITIES", "interests"),
            HeaderRule.of("REFERENCES|REFEREES", "references"),
            HeaderRule.of("AWARDS|HONORS|RECOGNITIONS", "awards")
    );

    private static final int MAX_HEADER_TAIL_WORDS = 3;

    private static final List<String> FALLBACK_SECTIONS = List.of("summary", "experience", "skills", "education");

    /**
     * Canonicalizes unicode, punctuation, bullets and whitespace. Idempotent; on an internal failure the
     * text processed so far is returned.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String current = text;
        for (UnaryOperator<String> stage : List.<UnaryOperator<String>>of(
                TextProcessor::canonicalUnicode,
                TextProcessor::asciiPunctuation,
                TextProcessor::canonicalBullets,
                TextProcessor::collapseWhitespace,
                TextProcessor::repairPunctuation)) {
            try {
                current = stage.apply(current);
            } catch (RuntimeException ex) {
                log.warn("Text normalization stopped early: {}", ex.toString());
                return current;
            }
        }
        return current;
    }

    private static String canonicalUnicode(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFKC);
    }

    private static String asciiPunctuation(String s) {
        return s.replace('“', '"').replace('”', '"')
                .replace('‘', '\'').replace('’', '\'')
                .replace("–", "-").replace("—", "--")
                .replace('‣', '•').replace('◦', '•')
                .replace('▪', '•').replace('●', '•');
    }

    private static String canonicalBullets(String s) {
        String unified = LINE_BREAK.matcher(s).replaceAll("\n");
        // inline bullets go first so that "*•" settles in a single pass
        String inline = INLINE_BULLET.matcher(unified).replaceAll(" - ");
        return BULLET_LINE.matcher(inline).replaceAll("- ");
    }

    private static String collapseWhitespace(String s) {
        String[] lines = s.split("\n", -1);
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            sb.append(HORIZONTAL_WS.matcher(lines[i]).replaceAll(" ").strip());
        }
        return BLANK_LINE_RUN.matcher(sb).replaceAll("\n\n").strip();
    }

    private static String repairPunctuation(String s) {
        String joined = SPACED_HYPHEN.matcher(s).replaceAll("-");
        return SENTENCE_GAP.matcher(joined).replaceAll("$1 ");
    }

    /**
     * Splits normalized text into sections by header keywords. Falls back to a fixed four-way chunk split
     * when no header is found. Non-empty input always yields at least one section.
     */
    public List<DocumentSection> detectSections(String text) {
        if (text == null || text.isBlank()) return List.of();

        try {
            List<DocumentSection> sections = new ArrayList<>();
            String[] lines = text.split("\n", -1);

            String currentName = DocumentSection.CONTENT;
            int currentStart = 0;
            int lastContentLine = -1;
            List<String> content = new ArrayList<>();
            boolean sawHeader = false;

            for (int i = 0; i < lines.length; i++) {
                String line = lines[i].strip();
                if (line.isEmpty()) continue;

                Matcher header = null;
                String headerName = null;
                for (HeaderRule rule : HEADER_RULES) {
                    Matcher m = rule.pattern().matcher(line);
                    if (m.matches() && looksLikeHeader(m.group(1))) {
                        header = m;
                        headerName = rule.section();
                        break;
                    }
                }

                if (headerName == null) {
                    if (content.isEmpty() && !sawHeader) currentStart = i;
                    content.add(line);
                    lastContentLine = i;
                    continue;
                }

                flush(sections, currentName, content, currentStart, lastContentLine);
                sawHeader = true;
                currentName = headerName;
                currentStart = i;
                content = new ArrayList<>();

                Matcher inline = INLINE_CONTENT.matcher(header.group(1));
                if (inline.matches()) {
                    content.add(inline.group(1).strip());
                    lastContentLine = i;
                }
            }
            flush(sections, currentName, content, currentStart, lastContentLine);

            if (!sawHeader || sections.isEmpty()) {
                return defaultSections(text);
            }
            return List.copyOf(sections);
        } catch (RuntimeException ex) {
            log.warn("Section detection failed, using chunk split: {}", ex.toString());
            return defaultSections(text);
        }
    }

    // "Experience with Python and React" is prose, "Professional Summary" is a header
    private static boolean looksLikeHeader(String remainder) {
        String rest = remainder.strip();
        if (rest.isEmpty() || INLINE_CONTENT.matcher(remainder).matches()) return true;
        return rest.split("\\s+").length <= MAX_HEADER_TAIL_WORDS;
    }

    private static void flush(List<DocumentSection> out, String name, List<String> content, int start, int end) {
        if (content.isEmpty()) return;
        out.add(new DocumentSection(name, String.join("\n", content).strip(), start, Math.max(start, end)));
    }

    private List<DocumentSection> defaultSections(String text) {
        try {
            String[] lines = text.split("\n");
            int total = lines.length;
            int chunk = Math.max(1, total / 4);

            List<DocumentSection> sections = new ArrayList<>();
            int start = 0;
            for (int k = 0; k < FALLBACK_SECTIONS.size() && start < total; k++) {
                boolean last = k == FALLBACK_SECTIONS.size() - 1;
                int end = last ? total : Math.min(start + chunk, total);
                String body = String.join("\n", Arrays.copyOfRange(lines, start, end));
                sections.add(new DocumentSection(FALLBACK_SECTIONS.get(k), body, start, end - 1));
                start = end;
            }
            return List.copyOf(sections);
        } catch (RuntimeException ex) {
            log.warn("Chunk split failed, using single section: {}", ex.toString());
            return List.of(new DocumentSection(DocumentSection.CONTENT, text, 0, text.split("\n").length - 1));
        }
    }

    /**
     * SHA-256 hex of the normalized text, used for content-addressed deduplication.
     */
    public String contentHash(String text) {
        return Sha256.hex(normalize(text));
    }

    public DocumentMetadata extractMetadata(String text, List<DocumentSection> sections) {
        if (text == null || text.isEmpty()) return DocumentMetadata.empty();
        try {
            String trimmed = text.strip();
            int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
            long letters = LETTER.matcher(text).results().count();
            long alnum = ALNUM.matcher(text).results().count();
            return new DocumentMetadata(
                    words,
                    text.split("\n", -1).length,
                    text.length(),
                    sections != null && sections.size() > 1,
                    alnum == 0 ? 0.0 : (double) letters / alnum
            );
        } catch (RuntimeException ex) {
            log.warn("Metadata extraction failed: {}", ex.toString());
            return DocumentMetadata.empty();
        }
    }
}
