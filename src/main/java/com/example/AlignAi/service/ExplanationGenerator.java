package com.example.AlignAi.service;

import com.example.AlignAi.model.AnalysisComponents;
import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.MatchedSkill;
import com.example.AlignAi.model.MissingSkill;
import com.example.AlignAi.model.NiceToHaveSkill;
import com.example.AlignAi.model.Outcome;
import com.example.AlignAi.model.Snippet;
import com.example.AlignAi.model.Snippets;
import com.example.AlignAi.util.EvidenceFinder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns two skill sets and the score components into the human-readable part of an analysis.
 */
@Service
@RequiredArgsConstructor
public class ExplanationGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExplanationGenerator.class);

    public static final double MISSING_THRESHOLD = 0.6;

    private static final int TOP_MISSING_FOR_ADVICE = 3;
    private static final int MAX_RECOMMENDATIONS = 5;
    private static final int MAX_RESUME_SNIPPETS = 3;
    private static final int FALLBACK_SNIPPET_CHARS = 200;
    private static final String ELLIPSIS = "...";
    private static final List<String> JD_REQUIREMENT_MARKERS = List.of("required", "must have", "essential");

    private final SkillExtractor skillExtractor;

    public record Explanation(
            List<MatchedSkill> matchedSkills,
            List<MissingSkill> missingSkills,
            List<NiceToHaveSkill> niceToHaveSkills,
            List<String> strengths,
            List<String> risks,
            List<String> recommendations,
            Snippets snippets
    ) {
        public static Explanation fallback() {
            return new Explanation(List.of(), List.of(), List.of(),
                    List.of("Analysis generation encountered an error"),
                    List.of("Unable to complete full analysis"),
                    List.of("Please try again or contact support"),
                    Snippets.placeholder());
        }
    }

    public Outcome<Explanation> generate(List<ExtractedSkill> resumeSkills,
                                         List<ExtractedSkill> jdSkills,
                                         AnalysisComponents components,
                                         String resumeText,
                                         String jdText) {
        try {
            Map<String, ExtractedSkill> resumeByName = new LinkedHashMap<>();
            for (ExtractedSkill s : resumeSkills) resumeByName.putIfAbsent(key(s.name()), s);

            List<MatchedSkill> matched = new ArrayList<>();
            List<MissingSkill> missing = new ArrayList<>();
            List<NiceToHaveSkill> niceToHave = new ArrayList<>();
            Set<String> seen = new HashSet<>();

            for (ExtractedSkill jdSkill : jdSkills) {
                if (!seen.add(key(jdSkill.name()))) continue;
                double importance = skillExtractor.importance(jdSkill.name(), jdText);
                ExtractedSkill own = resumeByName.get(key(jdSkill.name()));

                if (own != null) {
                    matched.add(new MatchedSkill(jdSkill.name(), own.evidence(), own.confidence(), importance));
                } else if (importance >= MISSING_THRESHOLD) {
                    missing.add(new MissingSkill(jdSkill.name(), importance));
                } else {
                    niceToHave.add(new NiceToHaveSkill(jdSkill.name(), importance));
                }
            }

            matched.sort(Comparator.comparingDouble(MatchedSkill::weight).reversed());
            missing.sort(Comparator.comparingDouble(MissingSkill::importance).reversed());
            niceToHave.sort(Comparator.comparingDouble(NiceToHaveSkill::importance).reversed());

            List<String> strengths = strengths(resumeSkills.size(), components);
            List<String> risks = risks(resumeSkills.size(), components);
            List<String> recommendations = recommendations(missing, resumeText, jdText);

            return Outcome.ok(new Explanation(
                    List.copyOf(matched), List.copyOf(missing), List.copyOf(niceToHave),
                    strengths, risks, recommendations,
                    snippets(resumeText, jdText, matched)));
        } catch (RuntimeException ex) {
            log.warn("Explanation generation failed: {}", ex.toString());
            return Outcome.degraded(Explanation.fallback(), ex);
        }
    }

    List<String> strengths(int resumeSkillCount, AnalysisComponents c) {
        List<String> out = new ArrayList<>();
        if (c.skillCoverage() >= 0.8) out.add("Strong skill alignment with job requirements");
        else if (c.skillCoverage() >= 0.6) out.add("Good skill coverage for the role");
        if (c.semanticSimilarity() >= 0.8) out.add("High semantic similarity between resume and job description");
        if (resumeSkillCount >= 10) out.add("Comprehensive skill set demonstrated");
        if (out.isEmpty()) out.add("Resume shows relevant technical background");
        return List.copyOf(out);
    }

    List<String> risks(int resumeSkillCount, AnalysisComponents c) {
        List<String> out = new ArrayList<>();
        if (c.skillCoverage() < 0.5) out.add("Significant skill gaps identified");
        if (c.experienceAlignment() < 0.4) out.add("Experience level may not align with role requirements");
        if (resumeSkillCount < 5) out.add("Limited skill diversity shown");
        if (out.isEmpty()) out.add("Consider adding more specific project examples");
        return List.copyOf(out);
    }

    List<String> recommendations(List<MissingSkill> missing, String resumeText, String jdText) {
        List<String> out = new ArrayList<>();
        for (MissingSkill skill : missing.subList(0, Math.min(TOP_MISSING_FOR_ADVICE, missing.size()))) {
            if (skill.importance() >= 0.8) {
                out.add("Add specific examples demonstrating " + skill.name() + " experience");
            } else if (skill.importance() >= MISSING_THRESHOLD) {
                out.add("Consider highlighting " + skill.name() + " in your skills section");
            }
        }
        if (missing.size() > 5) {
            out.add("Focus on the most critical missing skills rather than trying to cover everything");
        }
        if (key(resumeText).contains("experience") && key(jdText).contains("experience")) {
            out.add("Quantify your experience with specific metrics and achievements");
        }
        if (out.size() < 3) {
            out.add("Ensure your resume clearly demonstrates the impact of your work");
        }
        return List.copyOf(out.subList(0, Math.min(MAX_RECOMMENDATIONS, out.size())));
    }

    Snippets snippets(String resumeText, String jdText, List<MatchedSkill> matched) {
        String resume = resumeText == null ? "" : resumeText;
        String jd = jdText == null ? "" : jdText;

        List<Snippet> resumeSnippets = new ArrayList<>();
        for (MatchedSkill skill : matched.subList(0, Math.min(MAX_RESUME_SNIPPETS, matched.size()))) {
            String text = EvidenceFinder.snippet(resume, skill.name());
            if (text.isEmpty()) continue;
            int start = resume.indexOf(text);
            if (start < 0) start = 0;
            Snippet snippet = new Snippet(text, start, start + text.length());
            if (!resumeSnippets.contains(snippet)) resumeSnippets.add(snippet);
        }

        List<Snippet> jdSnippets = new ArrayList<>();
        int offset = 0;
        for (String line : jd.split("\n", -1)) {
            String lower = key(line);
            if (line.length() > 20 && line.length() < 200
                    && JD_REQUIREMENT_MARKERS.stream().anyMatch(lower::contains)) {
                String text = line.strip();
                int start = offset + line.indexOf(text);
                jdSnippets.add(new Snippet(text, start, start + text.length()));
            }
            offset += line.length() + 1;
        }

        if (resumeSnippets.isEmpty()) resumeSnippets.add(leading(resume));
        if (jdSnippets.isEmpty()) jdSnippets.add(leading(jd));
        return new Snippets(resumeSnippets, jdSnippets);
    }

    private static Snippet leading(String text) {
        if (text.length() <= FALLBACK_SNIPPET_CHARS) return new Snippet(text, 0, text.length());
        // the ellipsis counts toward the cap; end covers only the quoted chars
        int kept = FALLBACK_SNIPPET_CHARS - ELLIPSIS.length();
        return new Snippet(text.substring(0, kept) + ELLIPSIS, 0, kept);
    }

    private static String key(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
