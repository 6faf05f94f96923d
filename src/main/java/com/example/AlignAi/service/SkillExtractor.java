package com.example.AlignAi.service;

import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.OntologyEntry;
import com.example.AlignAi.model.Outcome;
import com.example.AlignAi.util.EvidenceFinder;
import com.example.AlignAi.util.FuzzyRatio;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects canonical skills in normalized text with three independent passes (ontology scan, context
 * patterns, fuzzy tokens) that feed one map keyed by canonical name.
 */
@Component
@RequiredArgsConstructor
public class SkillExtractor {

    private static final Logger log = LoggerFactory.getLogger(SkillExtractor.class);

    public static final double FUZZY_ACCEPT = 80.0;
    public static final double FUZZY_RECORD = 85.0;
    private static final int MIN_FUZZY_TOKEN = 4;
    private static final int MIN_CAPTURED_TERM = 3;

    private static final double CONTEXT_BOOST = 0.05;
    private static final double SKILLS_SECTION_BOOST = 0.05;
    private static final List<String> STRONG_PHRASES = List.of("experience with", "proficient in", "expert in");

    static final List<String> REQUIREMENT_PHRASES = List.of("requirements", "must have", "required", "essential");

    private static final Pattern TOKEN = Pattern.compile("\\b[a-z0-9+#]+\\b");
    private static final Pattern TERM_SPLIT = Pattern.compile("\\s*(?:,|;|/|\\n|\\band\\b|\\bor\\b)\\s*");

    enum Detection {
        EXACT(0.95),
        SYNONYM(0.90),
        EXPERIENCE(0.85),
        STACK(0.80),
        PROJECT(0.75),
        CERTIFICATION(0.90),
        FUZZY(0.70);

        final double base;

        Detection(double base) {
            this.base = base;
        }
    }

    private record ContextPattern(Pattern pattern, Detection detection) {
        static ContextPattern of(String regex, Detection detection) {
            return new ContextPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), detection);
        }
    }

    private static final List<ContextPattern> CONTEXT_PATTERNS = List.of(
            ContextPattern.of("\\b(?:experience|experienced|proficient|skilled|expert|knowledge|familiar|worked with|used|built|developed|implemented|created|designed|architected)\\s+(?:in|with|on|using)\\s+([a-zA-Z0-9+#\\s]+)",
                    Detection.EXPERIENCE),
            ContextPattern.of("\\b(?:tech stack|technology stack|stack|technologies?|tools?|frameworks?|libraries?|platforms?)\\s*[:=]\\s*([a-zA-Z0-9+#,\\s]+)",
                    Detection.STACK),
            ContextPattern.of("\\b(?:built|developed|created|implemented|designed|architected)\\s+(?:using|with|in)\\s+([a-zA-Z0-9+#\\s]+)",
                    Detection.PROJECT),
            ContextPattern.of("\\b(?:certified|certification)\\s+(?:in|for)\\s+([a-zA-Z0-9+#\\s]+)",
                    Detection.CERTIFICATION)
    );

    private final SkillOntology ontology;

    /**
     * Text-wide signals computed once per call.
     */
    private record Context(String text, String lower, boolean strongPhrase, boolean mentionsSkills) {
        static Context of(String text) {
            String lower = text.toLowerCase(Locale.ROOT);
            boolean strong = STRONG_PHRASES.stream().anyMatch(lower::contains);
            return new Context(text, lower, strong, lower.contains("skills"));
        }
    }

    public Outcome<List<ExtractedSkill>> extract(String text) {
        if (text == null || text.isBlank()) return Outcome.ok(List.of());

        Context ctx;
        try {
            ctx = Context.of(text);
        } catch (RuntimeException ex) {
            log.warn("Skill extraction skipped: {}", ex.toString());
            return Outcome.degraded(List.of(), ex);
        }

        Map<String, ExtractedSkill> detected = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        runPass("ontology", failures, () -> scanOntology(ctx, detected));
        runPass("patterns", failures, () -> scanPatterns(ctx, detected));
        runPass("fuzzy", failures, () -> scanFuzzy(ctx, detected));

        List<ExtractedSkill> skills = new ArrayList<>(detected.values());
        skills.sort(Comparator.comparingDouble(ExtractedSkill::confidence).reversed());

        log.debug("Extracted {} skills from {} chars", skills.size(), text.length());
        if (!failures.isEmpty()) {
            return Outcome.degraded(List.copyOf(skills), String.join("; ", failures));
        }
        return Outcome.ok(List.copyOf(skills));
    }

    private static void runPass(String name, List<String> failures, Runnable pass) {
        try {
            pass.run();
        } catch (RuntimeException ex) {
            log.warn("Skill extraction pass '{}' failed: {}", name, ex.toString());
            failures.add(name + ": " + Outcome.describe(ex));
        }
    }

    private void scanOntology(Context ctx, Map<String, ExtractedSkill> detected) {
        for (OntologyEntry entry : ontology.entries()) {
            if (ctx.lower().contains(entry.name())) {
                record(detected, entry, Detection.EXACT, entry.name(), ctx);
            }
            for (String synonym : entry.synonyms()) {
                if (ctx.lower().contains(synonym)) {
                    record(detected, entry, Detection.SYNONYM, synonym, ctx);
                }
            }
        }
    }

    private void scanPatterns(Context ctx, Map<String, ExtractedSkill> detected) {
        for (ContextPattern cp : CONTEXT_PATTERNS) {
            Matcher m = cp.pattern().matcher(ctx.text());
            while (m.find()) {
                for (String term : TERM_SPLIT.split(m.group(1).strip())) {
                    String candidate = term.strip().toLowerCase(Locale.ROOT);
                    if (candidate.length() < MIN_CAPTURED_TERM) continue;
                    bestContainmentMatch(candidate)
                            .ifPresent(entry -> record(detected, entry, cp.detection(), entry.name(), ctx));
                }
            }
        }
    }

    private void scanFuzzy(Context ctx, Map<String, ExtractedSkill> detected) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher m = TOKEN.matcher(ctx.lower());
        while (m.find()) {
            if (m.group().length() >= MIN_FUZZY_TOKEN) tokens.add(m.group());
        }

        for (String token : tokens) {
            OntologyEntry best = null;
            double bestScore = 0.0;
            for (OntologyEntry entry : ontology.entries()) {
                double score = FuzzyRatio.ratio(token, entry.name());
                if (score > bestScore) {
                    bestScore = score;
                    best = entry;
                }
            }
            if (best == null || bestScore < FUZZY_ACCEPT) continue;
            // accepted candidates below the record threshold stay undetected
            if (bestScore >= FUZZY_RECORD) record(detected, best, Detection.FUZZY, token, ctx);
        }
    }

    /**
     * Exact canonical name first, then the longest canonical name contained in the term, then the first
     * canonical name that contains the term.
     */
    private Optional<OntologyEntry> bestContainmentMatch(String term) {
        Optional<OntologyEntry> exact = ontology.find(term);
        if (exact.isPresent()) return exact;

        OntologyEntry contained = null;
        for (OntologyEntry entry : ontology.entries()) {
            if (term.contains(entry.name())
                    && (contained == null || entry.name().length() > contained.name().length())) {
                contained = entry;
            }
        }
        if (contained != null) return Optional.of(contained);

        return ontology.entries().stream()
                .filter(entry -> entry.name().contains(term))
                .findFirst();
    }

    private double confidence(OntologyEntry entry, Detection detection, Context ctx) {
        double confidence = detection.base;
        if (ctx.strongPhrase()) confidence += CONTEXT_BOOST;
        if (ctx.mentionsSkills() && ctx.lower().contains(entry.name())) confidence += SKILLS_SECTION_BOOST;
        return Math.min(confidence, 1.0);
    }

    // keeps the earlier detection unless the new one is strictly more confident
    private void record(Map<String, ExtractedSkill> detected, OntologyEntry entry, Detection detection,
                        String surface, Context ctx) {
        double confidence = confidence(entry, detection, ctx);
        ExtractedSkill existing = detected.get(entry.name());
        if (existing != null && confidence <= existing.confidence()) return;

        String evidence = EvidenceFinder.evidence(ctx.text(), entry.name());
        String anchor = entry.name();
        if (evidence.isEmpty() && !surface.equals(entry.name())) {
            evidence = EvidenceFinder.evidence(ctx.text(), surface);
            anchor = surface;
        }
        int start = EvidenceFinder.indexOfIgnoreCase(ctx.text(), anchor);

        detected.put(entry.name(), new ExtractedSkill(
                entry.name(),
                entry.category(),
                confidence,
                evidence.isEmpty() ? List.of() : List.of(evidence),
                start < 0 ? null : start,
                start < 0 ? null : start + anchor.length()
        ));
    }

    /**
     * How much a job description cares about a skill, in [0, 1].
     */
    public double importance(String skillName, String jdText) {
        if (jdText == null || jdText.isBlank() || skillName == null || skillName.isBlank()) return 0.5;

        String jd = jdText.toLowerCase(Locale.ROOT);
        String skill = skillName.toLowerCase(Locale.ROOT);
        double importance = 0.5;

        if (REQUIREMENT_PHRASES.stream().anyMatch(jd::contains)) {
            importance += 0.3;
        }
        if (jd.contains(skill)) {
            importance += 0.2;
        }
        int mentions = StringUtils.countMatches(jd, skill);
        if (mentions > 1) {
            importance += Math.min(0.1 * mentions, 0.2);
        }
        return Math.min(importance, 1.0);
    }
}
