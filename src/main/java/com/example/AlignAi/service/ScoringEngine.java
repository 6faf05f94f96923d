package com.example.AlignAi.service;

import com.example.AlignAi.model.AnalysisComponents;
import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.Outcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fuses semantic similarity, importance-weighted skill coverage and experience alignment into a 0-100
 * score.
 */
@Service
@RequiredArgsConstructor
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final int FALLBACK_SCORE = 50;
    public static final double FALLBACK_COMPONENT = 0.5;

    private final SkillExtractor skillExtractor;
    private final ExperienceAnalyzer experienceAnalyzer;
    private final RoleWeightResolver roleWeightResolver;

    public record ScoreCard(int score, AnalysisComponents components, WeightProfile weights,
                            Map<String, Object> metadata) {}

    public Outcome<ScoreCard> score(List<ExtractedSkill> resumeSkills,
                                    List<ExtractedSkill> jdSkills,
                                    double semanticSimilarity,
                                    String resumeText,
                                    String jdText,
                                    String targetRole) {
        WeightProfile weights = roleWeightResolver.resolve(targetRole);
        try {
            double coverage = skillCoverage(resumeSkills, jdSkills, jdText);
            ExperienceAnalyzer.Alignment alignment = experienceAnalyzer.align(resumeText, jdText);

            double raw = weights.combine(semanticSimilarity, coverage, alignment.value());
            int score = clampScore(Math.round(100 * raw));
            AnalysisComponents components = new AnalysisComponents(semanticSimilarity, coverage, alignment.value());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("weights_used", weights.asMap());
            metadata.put("skill_coverage_details", coverageDetails(resumeSkills, jdSkills));
            metadata.put("experience_details", Map.of(
                    "years_overlap", alignment.yearsOverlap(),
                    "seniority_match", alignment.seniorityMatch(),
                    "domain_match", alignment.domainMatch()
            ));

            log.info("Score calculated: {}/100 profile={} coverage={} alignment={}",
                    score, weights.name(), String.format(Locale.ROOT, "%.3f", coverage),
                    String.format(Locale.ROOT, "%.3f", alignment.value()));
            return Outcome.ok(new ScoreCard(score, components, weights, metadata));
        } catch (RuntimeException ex) {
            log.warn("Score calculation failed, falling back to {}: {}", FALLBACK_SCORE, ex.toString());
            AnalysisComponents components =
                    new AnalysisComponents(semanticSimilarity, FALLBACK_COMPONENT, FALLBACK_COMPONENT);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("weights_used", weights.asMap());
            metadata.put("error", Outcome.describe(ex));
            return Outcome.degraded(new ScoreCard(FALLBACK_SCORE, components, weights, metadata), ex);
        }
    }

    /**
     * Share of the job's skill importance that the resume covers. 0 when the job lists no skills.
     */
    public double skillCoverage(List<ExtractedSkill> resumeSkills, List<ExtractedSkill> jdSkills, String jdText) {
        if (jdSkills == null || jdSkills.isEmpty()) return 0.0;
        Set<String> resumeNames = names(resumeSkills);

        double total = 0.0;
        double covered = 0.0;
        for (ExtractedSkill jdSkill : jdSkills) {
            double importance = skillExtractor.importance(jdSkill.name(), jdText);
            total += importance;
            if (resumeNames.contains(jdSkill.name().toLowerCase(Locale.ROOT))) covered += importance;
        }
        if (total == 0.0) return 0.0;

        double coverage = covered / total;
        log.debug("Skill coverage {} ({}/{})", coverage, covered, total);
        return coverage;
    }

    static Set<String> names(List<ExtractedSkill> skills) {
        if (skills == null) return Set.of();
        return skills.stream()
                .map(s -> s.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static Map<String, Object> coverageDetails(List<ExtractedSkill> resumeSkills, List<ExtractedSkill> jdSkills) {
        Set<String> jdNames = names(jdSkills);
        long matched = resumeSkills == null ? 0 : resumeSkills.stream()
                .filter(s -> jdNames.contains(s.name().toLowerCase(Locale.ROOT)))
                .count();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resume_skills_count", resumeSkills == null ? 0 : resumeSkills.size());
        details.put("jd_skills_count", jdSkills == null ? 0 : jdSkills.size());
        details.put("matched_skills_count", matched);
        return details;
    }

    private static int clampScore(long score) {
        return (int) Math.max(0, Math.min(100, score));
    }
}
