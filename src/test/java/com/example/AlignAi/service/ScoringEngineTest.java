package com.example.AlignAi.service;

import com.example.AlignAi.config.ScoringProperties;
import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.Outcome;
import com.example.AlignAi.model.SkillCategory;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private static final SkillOntology ONTOLOGY = SkillOntology.fromClasspath(SkillOntology.DEFAULT_LOCATION);

    private final SkillExtractor extractor = new SkillExtractor(ONTOLOGY);
    private final ScoringEngine engine = new ScoringEngine(
            extractor, new ExperienceAnalyzer(), new RoleWeightResolver(new ScoringProperties()));

    private static ExtractedSkill skill(String name) {
        return new ExtractedSkill(name, SkillCategory.OTHER, 0.9, List.of(), null, null);
    }

    @Test
    void coverageIsZeroWithoutJobSkills() {
        assertThat(engine.skillCoverage(List.of(skill("python")), List.of(), "anything")).isZero();
    }

    @Test
    void coverageIsImportanceWeighted() {
        String jd = "Python and Docker";
        assertThat(engine.skillCoverage(List.of(skill("python")), List.of(skill("python"), skill("docker")), jd))
                .isCloseTo(0.5, within(1e-12));
        assertThat(engine.skillCoverage(List.of(skill("PYTHON"), skill("docker")),
                List.of(skill("python"), skill("docker")), jd)).isEqualTo(1.0);
        assertThat(engine.skillCoverage(List.of(), List.of(skill("python")), jd)).isZero();
    }

    @Test
    void matchingResumeAndJobScoreFullCoverage() {
        String resume = "5 years experience with Python and React. Senior engineer.";
        String jd = "Senior Python developer required. Must have React.";
        List<ExtractedSkill> resumeSkills = extractor.extract(resume).value();
        List<ExtractedSkill> jdSkills = extractor.extract(jd).value();

        Outcome<ScoringEngine.ScoreCard> outcome = engine.score(resumeSkills, jdSkills, 0.3, resume, jd, null);

        assertThat(outcome.isDegraded()).isFalse();
        ScoringEngine.ScoreCard card = outcome.value();
        assertThat(card.components().skillCoverage()).isEqualTo(1.0);
        assertThat(card.components().semanticSimilarity()).isEqualTo(0.3);
        assertThat(card.score()).isBetween(0, 100);

        double expected = 0.45 * 0.3 + 0.45 * 1.0 + 0.10 * card.components().experienceAlignment();
        assertThat(card.score()).isEqualTo((int) Math.round(100 * expected));

        @SuppressWarnings("unchecked")
        Map<String, Object> details = (Map<String, Object>) card.metadata().get("skill_coverage_details");
        assertThat(details).containsEntry("resume_skills_count", 2)
                .containsEntry("jd_skills_count", 2)
                .containsEntry("matched_skills_count", 2L);
    }

    @Test
    void targetRoleSwitchesWeights() {
        ScoringEngine.ScoreCard card = engine.score(List.of(), List.of(), 1.0, "", "", "Machine Learning Engineer")
                .value();

        assertThat(card.weights().name()).isEqualTo("ml_ai");
        assertThat(card.metadata().get("weights_used")).isEqualTo(card.weights().asMap());
    }

    @Test
    void scoreStaysInRangeForExtremeSignals() {
        assertThat(engine.score(List.of(), List.of(), 1.5, "", "", null).value().score()).isBetween(0, 100);
        assertThat(engine.score(List.of(), List.of(), -3.0, "", "", null).value().score()).isBetween(0, 100);
    }

    @Test
    void internalFailureFallsBackToFifty() {
        List<ExtractedSkill> broken = Collections.singletonList(null);

        Outcome<ScoringEngine.ScoreCard> outcome = engine.score(List.of(), broken, 0.8, "a", "b", null);

        assertThat(outcome.isDegraded()).isTrue();
        ScoringEngine.ScoreCard card = outcome.value();
        assertThat(card.score()).isEqualTo(ScoringEngine.FALLBACK_SCORE);
        assertThat(card.components().semanticSimilarity()).isEqualTo(0.8);
        assertThat(card.components().skillCoverage()).isEqualTo(0.5);
        assertThat(card.components().experienceAlignment()).isEqualTo(0.5);
        assertThat(card.metadata()).containsKey("error");
    }
}
