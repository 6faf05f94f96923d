package com.example.AlignAi.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class Analysis {

    private final String analysisId;
    private final String resumeId;
    private final String jdId;
    private final int score;
    private final AnalysisComponents components;

    @Singular
    private final List<MatchedSkill> matchedSkills;
    @Singular
    private final List<MissingSkill> missingSkills;
    @Singular("niceToHaveSkill")
    private final List<NiceToHaveSkill> niceToHaveSkills;

    @Singular
    private final List<String> strengths;
    @Singular
    private final List<String> risks;
    @Singular
    private final List<String> recommendations;

    private final Snippets snippets;
    private final Instant createdAt;
}
