package com.example.AlignAi.model;

import java.util.List;

public record MatchedSkill(String name, List<String> evidence, double confidence, double importance) {

    public MatchedSkill {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public double weight() {
        return importance * confidence;
    }
}
