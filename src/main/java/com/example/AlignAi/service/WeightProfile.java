package com.example.AlignAi.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated set of signal weights, chosen once per analysis.
 */
public record WeightProfile(String name, double semantic, double skillCoverage, double experienceAlignment) {

    public static final String DEFAULT = "default";
    static final double SUM_TOLERANCE = 1e-6;

    public WeightProfile {
        if (semantic < 0 || skillCoverage < 0 || experienceAlignment < 0) {
            throw new IllegalArgumentException("Weights of profile '" + name + "' must be non-negative");
        }
        double sum = semantic + skillCoverage + experienceAlignment;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weights of profile '" + name + "' sum to " + sum + ", expected 1.0");
        }
    }

    public double combine(double semanticSimilarity, double coverage, double alignment) {
        return semantic * semanticSimilarity + skillCoverage * coverage + experienceAlignment * alignment;
    }

    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("semantic", semantic);
        m.put("skill_coverage", skillCoverage);
        m.put("experience_alignment", experienceAlignment);
        return m;
    }
}
