package com.example.AlignAi.model;

public record AnalysisComponents(
        double semanticSimilarity,
        double skillCoverage,
        double experienceAlignment
) {
    public AnalysisComponents {
        semanticSimilarity = clamp(semanticSimilarity);
        skillCoverage = clamp(skillCoverage);
        experienceAlignment = clamp(experienceAlignment);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
