package com.example.AlignAi.model;

import java.util.List;

/**
 * A skill detected in a document, resolved to its canonical name.
 */
public record ExtractedSkill(
        String name,
        SkillCategory category,
        double confidence,
        List<String> evidence,
        Integer startOffset,
        Integer endOffset
) {
    public ExtractedSkill {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
