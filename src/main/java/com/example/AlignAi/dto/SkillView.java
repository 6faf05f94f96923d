package com.example.AlignAi.dto;

import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.SkillCategory;

import java.util.List;

public record SkillView(String name, SkillCategory category, double confidence, List<String> evidence) {

    public static SkillView of(ExtractedSkill s) {
        return new SkillView(s.name(), s.category(), s.confidence(), s.evidence());
    }
}
