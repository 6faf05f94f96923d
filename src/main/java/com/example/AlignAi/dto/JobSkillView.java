package com.example.AlignAi.dto;

import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.SkillCategory;

public record JobSkillView(String name, SkillCategory category, double confidence, double importance) {

    public static JobSkillView of(ExtractedSkill s, double importance) {
        return new JobSkillView(s.name(), s.category(), s.confidence(), importance);
    }
}
