package com.example.AlignAi.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SkillCategory {
    PROGRAMMING_LANGUAGE,
    WEB_TECHNOLOGY,
    BACKEND_FRAMEWORK,
    DATABASE,
    CLOUD_PLATFORM,
    DEVOPS,
    ML_AI,
    DATA_ANALYTICS,
    SECURITY,
    MOBILE_DEVELOPMENT,
    OTHER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SkillCategory fromCode(String code) {
        if (code == null || code.isBlank()) return OTHER;
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return OTHER;
        }
    }
}
