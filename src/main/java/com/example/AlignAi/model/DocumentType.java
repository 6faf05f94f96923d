package com.example.AlignAi.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    RESUME("resume", "resume"),
    JOB_DESCRIPTION("job_description", "jd");

    private final String code;
    private final String idPrefix;

    DocumentType(String code, String idPrefix) {
        this.code = code;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public String label() {
        return this == RESUME ? "resume" : "job description";
    }
}
