package com.example.AlignAi.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnalyzeRequest(
        @JsonProperty("resume_id") String resumeId,
        @JsonProperty("jd_id") String jdId,
        @JsonProperty("target_role") String targetRole
) {
}
