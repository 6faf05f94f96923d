package com.example.AlignAi.dto;

import java.util.List;

public record UploadResumeResponse(String documentId, List<String> detectedSections, List<SkillView> skills) {
}
