package com.example.AlignAi.dto;

import java.util.List;

public record UploadJobResponse(String documentId, List<JobSkillView> skills) {
}
