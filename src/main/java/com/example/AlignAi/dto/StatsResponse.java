package com.example.AlignAi.dto;

public record StatsResponse(
        long totalAnalyses,
        long totalResumes,
        long totalJobDescriptions,
        double averageScore,
        String storageType
) {
}
