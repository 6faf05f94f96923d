package com.example.AlignAi.dto;

public record DocumentSummary(String documentId, int skillsCount) {
}
