package com.example.AlignAi.dto;

import com.example.AlignAi.model.Analysis;

public record AnalysisEnvelope(Analysis analysis) {
}
