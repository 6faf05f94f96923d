package com.example.AlignAi.dto;

import com.example.AlignAi.model.Analysis;

import java.util.Map;

/**
 * @param processingTime seconds spent in the analyze call
 */
public record AnalyzeResponse(Analysis analysis, double processingTime, Map<String, Object> metadata) {
}
