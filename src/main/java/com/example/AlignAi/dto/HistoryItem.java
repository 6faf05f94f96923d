package com.example.AlignAi.dto;

import java.time.Instant;

/**
 * One history row. A summary is null when its document is no longer stored.
 */
public record HistoryItem(
        String analysisId,
        int score,
        Instant createdAt,
        DocumentSummary resumeSummary,
        DocumentSummary jdSummary
) {
}
