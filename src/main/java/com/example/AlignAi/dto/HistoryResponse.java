package com.example.AlignAi.dto;

import java.util.List;

public record HistoryResponse(List<HistoryItem> items) {
}
