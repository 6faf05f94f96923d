package com.example.AlignAi.dto;

public record HealthResponse(String status, long uptimeSec) {
}
