package com.example.AlignAi.dto;

public record MessageResponse(String message) {
}
