package com.example.AlignAi.dto;

public record ErrorResponse(String detail) {
}
