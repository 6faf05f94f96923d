package com.example.AlignAi.model;

public record DocumentMetadata(
        int wordCount,
        int lineCount,
        int characterCount,
        boolean hasSections,
        double englishRatio
) {
    public static DocumentMetadata empty() {
        return new DocumentMetadata(0, 0, 0, false, 0.0);
    }
}
