package com.example.AlignAi.model;

public record ExtractedFile(
        String filename,
        String mimeType,
        long sizeBytes,
        String extractedText,
        boolean truncated,
        String error
) {
    public boolean failed() {
        return error != null;
    }

    public boolean isEmpty() {
        return extractedText == null || extractedText.isBlank();
    }
}
