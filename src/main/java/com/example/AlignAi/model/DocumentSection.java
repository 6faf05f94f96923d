package com.example.AlignAi.model;

/**
 * A named block of a document. Line indices are inclusive and refer to the normalized text.
 */
public record DocumentSection(
        String name,
        String text,
        int startLine,
        int endLine
) {
    public static final String CONTENT = "content";
}
