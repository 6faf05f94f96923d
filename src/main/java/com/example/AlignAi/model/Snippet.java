package com.example.AlignAi.model;

/**
 * Evidence excerpt. {@code start}/{@code end} are character offsets into the normalized text.
 */
public record Snippet(String text, int start, int end) {
}
