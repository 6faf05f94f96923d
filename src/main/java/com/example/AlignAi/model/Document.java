package com.example.AlignAi.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Getter
@Builder
public class Document {

    public static final String SOURCE_TEXT = "text";
    public static final String SOURCE_FILE = "file";

    private final String documentId;
    private final DocumentType documentType;
    private final String source;
    private final String contentHash;
    private final String cleanText;

    @Singular
    private final List<DocumentSection> sections;

    @Singular
    private final List<ExtractedSkill> extractedSkills;

    // "document" plus one entry per section name
    @JsonIgnore
    @Singular
    private final Map<String, double[]> vectors;

    private final DocumentMetadata metadata;
    private final Instant createdAt;

    public boolean isOfType(DocumentType type) {
        return documentType == type;
    }
}
