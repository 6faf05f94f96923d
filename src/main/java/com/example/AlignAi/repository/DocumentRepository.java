package com.example.AlignAi.repository;

import com.example.AlignAi.model.Document;
import com.example.AlignAi.model.DocumentType;

import java.util.List;
import java.util.Optional;

public interface DocumentRepository {

    void put(Document document);

    Optional<Document> get(String documentId);

    Optional<Document> findByContentHash(DocumentType type, String contentHash);

    /**
     * Stores the document unless one of the same type and content hash exists.
     *
     * @return the stored document, or the existing one on conflict
     */
    Document insertIgnoreConflict(Document document);

    List<Document> list();

    long countByType(DocumentType type);

    void clear();
}
