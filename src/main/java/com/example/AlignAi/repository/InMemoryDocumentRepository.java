package com.example.AlignAi.repository;

import com.example.AlignAi.model.Document;
import com.example.AlignAi.model.DocumentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDocumentRepository implements DocumentRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentRepository.class);

    private final Map<String, Document> byId = new ConcurrentHashMap<>();
    // "<type>:<hash>" -> document id
    private final Map<String, String> byHash = new ConcurrentHashMap<>();

    @Override
    public synchronized void put(Document document) {
        Objects.requireNonNull(document, "document");
        byId.put(document.getDocumentId(), document);
        if (hasHash(document)) {
            byHash.put(hashKey(document.getDocumentType(), document.getContentHash()), document.getDocumentId());
        }
    }

    @Override
    public Optional<Document> get(String documentId) {
        if (documentId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(documentId));
    }

    @Override
    public Optional<Document> findByContentHash(DocumentType type, String contentHash) {
        if (type == null || contentHash == null || contentHash.isEmpty()) return Optional.empty();
        String id = byHash.get(hashKey(type, contentHash));
        return id == null ? Optional.empty() : get(id);
    }

    @Override
    public synchronized Document insertIgnoreConflict(Document document) {
        Optional<Document> existing = findByContentHash(document.getDocumentType(), document.getContentHash());
        if (existing.isPresent()) {
            log.debug("insertIgnoreConflict hit duplicate, type={}, id={}",
                    document.getDocumentType().code(), existing.get().getDocumentId());
            return existing.get();
        }
        put(document);
        return document;
    }

    @Override
    public List<Document> list() {
        return List.copyOf(byId.values());
    }

    @Override
    public long countByType(DocumentType type) {
        return byId.values().stream().filter(d -> d.isOfType(type)).count();
    }

    @Override
    public synchronized void clear() {
        byId.clear();
        byHash.clear();
    }

    private static boolean hasHash(Document d) {
        return d.getContentHash() != null && !d.getContentHash().isEmpty();
    }

    private static String hashKey(DocumentType type, String hash) {
        return type.code() + ":" + hash;
    }
}
