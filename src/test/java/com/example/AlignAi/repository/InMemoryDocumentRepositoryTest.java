package com.example.AlignAi.repository;

import com.example.AlignAi.model.Document;
import com.example.AlignAi.model.DocumentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDocumentRepositoryTest {

    private InMemoryDocumentRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryDocumentRepository();
    }

    private static Document doc(String id, DocumentType type, String hash) {
        return Document.builder()
                .documentId(id)
                .documentType(type)
                .source(Document.SOURCE_TEXT)
                .contentHash(hash)
                .cleanText("text of " + id)
                .build();
    }

    @Test
    void insertIgnoreConflictReturnsExistingDocumentForSameTypeAndHash() {
        Document first = repo.insertIgnoreConflict(doc("resume_1", DocumentType.RESUME, "abc"));
        Document second = repo.insertIgnoreConflict(doc("resume_2", DocumentType.RESUME, "abc"));

        assertThat(second.getDocumentId()).isEqualTo("resume_1");
        assertThat(second).isSameAs(first);
        assertThat(repo.get("resume_2")).isEmpty();
        assertThat(repo.countByType(DocumentType.RESUME)).isEqualTo(1);
    }

    @Test
    void sameHashUnderDifferentTypeIsStoredSeparately() {
        repo.insertIgnoreConflict(doc("resume_1", DocumentType.RESUME, "abc"));
        Document jd = repo.insertIgnoreConflict(doc("jd_1", DocumentType.JOB_DESCRIPTION, "abc"));

        assertThat(jd.getDocumentId()).isEqualTo("jd_1");
        assertThat(repo.findByContentHash(DocumentType.JOB_DESCRIPTION, "abc"))
                .map(Document::getDocumentId).contains("jd_1");
        assertThat(repo.countByType(DocumentType.RESUME)).isEqualTo(1);
        assertThat(repo.countByType(DocumentType.JOB_DESCRIPTION)).isEqualTo(1);
        assertThat(repo.list()).hasSize(2);
    }

    @Test
    void lookupsTolerateMissingKeys() {
        assertThat(repo.get(null)).isEmpty();
        assertThat(repo.get("nope")).isEmpty();
        assertThat(repo.findByContentHash(DocumentType.RESUME, "")).isEmpty();
        assertThat(repo.findByContentHash(null, "abc")).isEmpty();
    }

    @Test
    void clearDropsHashIndexToo() {
        repo.insertIgnoreConflict(doc("resume_1", DocumentType.RESUME, "abc"));

        repo.clear();

        assertThat(repo.findByContentHash(DocumentType.RESUME, "abc")).isEmpty();
        Document again = repo.insertIgnoreConflict(doc("resume_9", DocumentType.RESUME, "abc"));
        assertThat(again.getDocumentId()).isEqualTo("resume_9");
    }
}
