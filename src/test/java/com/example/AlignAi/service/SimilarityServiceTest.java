package com.example.AlignAi.service;

import com.example.AlignAi.model.DocumentSection;
import com.example.AlignAi.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityServiceTest {

    private final SimilarityService service = new SimilarityService();

    @Test
    void cosineOfParallelVectorsIsOne() {
        assertThat(SimilarityService.cosineSimilarity(new double[]{1, 2, 3}, new double[]{2, 4, 6}))
                .isCloseTo(1.0, within(1e-12));
    }

    @Test
    void negativeCosineIsClampedToZero() {
        assertThat(SimilarityService.cosineSimilarity(new double[]{1, 0}, new double[]{-1, 0})).isZero();
        assertThat(SimilarityService.cosineSimilarity(new double[]{1, 0}, new double[]{0, 1})).isZero();
    }

    @Test
    void differentDimensionsCompareLeadingOverlap() {
        assertThat(SimilarityService.cosineSimilarity(new double[]{1, 0, 5}, new double[]{1, 0}))
                .isCloseTo(1.0, within(1e-12));
    }

    @Test
    void missingOrZeroVectorsGiveZero() {
        assertThat(SimilarityService.cosineSimilarity(null, new double[]{1})).isZero();
        assertThat(SimilarityService.cosineSimilarity(new double[0], new double[0])).isZero();
        assertThat(SimilarityService.cosineSimilarity(new double[]{0, 0}, new double[]{1, 1})).isZero();
    }

    @Test
    void comparingTextWithItselfIsOne() {
        String text = "Senior Java engineer building Spring services on AWS";
        Outcome<SimilarityService.PairSimilarity> outcome = service.compare(text, text);

        assertThat(outcome.isDegraded()).isFalse();
        assertThat(outcome.value().similarity()).isCloseTo(1.0, within(1e-9));
        assertThat(outcome.value().vocabularySize()).isPositive();
    }

    @Test
    void comparisonDependsOnlyOnThePair() {
        String resume = "Python developer with Django and PostgreSQL";
        String jd = "Looking for a Python developer who knows Django";

        double first = service.compare(resume, jd).value().similarity();
        service.compare("Rust embedded firmware", "Kotlin Android apps");
        double second = service.compare(resume, jd).value().similarity();

        assertThat(first).isEqualTo(second).isBetween(0.0, 1.0).isPositive();
    }

    @Test
    void disjointOrEmptyTextsScoreZero() {
        assertThat(service.compare("python django", "react frontend").value().similarity()).isZero();
        Outcome<SimilarityService.PairSimilarity> empty = service.compare("", null);
        assertThat(empty.isDegraded()).isFalse();
        assertThat(empty.value().similarity()).isZero();
    }

    @Test
    void embedDocumentHasWholeAndPerSectionVectors() {
        List<DocumentSection> sections = List.of(
                new DocumentSection("summary", "Backend engineer", 0, 0),
                new DocumentSection("skills", "Java Spring", 1, 1),
                new DocumentSection("skills", "Kafka", 2, 2));

        Map<String, double[]> vectors = service.embedDocument("Backend engineer\nJava Spring\nKafka", sections).value();

        assertThat(vectors).containsOnlyKeys(SimilarityService.DOCUMENT_VECTOR, "summary", "skills");
        assertThat(vectors.get(SimilarityService.DOCUMENT_VECTOR)).hasSize(LexicalVectorizer.DIMENSION);
        assertThat(SimilarityService.cosineSimilarity(
                vectors.get("skills"), vectors.get(SimilarityService.DOCUMENT_VECTOR))).isPositive();
    }
}
