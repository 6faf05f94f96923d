package com.example.AlignAi.service;

import com.example.AlignAi.model.DocumentSection;
import com.example.AlignAi.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical semantic similarity. Each comparison fits its own vocabulary on the two texts being compared,
 * so the result does not depend on which documents were ingested before.
 */
@Service
public class SimilarityService {

    private static final Logger log = LoggerFactory.getLogger(SimilarityService.class);

    public static final String DOCUMENT_VECTOR = "document";

    public record PairSimilarity(double similarity, int vocabularySize) {
        public static PairSimilarity none() {
            return new PairSimilarity(0.0, 0);
        }
    }

    public Outcome<PairSimilarity> compare(String resumeText, String jdText) {
        try {
            LexicalVectorizer vectorizer = LexicalVectorizer.fit(List.of(nz(resumeText), nz(jdText)));
            double similarity = cosineSimilarity(vectorizer.transform(resumeText), vectorizer.transform(jdText));
            log.debug("Pair similarity={} vocabulary={}", similarity, vectorizer.vocabularySize());
            return Outcome.ok(new PairSimilarity(similarity, vectorizer.vocabularySize()));
        } catch (RuntimeException ex) {
            log.warn("Similarity failed, using 0: {}", ex.toString());
            return Outcome.degraded(PairSimilarity.none(), ex);
        }
    }

    /**
     * Whole-document vector plus one vector per section name, fitted on the document's own text and
     * sections. Sections sharing a name are embedded as one joined text.
     */
    public Outcome<Map<String, double[]>> embedDocument(String text, List<DocumentSection> sections) {
        Map<String, String> sectionTexts = new LinkedHashMap<>();
        if (sections != null) {
            for (DocumentSection s : sections) {
                sectionTexts.merge(s.name(), s.text(), (a, b) -> a + "\n" + b);
            }
        }

        try {
            List<String> corpus = new ArrayList<>();
            corpus.add(nz(text));
            corpus.addAll(sectionTexts.values());
            LexicalVectorizer vectorizer = LexicalVectorizer.fit(corpus);

            Map<String, double[]> vectors = new LinkedHashMap<>();
            vectors.put(DOCUMENT_VECTOR, vectorizer.transform(text));
            sectionTexts.forEach((name, body) -> vectors.put(name, vectorizer.transform(body)));
            return Outcome.ok(vectors);
        } catch (RuntimeException ex) {
            log.warn("Document embedding failed, using zero vectors: {}", ex.toString());
            Map<String, double[]> zeros = new LinkedHashMap<>();
            zeros.put(DOCUMENT_VECTOR, new double[LexicalVectorizer.DIMENSION]);
            sectionTexts.keySet().forEach(name -> zeros.put(name, new double[LexicalVectorizer.DIMENSION]));
            return Outcome.degraded(zeros, ex);
        }
    }

    /**
     * Cosine similarity clamped to [0, 1]. Vectors of different length are compared on their overlapping
     * leading dimensions; missing, empty or zero vectors give 0.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a == null || b == null) return 0.0;
        int n = Math.min(a.length, b.length);
        if (n == 0) return 0.0;

        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < n; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0.0 || nb == 0.0) return 0.0;

        double cos = dot / (Math.sqrt(na) * Math.sqrt(nb));
        if (Double.isNaN(cos)) return 0.0;
        return Math.max(0.0, Math.min(1.0, cos));
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
