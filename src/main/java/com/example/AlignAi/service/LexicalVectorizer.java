package com.example.AlignAi.service;

import com.example.AlignAi.util.StopWords;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF over unigrams and bigrams, fitted on a small corpus and producing fixed-size L2-normalized
 * vectors. Instances are immutable; two vectors are comparable only when they come from the same
 * fitted instance.
 */
public final class LexicalVectorizer {

    public static final int DIMENSION = 1000;
    public static final int MAX_FEATURES = 1000;

    private static final Pattern WORD = Pattern.compile("\\b\\w\\w+\\b");

    private final Map<String, Integer> vocabulary;
    private final double[] idf;

    private LexicalVectorizer(Map<String, Integer> vocabulary, double[] idf) {
        this.vocabulary = vocabulary;
        this.idf = idf;
    }

    public static LexicalVectorizer fit(Collection<String> corpus) {
        Map<String, Integer> frequency = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        int n = 0;

        for (String doc : corpus) {
            if (doc == null) continue;
            n++;
            List<String> terms = terms(doc);
            for (String t : terms) frequency.merge(t, 1, Integer::sum);
            for (String t : new HashSet<>(terms)) documentFrequency.merge(t, 1, Integer::sum);
        }

        // most frequent terms win the capped slots, index order is alphabetical
        List<String> kept = frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_FEATURES)
                .map(Map.Entry::getKey)
                .sorted(Comparator.naturalOrder())
                .toList();

        Map<String, Integer> vocabulary = new TreeMap<>();
        double[] idf = new double[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            String term = kept.get(i);
            vocabulary.put(term, i);
            idf[i] = Math.log((1.0 + n) / (1.0 + documentFrequency.get(term))) + 1.0;
        }
        return new LexicalVectorizer(vocabulary, idf);
    }

    /**
     * Vector of length {@link #DIMENSION}. Empty input or text without known terms gives the zero vector.
     */
    public double[] transform(String text) {
        double[] vector = new double[DIMENSION];
        if (text == null || text.isBlank() || vocabulary.isEmpty()) return vector;

        for (String term : terms(text)) {
            Integer idx = vocabulary.get(term);
            if (idx != null) vector[idx] += 1.0;
        }

        double norm = 0.0;
        for (int i = 0; i < idf.length; i++) {
            vector[i] *= idf[i];
            norm += vector[i] * vector[i];
        }
        if (norm == 0.0) return vector;

        norm = Math.sqrt(norm);
        for (int i = 0; i < idf.length; i++) vector[i] /= norm;
        return vector;
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    public Set<String> vocabulary() {
        return vocabulary.keySet();
    }

    static List<String> terms(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String token = m.group();
            if (!StopWords.contains(token)) tokens.add(token);
        }

        List<String> terms = new ArrayList<>(tokens.size() * 2);
        terms.addAll(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            terms.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return terms;
    }
}
