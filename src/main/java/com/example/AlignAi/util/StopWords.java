package com.example.AlignAi.util;

import java.util.Set;

/**
 * English stop words dropped before term counting.
 */
public final class StopWords {

    private StopWords() {}

    private static final Set<String> ENGLISH = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "also", "am", "an", "and", "any", "are",
            "as", "at", "be", "because", "been", "before", "being", "below", "between", "both", "but", "by",
            "can", "could", "did", "do", "does", "doing", "down", "during", "each", "etc", "few", "for", "from",
            "further", "had", "has", "have", "having", "he", "her", "here", "hers", "herself", "him", "himself",
            "his", "how", "however", "if", "in", "into", "is", "it", "its", "itself", "just", "least", "less",
            "may", "me", "might", "more", "most", "much", "must", "my", "myself", "no", "nor", "not", "now",
            "of", "off", "on", "once", "only", "or", "other", "our", "ours", "ourselves", "out", "over", "own",
            "per", "same", "she", "should", "so", "some", "such", "than", "that", "the", "their", "theirs",
            "them", "themselves", "then", "there", "these", "they", "this", "those", "through", "thus", "to",
            "too", "under", "until", "up", "upon", "us", "very", "via", "was", "we", "well", "were", "what",
            "when", "where", "whether", "which", "while", "who", "whom", "whose", "why", "will", "with",
            "within", "without", "would", "yet", "you", "your", "yours", "yourself", "yourselves"
    );

    public static boolean contains(String token) {
        return token != null && ENGLISH.contains(token);
    }
}
