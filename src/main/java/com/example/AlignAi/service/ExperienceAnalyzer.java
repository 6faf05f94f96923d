package com.example.AlignAi.service;

import com.example.AlignAi.model.SeniorityLevel;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares the career signals of two texts: mentioned years, seniority and industry domains.
 */
@Component
public class ExperienceAnalyzer {

    private static final Pattern YEAR = Pattern.compile("\\b(19\\d{2}|20\\d{2})\\b");

    private static final double YEARS_WEIGHT = 0.4;
    private static final double SENIORITY_WEIGHT = 0.3;
    private static final double DOMAIN_WEIGHT = 0.3;
    private static final double NEUTRAL = 0.5;
    private static final double STEEPNESS = 5.0;

    private static final Map<String, List<String>> DOMAIN_TERMS = domainTerms();

    public record Alignment(double yearsOverlap, double seniorityMatch, double domainMatch, double raw, double value) {}

    public Alignment align(String resumeText, String jdText) {
        double years = yearsOverlap(resumeText, jdText);
        double seniority = seniorityMatch(resumeText, jdText);
        double domain = domainMatch(resumeText, jdText);
        double raw = YEARS_WEIGHT * years + SENIORITY_WEIGHT * seniority + DOMAIN_WEIGHT * domain;
        return new Alignment(years, seniority, domain, raw, squash(raw));
    }

    // logistic centered at 0.5
    static double squash(double x) {
        return 1.0 / (1.0 + Math.exp(-STEEPNESS * (x - 0.5)));
    }

    public double yearsOverlap(String resumeText, String jdText) {
        return jaccardOrNeutral(years(resumeText), years(jdText));
    }

    public double seniorityMatch(String resumeText, String jdText) {
        return SeniorityLevel.classify(resumeText).matchScore(SeniorityLevel.classify(jdText));
    }

    public double domainMatch(String resumeText, String jdText) {
        return jaccardOrNeutral(domains(resumeText), domains(jdText));
    }

    public Set<String> years(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) return out;
        Matcher m = YEAR.matcher(text);
        while (m.find()) out.add(m.group(1));
        return out;
    }

    public Set<String> domains(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return out;
        String lower = text.toLowerCase(Locale.ROOT);
        DOMAIN_TERMS.forEach((domain, terms) -> {
            if (terms.stream().anyMatch(lower::contains)) out.add(domain);
        });
        return out;
    }

    private static double jaccardOrNeutral(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return NEUTRAL;
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> common = new HashSet<>(a);
        common.retainAll(b);
        return (double) common.size() / union.size();
    }

    private static Map<String, List<String>> domainTerms() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("fintech", List.of("fintech", "financial", "banking", "payments", "blockchain", "cryptocurrency"));
        m.put("healthcare", List.of("healthcare", "medical", "pharmaceutical", "biotech", "clinical"));
        m.put("ecommerce", List.of("ecommerce", "retail", "shopping", "marketplace", "online store"));
        m.put("ai_ml", List.of("artificial intelligence", "machine learning", "deep learning", "neural networks"));
        m.put("cloud", List.of("cloud", "aws", "azure", "gcp", "kubernetes", "docker"));
        m.put("mobile", List.of("mobile", "ios", "android", "react native", "flutter"));
        m.put("web", List.of("web", "frontend", "backend", "full-stack", "responsive"));
        m.put("data", List.of("data", "analytics", "big data", "data science", "business intelligence"));
        return Collections.unmodifiableMap(m);
    }
}
