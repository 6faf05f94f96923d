package com.example.AlignAi.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Ordinal career level inferred from free text by keyword hits.
 */
public enum SeniorityLevel {
    JUNIOR(0, List.of()),
    MID(1, List.of("mid", "intermediate", "mid-level")),
    SENIOR(2, List.of("senior", "sr.", "experienced", "expert")),
    LEAD(3, List.of("lead", "principal", "architect", "director", "head"));

    private static final List<SeniorityLevel> SCAN_ORDER = List.of(LEAD, SENIOR, MID);

    private final int rank;
    private final List<String> terms;

    SeniorityLevel(int rank, List<String> terms) {
        this.rank = rank;
        this.terms = terms;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Highest level whose keyword group occurs in the text; {@link #JUNIOR} when none does.
     */
    public static SeniorityLevel classify(String text) {
        if (text == null || text.isBlank()) return JUNIOR;
        String lower = text.toLowerCase(Locale.ROOT);
        for (SeniorityLevel level : SCAN_ORDER) {
            if (level.terms.stream().anyMatch(lower::contains)) return level;
        }
        return JUNIOR;
    }

    /**
     * 1.0 for the same level, then 0.7, 0.4 and 0.1 as the levels drift apart.
     */
    public double matchScore(SeniorityLevel other) {
        return switch (Math.abs(rank - other.rank)) {
            case 0 -> 1.0;
            case 1 -> 0.7;
            case 2 -> 0.4;
            default -> 0.1;
        };
    }
}
