package com.example.AlignAi.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExperienceAnalyzerTest {

    private final ExperienceAnalyzer analyzer = new ExperienceAnalyzer();

    @Test
    void yearsOverlapIsJaccardOfMentionedYears() {
        assertThat(analyzer.yearsOverlap("2019 to 2020", "2020 and 2021")).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(analyzer.years("since 1999, until 2100 or 20231")).containsExactly("1999");
    }

    @Test
    void missingYearsOrDomainsAreNeutral() {
        assertThat(analyzer.yearsOverlap("no years", "2020")).isEqualTo(0.5);
        assertThat(analyzer.domainMatch("nothing here", "banking platform")).isEqualTo(0.5);
    }

    @Test
    void domainsAreTaggedBySubstring() {
        assertThat(analyzer.domains("Payments at an online store running on AWS"))
                .containsExactly("fintech", "ecommerce", "cloud");
        assertThat(analyzer.domainMatch("banking", "fintech payments")).isEqualTo(1.0);
    }

    @Test
    void alignmentIsSquashedAroundOneHalf() {
        assertThat(ExperienceAnalyzer.squash(0.5)).isEqualTo(0.5);
        assertThat(ExperienceAnalyzer.squash(1.0)).isGreaterThan(0.9).isLessThan(1.0);

        ExperienceAnalyzer.Alignment a = analyzer.align(
                "5 years experience with Python and React. Senior engineer.",
                "Senior Python developer required. Must have React.");
        assertThat(a.seniorityMatch()).isEqualTo(1.0);
        assertThat(a.yearsOverlap()).isEqualTo(0.5);
        assertThat(a.raw()).isCloseTo(0.4 * 0.5 + 0.3 * 1.0 + 0.3 * 0.5, within(1e-12));
        assertThat(a.value()).isCloseTo(1 / (1 + Math.exp(-5 * (a.raw() - 0.5))), within(1e-12));
    }
}
