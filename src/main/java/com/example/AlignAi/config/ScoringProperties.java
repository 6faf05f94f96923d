package com.example.AlignAi.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Signal weights for the scoring engine. The default set applies unless the target role matches
 * one of the role profiles, checked in declaration order.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.scoring")
public class ScoringProperties {

    private WeightSet defaults = new WeightSet(0.45, 0.45, 0.10);

    private List<RoleProfile> roles = new ArrayList<>(List.of(
            new RoleProfile("ml_ai", List.of("ml", "ai", "data scientist", "machine learning"),
                    new WeightSet(0.40, 0.55, 0.05)),
            new RoleProfile("security", List.of("security", "cybersecurity", "infosec"),
                    new WeightSet(0.35, 0.50, 0.15)),
            new RoleProfile("frontend", List.of("frontend", "ui", "ux"),
                    new WeightSet(0.50, 0.40, 0.10))
    ));

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WeightSet {
        private double semantic;
        private double skillCoverage;
        private double experienceAlignment;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RoleProfile {
        private String name;
        private List<String> keywords = new ArrayList<>();
        private WeightSet weights;
    }
}
