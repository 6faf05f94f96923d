package com.example.AlignAi.service;

import com.example.AlignAi.config.ScoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks the weight profile for a target role. Role groups are tried in configured order, a group
 * matches when one of its keywords occurs as a whole word in the role string.
 */
@Component
public class RoleWeightResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleWeightResolver.class);

    private record RoleMatcher(Pattern pattern, WeightProfile profile) {}

    private final WeightProfile defaults;
    private final List<RoleMatcher> roles;

    public RoleWeightResolver(ScoringProperties props) {
        this.defaults = toProfile(WeightProfile.DEFAULT, props.getDefaults());

        List<RoleMatcher> matchers = new ArrayList<>();
        for (ScoringProperties.RoleProfile role : props.getRoles()) {
            WeightProfile profile = toProfile(role.getName(), role.getWeights());
            List<String> keywords = role.getKeywords() == null ? List.of() : role.getKeywords();
            if (keywords.isEmpty()) {
                throw new IllegalArgumentException("Role profile '" + role.getName() + "' has no keywords");
            }
            String alternation = String.join("|", keywords.stream()
                    .map(k -> Pattern.quote(k.trim().toLowerCase(Locale.ROOT)))
                    .toList());
            matchers.add(new RoleMatcher(Pattern.compile("\\b(?:" + alternation + ")\\b"), profile));
        }
        this.roles = List.copyOf(matchers);
        log.info("Scoring weights ready: default={} roles={}", defaults.asMap(),
                roles.stream().map(r -> r.profile().name()).toList());
    }

    public WeightProfile resolve(String targetRole) {
        if (targetRole == null || targetRole.isBlank()) return defaults;
        String role = targetRole.toLowerCase(Locale.ROOT);
        for (RoleMatcher m : roles) {
            if (m.pattern().matcher(role).find()) return m.profile();
        }
        return defaults;
    }

    public WeightProfile defaults() {
        return defaults;
    }

    private static WeightProfile toProfile(String name, ScoringProperties.WeightSet w) {
        if (w == null) throw new IllegalArgumentException("Weight profile '" + name + "' is missing weights");
        return new WeightProfile(name, w.getSemantic(), w.getSkillCoverage(), w.getExperienceAlignment());
    }
}
