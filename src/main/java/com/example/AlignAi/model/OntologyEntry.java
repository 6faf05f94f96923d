package com.example.AlignAi.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One canonical skill of the ontology.
 *
 * @param name     canonical, lower-case skill name
 * @param category skill category
 * @param synonyms alternative spellings that resolve to {@code name}, in file order without duplicates
 */
public record OntologyEntry(
        String name,
        SkillCategory category,
        List<String> synonyms
) {
    public OntologyEntry {
        Objects.requireNonNull(name, "name");
        name = name.trim().toLowerCase(Locale.ROOT);
        category = category == null ? SkillCategory.OTHER : category;
        synonyms = synonyms == null ? List.of() : synonyms.stream()
                .filter(Objects::nonNull)
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
