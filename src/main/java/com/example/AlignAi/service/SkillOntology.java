package com.example.AlignAi.service;

import com.example.AlignAi.model.OntologyEntry;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of canonical skills. Loaded once at startup and shared by every extraction call.
 */
public final class SkillOntology {

    public static final String DEFAULT_LOCATION = "skills/ontology.json";

    private final String version;
    private final List<OntologyEntry> entries;
    private final Map<String, OntologyEntry> byName;

    public record OntologyFile(String version, List<OntologyEntry> skills) {}

    public SkillOntology(String version, List<OntologyEntry> entries) {
        Map<String, OntologyEntry> index = new LinkedHashMap<>();
        for (OntologyEntry e : entries) {
            if (index.putIfAbsent(e.name(), e) != null) {
                throw new IllegalStateException("Duplicate ontology skill: " + e.name());
            }
        }
        this.version = version == null ? "unversioned" : version;
        this.entries = List.copyOf(index.values());
        this.byName = Collections.unmodifiableMap(index);
    }

    public static SkillOntology load(InputStream in, ObjectMapper objectMapper) throws IOException {
        OntologyFile file = objectMapper.readValue(in, OntologyFile.class);
        if (file == null || file.skills() == null || file.skills().isEmpty()) {
            throw new IllegalStateException("Skill ontology is empty");
        }
        return new SkillOntology(file.version(), file.skills());
    }

    public static SkillOntology fromClasspath(String location) {
        ClassLoader cl = SkillOntology.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(location)) {
            if (in == null) throw new IllegalStateException("Skill ontology not found on classpath: " + location);
            return load(in, new ObjectMapper());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read skill ontology " + location, e);
        }
    }

    public Optional<OntologyEntry> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(byName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public List<OntologyEntry> entries() {
        return entries;
    }

    public String version() {
        return version;
    }

    public int size() {
        return entries.size();
    }
}
