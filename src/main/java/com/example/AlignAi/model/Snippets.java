package com.example.AlignAi.model;

import java.util.List;

public record Snippets(List<Snippet> resume, List<Snippet> jd) {

    public Snippets {
        resume = resume == null ? List.of() : List.copyOf(resume);
        jd = jd == null ? List.of() : List.copyOf(jd);
    }

    public static Snippets placeholder() {
        return new Snippets(
                List.of(new Snippet("Resume content", 0, 0)),
                List.of(new Snippet("Job description content", 0, 0))
        );
    }
}
