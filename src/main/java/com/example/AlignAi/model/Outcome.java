package com.example.AlignAi.model;

/**
 * Result of a pipeline step that never throws: a usable value, plus the failure reason when the
 * value is a fallback.
 */
public record Outcome<T>(T value, String failure) {

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> degraded(T fallback, String failure) {
        return new Outcome<>(fallback, failure == null || failure.isBlank() ? "unknown failure" : failure);
    }

    public static <T> Outcome<T> degraded(T fallback, Throwable cause) {
        return degraded(fallback, describe(cause));
    }

    public boolean isDegraded() {
        return failure != null;
    }

    public static String describe(Throwable ex) {
        if (ex == null) return "";
        String m = ex.getClass().getSimpleName() + ": " + ex.getMessage();
        m = m.replaceAll("\\s+", " ").trim();
        if (m.length() > 300) m = m.substring(0, 300) + "...";
        return m;
    }
}
