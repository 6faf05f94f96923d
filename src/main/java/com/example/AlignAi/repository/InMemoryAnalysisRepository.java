package com.example.AlignAi.repository;

import com.example.AlignAi.model.Analysis;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryAnalysisRepository implements AnalysisRepository {

    // insertion sequence breaks ties between equal timestamps
    private record Entry(Analysis analysis, long sequence) {}

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry e) -> createdAt(e.analysis()))
            .thenComparingLong(Entry::sequence)
            .reversed();

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void put(Analysis analysis) {
        Objects.requireNonNull(analysis, "analysis");
        store.put(analysis.getAnalysisId(), new Entry(analysis, sequence.incrementAndGet()));
    }

    @Override
    public Optional<Analysis> get(String analysisId) {
        if (analysisId == null) return Optional.empty();
        return Optional.ofNullable(store.get(analysisId)).map(Entry::analysis);
    }

    @Override
    public boolean delete(String analysisId) {
        if (analysisId == null) return false;
        return store.remove(analysisId) != null;
    }

    @Override
    public List<Analysis> list() {
        return store.values().stream().sorted(NEWEST_FIRST).map(Entry::analysis).toList();
    }

    @Override
    public List<Analysis> page(int limit, int offset) {
        if (limit <= 0 || offset < 0) return List.of();
        return store.values().stream()
                .sorted(NEWEST_FIRST)
                .skip(offset)
                .limit(limit)
                .map(Entry::analysis)
                .toList();
    }

    @Override
    public long count() {
        return store.size();
    }

    @Override
    public void clear() {
        store.clear();
    }

    private static Instant createdAt(Analysis a) {
        return a.getCreatedAt() == null ? Instant.EPOCH : a.getCreatedAt();
    }
}
