package com.example.AlignAi.repository;

import com.example.AlignAi.model.Analysis;

import java.util.List;
import java.util.Optional;

public interface AnalysisRepository {

    void put(Analysis analysis);

    Optional<Analysis> get(String analysisId);

    boolean delete(String analysisId);

    /**
     * All analyses, newest first.
     */
    List<Analysis> list();

    List<Analysis> page(int limit, int offset);

    long count();

    void clear();
}
