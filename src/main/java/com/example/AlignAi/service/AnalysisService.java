package com.example.AlignAi.service;

import com.example.AlignAi.dto.DocumentSummary;
import com.example.AlignAi.dto.HistoryItem;
import com.example.AlignAi.dto.StatsResponse;
import com.example.AlignAi.exception.AnalysisNotFoundException;
import com.example.AlignAi.exception.DocumentNotFoundException;
import com.example.AlignAi.exception.InvalidDocumentTypeException;
import com.example.AlignAi.exception.InvalidRequestException;
import com.example.AlignAi.model.Analysis;
import com.example.AlignAi.model.Document;
import com.example.AlignAi.model.DocumentSection;
import com.example.AlignAi.model.DocumentType;
import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.Outcome;
import com.example.AlignAi.repository.AnalysisRepository;
import com.example.AlignAi.repository.DocumentRepository;
import com.example.AlignAi.util.Sha256;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Composition root of the pipeline: ingests documents into the document store and runs analyses
 * between a stored resume and a stored job description.
 */
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    public static final int DEFAULT_HISTORY_LIMIT = 20;
    public static final int MAX_HISTORY_LIMIT = 100;
    public static final String STORAGE_TYPE = "in_memory";
    private static final String ANALYSIS_PREFIX = "analysis";

    private final TextProcessor textProcessor;
    private final SkillExtractor skillExtractor;
    private final SimilarityService similarityService;
    private final ScoringEngine scoringEngine;
    private final ExplanationGenerator explanationGenerator;
    private final DocumentRepository documents;
    private final AnalysisRepository analyses;

    public record AnalysisResult(Analysis analysis, double processingTime, Map<String, Object> metadata) {}

    public Document ingestResume(String rawText, String source) {
        return ingest(rawText, DocumentType.RESUME, source);
    }

    public Document ingestJobDescription(String rawText, String source) {
        return ingest(rawText, DocumentType.JOB_DESCRIPTION, source);
    }

    /**
     * Normalizes, segments, extracts and embeds a document, then stores it. Text identical (after
     * normalization) to an already stored document of the same type returns that document.
     */
    public Document ingest(String rawText, DocumentType type, String source) {
        long started = System.nanoTime();

        String clean = textProcessor.normalize(rawText);
        if (clean.isBlank()) {
            throw new InvalidRequestException("No text content found in " + type.label());
        }

        String hash = Sha256.hex(clean);
        Optional<Document> existing = documents.findByContentHash(type, hash);
        if (existing.isPresent()) {
            log.info("Duplicate {} ingested, reusing {}", type.label(), existing.get().getDocumentId());
            return existing.get();
        }

        List<DocumentSection> sections = textProcessor.detectSections(clean);
        Outcome<List<ExtractedSkill>> skills = skillExtractor.extract(clean);
        Outcome<Map<String, double[]>> vectors = similarityService.embedDocument(clean, sections);

        Document document = Document.builder()
                .documentId(newId(type.idPrefix()))
                .documentType(type)
                .source(source == null ? Document.SOURCE_TEXT : source)
                .contentHash(hash)
                .cleanText(clean)
                .sections(sections)
                .extractedSkills(skills.value())
                .vectors(vectors.value())
                .metadata(textProcessor.extractMetadata(clean, sections))
                .createdAt(Instant.now())
                .build();

        Document stored = documents.insertIgnoreConflict(document);
        log.info("{} {} processed in {} ms: sections={} skills={}{}",
                type.label(), stored.getDocumentId(), elapsedMillis(started),
                sections.size(), stored.getExtractedSkills().size(),
                skills.isDegraded() ? " (degraded: " + skills.failure() + ")" : "");
        return stored;
    }

    public double importance(String skillName, Document jobDescription) {
        return skillExtractor.importance(skillName, jobDescription.getCleanText());
    }

    /**
     * Scores a stored resume against a stored job description. Unknown ids and swapped document types
     * are rejected before anything is computed or stored.
     */
    public AnalysisResult analyze(String resumeId, String jdId, String targetRole) {
        long started = System.nanoTime();

        Document resume = requireDocument(resumeId, DocumentType.RESUME);
        Document jd = requireDocument(jdId, DocumentType.JOB_DESCRIPTION);

        List<String> degraded = new ArrayList<>();

        Outcome<SimilarityService.PairSimilarity> similarity =
                similarityService.compare(resume.getCleanText(), jd.getCleanText());
        collect(degraded, "similarity", similarity);

        Outcome<ScoringEngine.ScoreCard> scored = scoringEngine.score(
                resume.getExtractedSkills(), jd.getExtractedSkills(),
                similarity.value().similarity(),
                resume.getCleanText(), jd.getCleanText(), targetRole);
        collect(degraded, "scoring", scored);
        ScoringEngine.ScoreCard card = scored.value();

        Outcome<ExplanationGenerator.Explanation> explained = explanationGenerator.generate(
                resume.getExtractedSkills(), jd.getExtractedSkills(), card.components(),
                resume.getCleanText(), jd.getCleanText());
        collect(degraded, "explanation", explained);
        ExplanationGenerator.Explanation explanation = explained.value();

        Analysis analysis = Analysis.builder()
                .analysisId(newId(ANALYSIS_PREFIX))
                .resumeId(resume.getDocumentId())
                .jdId(jd.getDocumentId())
                .score(card.score())
                .components(card.components())
                .matchedSkills(explanation.matchedSkills())
                .missingSkills(explanation.missingSkills())
                .niceToHaveSkills(explanation.niceToHaveSkills())
                .strengths(explanation.strengths())
                .risks(explanation.risks())
                .recommendations(explanation.recommendations())
                .snippets(explanation.snippets())
                .createdAt(Instant.now())
                .build();
        analyses.put(analysis);

        Map<String, Object> metadata = new LinkedHashMap<>(card.metadata());
        metadata.put("role_profile", card.weights().name());
        metadata.put("target_role", targetRole);
        metadata.put("vocabulary_size", similarity.value().vocabularySize());
        if (!degraded.isEmpty()) metadata.put("degraded", List.copyOf(degraded));

        double seconds = elapsedMillis(started) / 1000.0;
        log.info("Analysis {} completed in {}s: score={} matched={} missing={}",
                analysis.getAnalysisId(), seconds, analysis.getScore(),
                analysis.getMatchedSkills().size(), analysis.getMissingSkills().size());
        return new AnalysisResult(analysis, seconds, metadata);
    }

    public List<HistoryItem> history(int limit, int offset) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new InvalidRequestException("Limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        if (offset < 0) {
            throw new InvalidRequestException("Offset must be non-negative");
        }

        return analyses.page(limit, offset).stream()
                .map(a -> new HistoryItem(
                        a.getAnalysisId(),
                        a.getScore(),
                        a.getCreatedAt(),
                        summary(a.getResumeId()),
                        summary(a.getJdId())))
                .toList();
    }

    public Analysis getAnalysis(String analysisId) {
        return analyses.get(analysisId).orElseThrow(() -> new AnalysisNotFoundException(analysisId));
    }

    public void deleteAnalysis(String analysisId) {
        if (!analyses.delete(analysisId)) throw new AnalysisNotFoundException(analysisId);
        log.info("Analysis {} deleted", analysisId);
    }

    public StatsResponse stats() {
        List<Analysis> all = analyses.list();
        double average = all.stream().mapToInt(Analysis::getScore).average().orElse(0.0);
        return new StatsResponse(
                all.size(),
                documents.countByType(DocumentType.RESUME),
                documents.countByType(DocumentType.JOB_DESCRIPTION),
                Math.round(average * 100.0) / 100.0,
                STORAGE_TYPE
        );
    }

    public void reset() {
        analyses.clear();
        documents.clear();
        log.info("All documents and analyses cleared");
    }

    private Document requireDocument(String id, DocumentType expected) {
        Document document = documents.get(id)
                .orElseThrow(() -> new DocumentNotFoundException(expected.label(), id));
        if (!document.isOfType(expected)) {
            throw new InvalidDocumentTypeException(id, expected, document.getDocumentType());
        }
        return document;
    }

    private DocumentSummary summary(String documentId) {
        return documents.get(documentId)
                .map(d -> new DocumentSummary(d.getDocumentId(), d.getExtractedSkills().size()))
                .orElse(null);
    }

    private static void collect(List<String> degraded, String stage, Outcome<?> outcome) {
        if (outcome.isDegraded()) degraded.add(stage + ": " + outcome.failure());
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
