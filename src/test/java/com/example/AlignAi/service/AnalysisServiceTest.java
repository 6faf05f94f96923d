package com.example.AlignAi.service;

import com.example.AlignAi.config.ScoringProperties;
import com.example.AlignAi.dto.HistoryItem;
import com.example.AlignAi.dto.StatsResponse;
import com.example.AlignAi.exception.AnalysisNotFoundException;
import com.example.AlignAi.exception.DocumentNotFoundException;
import com.example.AlignAi.exception.InvalidDocumentTypeException;
import com.example.AlignAi.exception.InvalidRequestException;
import com.example.AlignAi.model.Analysis;
import com.example.AlignAi.model.Document;
import com.example.AlignAi.model.DocumentType;
import com.example.AlignAi.model.ExtractedSkill;
import com.example.AlignAi.model.MatchedSkill;
import com.example.AlignAi.repository.InMemoryAnalysisRepository;
import com.example.AlignAi.repository.InMemoryDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisServiceTest {

    private static final SkillOntology ONTOLOGY = SkillOntology.fromClasspath(SkillOntology.DEFAULT_LOCATION);

    private static final String RESUME = "5 years experience with Python and React. Senior engineer.";
    private static final String JD = "Senior Python developer required. Must have React.";

    private InMemoryDocumentRepository documents;
    private InMemoryAnalysisRepository analyses;
    private AnalysisService service;

    @BeforeEach
    void setUp() {
        SkillExtractor extractor = new SkillExtractor(ONTOLOGY);
        documents = new InMemoryDocumentRepository();
        analyses = new InMemoryAnalysisRepository();
        service = new AnalysisService(
                new TextProcessor(),
                extractor,
                new SimilarityService(),
                new ScoringEngine(extractor, new ExperienceAnalyzer(), new RoleWeightResolver(new ScoringProperties())),
                new ExplanationGenerator(extractor),
                documents,
                analyses);
    }

    @Test
    void ingestStoresProcessedDocument() {
        Document resume = service.ingestResume(RESUME, null);

        assertThat(resume.getDocumentId()).startsWith("resume_").hasSize("resume_".length() + 8);
        assertThat(resume.getDocumentType()).isEqualTo(DocumentType.RESUME);
        assertThat(resume.getSource()).isEqualTo(Document.SOURCE_TEXT);
        assertThat(resume.getContentHash()).hasSize(64);
        assertThat(resume.getExtractedSkills()).extracting(ExtractedSkill::name)
                .containsExactlyInAnyOrder("python", "react");
        assertThat(resume.getVectors()).containsKey(SimilarityService.DOCUMENT_VECTOR);
        assertThat(documents.get(resume.getDocumentId())).contains(resume);

        Document jd = service.ingestJobDescription(JD, Document.SOURCE_FILE);
        assertThat(jd.getDocumentId()).startsWith("jd_");
        assertThat(jd.getSource()).isEqualTo(Document.SOURCE_FILE);
    }

    @Test
    void identicalTextIsDeduplicatedPerType() {
        Document first = service.ingestResume(RESUME, null);
        Document second = service.ingestResume(RESUME, null);
        Document asJob = service.ingestJobDescription(RESUME, null);

        assertThat(second.getDocumentId()).isEqualTo(first.getDocumentId());
        assertThat(asJob.getDocumentId()).isNotEqualTo(first.getDocumentId());
        assertThat(documents.countByType(DocumentType.RESUME)).isEqualTo(1);
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> service.ingestResume("   \n  ", null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("No text content found in resume");
        assertThat(documents.list()).isEmpty();
    }

    @Test
    void analyzeMatchesResumeAgainstJobDescription() {
        Document resume = service.ingestResume(RESUME, null);
        Document jd = service.ingestJobDescription(JD, null);

        AnalysisService.AnalysisResult result = service.analyze(resume.getDocumentId(), jd.getDocumentId(), null);
        Analysis analysis = result.analysis();

        assertThat(analysis.getAnalysisId()).startsWith("analysis_");
        assertThat(analysis.getResumeId()).isEqualTo(resume.getDocumentId());
        assertThat(analysis.getJdId()).isEqualTo(jd.getDocumentId());
        assertThat(analysis.getScore()).isBetween(0, 100);
        assertThat(analysis.getComponents().skillCoverage()).isEqualTo(1.0);
        assertThat(analysis.getMatchedSkills()).extracting(MatchedSkill::name)
                .containsExactlyInAnyOrder("python", "react");
        assertThat(analysis.getMissingSkills()).isEmpty();
        assertThat(analysis.getStrengths()).isNotEmpty();
        assertThat(analysis.getRisks()).isNotEmpty();
        assertThat(analysis.getRecommendations()).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(analysis.getCreatedAt()).isNotNull();

        assertThat(result.processingTime()).isGreaterThanOrEqualTo(0.0);
        assertThat(result.metadata())
                .containsKeys("weights_used", "skill_coverage_details", "experience_details", "vocabulary_size")
                .containsEntry("role_profile", "default")
                .doesNotContainKey("degraded");
        assertThat(service.getAnalysis(analysis.getAnalysisId())).isSameAs(analysis);
    }

    @Test
    void unknownDocumentStoresNothing() {
        Document jd = service.ingestJobDescription(JD, null);

        assertThatThrownBy(() -> service.analyze("resume_missing", jd.getDocumentId(), null))
                .isInstanceOf(DocumentNotFoundException.class)
                .hasMessage("Resume not found: resume_missing");
        assertThat(analyses.count()).isZero();
    }

    @Test
    void swappedDocumentTypesAreRejected() {
        Document resume = service.ingestResume(RESUME, null);
        Document jd = service.ingestJobDescription(JD, null);

        assertThatThrownBy(() -> service.analyze(jd.getDocumentId(), resume.getDocumentId(), null))
                .isInstanceOf(InvalidDocumentTypeException.class)
                .hasMessage("Document " + jd.getDocumentId() + " is a job description, expected a resume");
        assertThat(analyses.count()).isZero();
    }

    @Test
    void historyListsAnalysesWithDocumentSummaries() {
        Document resume = service.ingestResume(RESUME, null);
        Document jd = service.ingestJobDescription(JD, null);
        Analysis analysis = service.analyze(resume.getDocumentId(), jd.getDocumentId(), "Backend Engineer").analysis();

        List<HistoryItem> items = service.history(AnalysisService.DEFAULT_HISTORY_LIMIT, 0);

        assertThat(items).hasSize(1);
        HistoryItem item = items.get(0);
        assertThat(item.analysisId()).isEqualTo(analysis.getAnalysisId());
        assertThat(item.score()).isEqualTo(analysis.getScore());
        assertThat(item.resumeSummary().documentId()).isEqualTo(resume.getDocumentId());
        assertThat(item.resumeSummary().skillsCount()).isEqualTo(2);
        assertThat(item.jdSummary().documentId()).isEqualTo(jd.getDocumentId());
        assertThat(service.history(10, 1)).isEmpty();
    }

    @Test
    void historyRejectsOutOfRangePaging() {
        assertThatThrownBy(() -> service.history(0, 0)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.history(101, 0)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.history(10, -1)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void deleteStatsAndReset() {
        Document resume = service.ingestResume(RESUME, null);
        Document jd = service.ingestJobDescription(JD, null);
        Analysis analysis = service.analyze(resume.getDocumentId(), jd.getDocumentId(), null).analysis();

        StatsResponse stats = service.stats();
        assertThat(stats.totalAnalyses()).isEqualTo(1);
        assertThat(stats.totalResumes()).isEqualTo(1);
        assertThat(stats.totalJobDescriptions()).isEqualTo(1);
        assertThat(stats.averageScore()).isEqualTo((double) analysis.getScore());
        assertThat(stats.storageType()).isEqualTo("in_memory");

        service.deleteAnalysis(analysis.getAnalysisId());
        assertThatThrownBy(() -> service.getAnalysis(analysis.getAnalysisId()))
                .isInstanceOf(AnalysisNotFoundException.class);
        assertThatThrownBy(() -> service.deleteAnalysis(analysis.getAnalysisId()))
                .isInstanceOf(AnalysisNotFoundException.class);

        service.reset();
        StatsResponse empty = service.stats();
        assertThat(empty.totalResumes()).isZero();
        assertThat(empty.totalJobDescriptions()).isZero();
        assertThat(empty.averageScore()).isZero();
    }
}
