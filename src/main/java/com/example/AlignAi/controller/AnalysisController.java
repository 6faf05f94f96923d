package com.example.AlignAi.controller;

import com.example.AlignAi.config.UploadProperties;
import com.example.AlignAi.dto.AnalysisEnvelope;
import com.example.AlignAi.dto.AnalyzeRequest;
import com.example.AlignAi.dto.AnalyzeResponse;
import com.example.AlignAi.dto.HealthResponse;
import com.example.AlignAi.dto.HistoryResponse;
import com.example.AlignAi.dto.JobSkillView;
import com.example.AlignAi.dto.MessageResponse;
import com.example.AlignAi.dto.SkillView;
import com.example.AlignAi.dto.StatsResponse;
import com.example.AlignAi.dto.UploadJobResponse;
import com.example.AlignAi.dto.UploadResumeResponse;
import com.example.AlignAi.exception.InvalidRequestException;
import com.example.AlignAi.model.Document;
import com.example.AlignAi.model.DocumentSection;
import com.example.AlignAi.model.ExtractedFile;
import com.example.AlignAi.service.AnalysisService;
import com.example.AlignAi.service.FileExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.Duration;
import java.time.Instant;

@RestController
@RequestMapping("/api/v1")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    static final int TOP_SKILLS = 10;

    private final AnalysisService analysisService;
    private final FileExtractionService fileExtractionService;
    private final UploadProperties limits;
    private final Instant startedAt = Instant.now();

    public AnalysisController(AnalysisService analysisService,
                              FileExtractionService fileExtractionService,
                              UploadProperties limits) {
        this.analysisService = analysisService;
        this.fileExtractionService = fileExtractionService;
        this.limits = limits;
    }

    @PostMapping(value = "/upload-resume", consumes = {
            MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE})
    public UploadResumeResponse uploadResume(@RequestParam(value = "text", required = false) String text) {
        requireText(text, "Resume", limits.getMaxResumeChars());
        return resumeResponse(analysisService.ingestResume(text, Document.SOURCE_TEXT));
    }

    @PostMapping(value = "/upload-resume/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadResumeResponse uploadResumeFile(@RequestParam("file") MultipartFile file) {
        String text = extract(file, "Resume", limits.getMaxResumeChars());
        return resumeResponse(analysisService.ingestResume(text, Document.SOURCE_FILE));
    }

    @PostMapping(value = "/upload-job", consumes = {
            MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE})
    public UploadJobResponse uploadJob(@RequestParam(value = "text", required = false) String text) {
        requireText(text, "Job description", limits.getMaxJobChars());
        return jobResponse(analysisService.ingestJobDescription(text, Document.SOURCE_TEXT));
    }

    @PostMapping(value = "/upload-job/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadJobResponse uploadJobFile(@RequestParam("file") MultipartFile file) {
        String text = extract(file, "Job description", limits.getMaxJobChars());
        return jobResponse(analysisService.ingestJobDescription(text, Document.SOURCE_FILE));
    }

    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AnalyzeResponse analyze(@RequestBody AnalyzeRequest request) {
        if (request == null || isBlank(request.resumeId()) || isBlank(request.jdId())) {
            throw new InvalidRequestException("resume_id and jd_id are required");
        }
        AnalysisService.AnalysisResult result =
                analysisService.analyze(request.resumeId(), request.jdId(), request.targetRole());
        return new AnalyzeResponse(result.analysis(), result.processingTime(), result.metadata());
    }

    @GetMapping("/history")
    public HistoryResponse history(@RequestParam(defaultValue = "20") int limit,
                                   @RequestParam(defaultValue = "0") int offset) {
        return new HistoryResponse(analysisService.history(limit, offset));
    }

    @GetMapping("/analysis/{analysisId}")
    public AnalysisEnvelope getAnalysis(@PathVariable String analysisId) {
        return new AnalysisEnvelope(analysisService.getAnalysis(analysisId));
    }

    @DeleteMapping("/analysis/{analysisId}")
    public MessageResponse deleteAnalysis(@PathVariable String analysisId) {
        analysisService.deleteAnalysis(analysisId);
        return new MessageResponse("Analysis deleted successfully");
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", Duration.between(startedAt, Instant.now()).toSeconds());
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return analysisService.stats();
    }

    @PostMapping("/reset")
    public MessageResponse reset() {
        analysisService.reset();
        return new MessageResponse("System data cleared successfully");
    }

    private UploadResumeResponse resumeResponse(Document d) {
        return new UploadResumeResponse(
                d.getDocumentId(),
                d.getSections().stream().map(DocumentSection::name).toList(),
                d.getExtractedSkills().stream().limit(TOP_SKILLS).map(SkillView::of).toList());
    }

    private UploadJobResponse jobResponse(Document d) {
        return new UploadJobResponse(
                d.getDocumentId(),
                d.getExtractedSkills().stream()
                        .limit(TOP_SKILLS)
                        .map(s -> JobSkillView.of(s, analysisService.importance(s.name(), d)))
                        .toList());
    }

    private String extract(MultipartFile file, String label, int maxChars) {
        if (file == null || file.isEmpty()) {
            throw new InvalidRequestException(label + " file is required");
        }
        ExtractedFile extracted = fileExtractionService.extract(file);
        if (extracted.failed()) {
            throw new InvalidRequestException("Could not read " + extracted.filename() + ": " + extracted.error());
        }
        if (extracted.isEmpty()) {
            throw new InvalidRequestException("No text content found in " + extracted.filename());
        }
        String text = extracted.extractedText();
        if (extracted.truncated() || text.length() > maxChars) {
            throw new InvalidRequestException(label + " text too long (max " + maxChars + " characters)");
        }
        log.info("{} file {} extracted: {} chars", label, extracted.filename(), text.length());
        return text;
    }

    private static void requireText(String text, String label, int maxChars) {
        if (isBlank(text)) throw new InvalidRequestException(label + " text is required");
        if (text.length() > maxChars) {
            throw new InvalidRequestException(label + " text too long (max " + maxChars + " characters)");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
