package com.example.AlignAi.service;

import com.example.AlignAi.config.UploadProperties;
import com.example.AlignAi.model.ExtractedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Reduces an uploaded file to plain text before it reaches the pipeline. Failures are reported on the
 * returned {@link ExtractedFile}, never thrown. Text beyond the extraction cap is cut and flagged as
 * truncated.
 */
@Service
public class FileExtractionService {

    private static final Logger log = LoggerFactory.getLogger(FileExtractionService.class);

    private final TikaUniversalExtractor tika;
    private final int maxExtractChars;

    public FileExtractionService(TikaUniversalExtractor tika, UploadProperties props) {
        this.tika = tika;
        this.maxExtractChars = props.getMaxExtractChars();
    }

    public ExtractedFile extract(MultipartFile file) {
        String filename = file.getOriginalFilename();
        String mime = normalizeMime(file.getContentType());
        long size = file.getSize();

        if (isImage(mime)) {
            return new ExtractedFile(filename, mime, size, "", false, "Image uploads are not supported: " + mime);
        }

        try {
            byte[] bytes = file.getBytes();
            String text;
            boolean truncated;
            if (isPlainText(mime)) {
                text = new String(bytes, StandardCharsets.UTF_8);
                truncated = text.length() > maxExtractChars;
            } else {
                TikaUniversalExtractor.TikaResult result = tika.extract(bytes, filename, mime);
                text = result.text();
                truncated = result.truncated() || text.length() > maxExtractChars;
            }
            if (truncated) {
                log.info("Extraction of {} stopped at {} chars", filename, maxExtractChars);
                text = clamp(text, maxExtractChars);
            }
            log.debug("Extracted {} chars from {} ({}, {} bytes)", text.length(), filename, mime, size);
            return new ExtractedFile(filename, mime, size, text, truncated, null);
        } catch (Exception ex) {
            log.warn("File extraction failed for {}: {}", filename, ex.toString());
            return new ExtractedFile(filename, mime, size, "", false, ex.toString());
        }
    }

    private static boolean isImage(String mime) {
        return mime.startsWith("image/");
    }

    private static boolean isPlainText(String mime) {
        return (mime.startsWith("text/") && !mime.equals("text/html"))
                || mime.equals("application/json")
                || mime.equals("application/xml")
                || mime.endsWith("+json")
                || mime.endsWith("+xml");
    }

    private static String normalizeMime(String mime) {
        if (mime == null) return "application/octet-stream";
        String m = mime.toLowerCase(Locale.ROOT);
        int semi = m.indexOf(';');
        return semi > 0 ? m.substring(0, semi).trim() : m.trim();
    }

    private static String clamp(String s, int maxChars) {
        if (s == null) return "";
        if (s.length() <= maxChars) return s;
        return s.substring(0, maxChars);
    }
}
