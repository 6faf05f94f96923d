package com.example.AlignAi.service;

import com.example.AlignAi.config.UploadProperties;
import com.example.AlignAi.model.ExtractedFile;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FileExtractionServiceTest {

    private static FileExtractionService service(int maxChars) {
        UploadProperties props = new UploadProperties();
        props.setMaxExtractChars(maxChars);
        return new FileExtractionService(new TikaUniversalExtractor(props), props);
    }

    private static MockMultipartFile file(String name, String mime, String content) {
        return new MockMultipartFile("file", name, mime, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void plainTextIsDecodedDirectly() {
        ExtractedFile out = service(50_000).extract(file("cv.txt", "text/plain; charset=utf-8", "Python and React"));

        assertThat(out.failed()).isFalse();
        assertThat(out.mimeType()).isEqualTo("text/plain");
        assertThat(out.extractedText()).isEqualTo("Python and React");
        assertThat(out.sizeBytes()).isEqualTo(16);
        assertThat(out.truncated()).isFalse();
    }

    @Test
    void htmlGoesThroughTika() {
        ExtractedFile out = service(50_000).extract(file("cv.html", "text/html",
                "<html><body><h1>Skills</h1><p>Python and React</p></body></html>"));

        assertThat(out.failed()).isFalse();
        assertThat(out.extractedText()).contains("Python and React").doesNotContain("<p>");
    }

    @Test
    void textIsClampedToTheExtractionCap() {
        ExtractedFile out = service(10).extract(file("cv.txt", "text/plain", "0123456789abcdef"));

        assertThat(out.extractedText()).isEqualTo("0123456789");
        assertThat(out.truncated()).isTrue();
    }

    @Test
    void imagesAreRejected() {
        ExtractedFile out = service(50_000).extract(file("photo.png", "image/png", "not really a png"));

        assertThat(out.failed()).isTrue();
        assertThat(out.error()).contains("image/png");
        assertThat(out.isEmpty()).isTrue();
    }
}
