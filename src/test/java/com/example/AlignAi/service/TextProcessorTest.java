package com.example.AlignAi.service;

import com.example.AlignAi.model.DocumentMetadata;
import com.example.AlignAi.model.DocumentSection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class TextProcessorTest {

    private final TextProcessor processor = new TextProcessor();

    @Test
    void normalizeIsIdempotent() {
        List<String> samples = List.of(
                "Hello   world\r\n\r\n\r\n\r\n• item one\n  * item two",
                "“Quoted” — text with ‘single’ quotes – and dashes",
                "well - known   full - stack dev.Next sentence!Another one",
                "ﬁne ligatures and ① circled digits\t\ttabs",
                "Skills ● Java ● Python ▪ Go",
                "*• starred bullet\n\u00a0+• plus bullet",
                "   ",
                "a - b - c - d"
        );
        for (String s : samples) {
            String once = processor.normalize(s);
            assertThat(processor.normalize(once)).as("normalize twice: %s", s).isEqualTo(once);
        }
    }

    @Test
    void normalizeIsIdempotentOverRandomPunctuationAndBullets() {
        String[] alphabet = {" ", "\t", "\n", "\r", "\u00a0", "\u3000", "*", "+", "-", "•", "‣", "●", "—", "–",
                "a", "b", "B", ".", "!", "x"};
        Random random = new Random(20240501L);
        for (int i = 0; i < 50_000; i++) {
            StringBuilder sb = new StringBuilder();
            int length = random.nextInt(15);
            for (int j = 0; j < length; j++) sb.append(alphabet[random.nextInt(alphabet.length)]);
            String input = sb.toString();

            String once = processor.normalize(input);
            assertThat(processor.normalize(once)).as("normalize twice: [%s]", input).isEqualTo(once);
        }
    }

    @Test
    void bulletGluedToLineMarkerCollapsesInOnePass() {
        assertThat(processor.normalize("*•")).isEqualTo("- -");
        assertThat(processor.normalize("\u00a0+• item")).isEqualTo("- - item");
    }

    @Test
    void normalizeCanonicalizesPunctuationAndWhitespace() {
        assertThat(processor.normalize("“Quoted”   text")).isEqualTo("\"Quoted\" text");
        assertThat(processor.normalize("Hello   world\r\n\r\n\r\n\r\n• item one\n  * item two"))
                .isEqualTo("Hello world\n\n- item one\n- item two");
        assertThat(processor.normalize("full - stack developer")).isEqualTo("full-stack developer");
        assertThat(processor.normalize("Done.Next step")).isEqualTo("Done. Next step");
        assertThat(processor.normalize(null)).isEmpty();
    }

    @Test
    void detectSectionsSplitsOnHeaders() {
        String text = String.join("\n",
                "John Doe",
                "SUMMARY",
                "Backend engineer.",
                "EXPERIENCE",
                "Acme Corp 2019-2023",
                "SKILLS: Java, Python",
                "EDUCATION",
                "BSc Computer Science");

        List<DocumentSection> sections = processor.detectSections(text);

        assertThat(sections).extracting(DocumentSection::name)
                .containsExactly("content", "summary", "experience", "skills", "education");
        assertThat(sections.get(3).text()).isEqualTo("Java, Python");
        assertThat(sections.get(2).text()).isEqualTo("Acme Corp 2019-2023");
        assertThat(sections.get(4).startLine()).isEqualTo(6);
        assertThat(sections.get(4).endLine()).isEqualTo(7);
    }

    @Test
    void proseStartingWithHeaderWordIsNotAHeader() {
        String text = String.join("\n",
                "SKILLS",
                "Java and Python",
                "Experience with distributed systems at scale for many years");

        List<DocumentSection> sections = processor.detectSections(text);

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).name()).isEqualTo("skills");
        assertThat(sections.get(0).text()).contains("Experience with distributed systems");
    }

    @Test
    void noHeadersFallsBackToFourChunks() {
        String text = "line one\nline two\nline three\nline four\nline five";

        List<DocumentSection> sections = processor.detectSections(text);

        assertThat(sections).extracting(DocumentSection::name)
                .containsExactly("summary", "experience", "skills", "education");
        assertThat(sections.get(3).text()).isEqualTo("line four\nline five");
    }

    @Test
    void shortTextWithoutHeadersOmitsLaterChunks() {
        List<DocumentSection> sections = processor.detectSections("alpha\nbeta");

        assertThat(sections).extracting(DocumentSection::name).containsExactly("summary", "experience");
    }

    @Test
    void nonEmptyInputAlwaysYieldsASection() {
        assertThat(processor.detectSections("x")).hasSize(1);
        assertThat(processor.detectSections("")).isEmpty();
    }

    @Test
    void contentHashIgnoresFormattingNoise() {
        assertThat(processor.contentHash("Hello   world")).isEqualTo(processor.contentHash("Hello world\n"));
        assertThat(processor.contentHash("Hello world")).hasSize(64);
        assertThat(processor.contentHash("")).isEmpty();
    }

    @Test
    void extractMetadataCountsText() {
        String text = "Java dev\nPython 3";
        DocumentMetadata md = processor.extractMetadata(text, processor.detectSections(text));

        assertThat(md.wordCount()).isEqualTo(4);
        assertThat(md.lineCount()).isEqualTo(2);
        assertThat(md.characterCount()).isEqualTo(text.length());
        assertThat(md.englishRatio()).isEqualTo(13.0 / 14.0);
        assertThat(processor.extractMetadata("", List.of())).isEqualTo(DocumentMetadata.empty());
    }
}
