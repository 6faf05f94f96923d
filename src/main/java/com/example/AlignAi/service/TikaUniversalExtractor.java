package com.example.AlignAi.service;

import com.example.AlignAi.config.UploadProperties;
import org.apache.tika.exception.TikaException;
import org.apache.tika.extractor.EmbeddedDocumentExtractor;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Plain text out of PDF, DOCX and the other formats Tika can parse.
 */
@Service
public class TikaUniversalExtractor {

    private final AutoDetectParser parser = new AutoDetectParser();
    private final int maxChars;

    public TikaUniversalExtractor(UploadProperties props) {
        this.maxChars = props.getMaxExtractChars();
    }

    public TikaResult extract(byte[] bytes, String filename, String declaredMimeOrNull)
            throws IOException, SAXException, TikaException {
        Metadata md = new Metadata();
        if (filename != null && !filename.isBlank()) {
            md.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        if (declaredMimeOrNull != null && !declaredMimeOrNull.isBlank()) {
            md.set(Metadata.CONTENT_TYPE, declaredMimeOrNull);
        }

        BodyContentHandler handler = new BodyContentHandler(maxChars);
        ParseContext ctx = new ParseContext();
        // attachments inside a resume are not part of its text
        ctx.set(EmbeddedDocumentExtractor.class, new EmbeddedDocumentExtractor() {
            @Override
            public boolean shouldParseEmbedded(Metadata metadata) {
                return false;
            }

            @Override
            public void parseEmbedded(InputStream stream, ContentHandler handler, Metadata metadata, boolean outputHtml) {
                // skipped
            }
        });

        boolean truncated = false;
        try (InputStream is = new ByteArrayInputStream(bytes)) {
            try {
                parser.parse(is, handler, md, ctx);
            } catch (SAXException sax) {
                // BodyContentHandler signals its write limit with a SAXException
                String msg = sax.getMessage() == null ? "" : sax.getMessage().toLowerCase(Locale.ROOT);
                truncated = msg.contains("write limit") || msg.contains("your document contained more than");
                if (!truncated) throw sax;
            }
        }

        return new TikaResult(handler.toString(), md.get(Metadata.CONTENT_TYPE), truncated);
    }

    public record TikaResult(String text, String detectedMime, boolean truncated) {}
}
