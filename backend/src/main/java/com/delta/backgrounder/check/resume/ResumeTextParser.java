package com.delta.backgrounder.check.resume;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Plain text of an uploaded résumé. PDFs go through PDFBox, Word documents are rejected and
 * anything else is decoded as text, honouring a UTF-16 byte order mark.
 */
@Component
public class ResumeTextParser {

    public String extractText(byte[] content, String filename, String contentType) {
        if (content == null || content.length == 0) {
            throw new ResumeParseException("Resume file is empty");
        }
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        String text;
        if (type.equals("application/pdf") || name.endsWith(".pdf")) {
            text = pdfText(content);
        } else if (isWordDocument(name, type)) {
            throw new ResumeParseException("Unsupported resume format: " + (filename == null ? type : filename));
        } else {
            text = new String(content, detectCharset(content));
        }
        if (text.isBlank()) {
            throw new ResumeParseException("Resume contained no extractable text");
        }
        return text.trim();
    }

    private static boolean isWordDocument(String name, String type) {
        return name.endsWith(".docx") || name.endsWith(".doc")
            || type.equals("application/msword")
            || type.startsWith("application/vnd.openxmlformats-officedocument.wordprocessingml");
    }

    private String pdfText(byte[] content) {
        try (PDDocument doc = Loader.loadPDF(content)) {
            return new PDFTextStripper().getText(doc);
        } catch (IOException e) {
            throw new ResumeParseException("Could not read PDF resume", e);
        }
    }

    private static Charset detectCharset(byte[] content) {
        if (content.length >= 2) {
            int b0 = content[0] & 0xFF;
            int b1 = content[1] & 0xFF;
            if ((b0 == 0xFE && b1 == 0xFF) || (b0 == 0xFF && b1 == 0xFE)) {
                return StandardCharsets.UTF_16;
            }
        }
        return StandardCharsets.UTF_8;
    }
}
