package com.delta.backgrounder.check.resume;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeTextParserTest {
    private final ResumeTextParser parser = new ResumeTextParser();

    @Test
    void decodesAnythingButPdfAndWordAsText() {
        byte[] bytes = "  Jane Doe\nStaff Engineer  \n".getBytes(StandardCharsets.UTF_8);

        assertThat(parser.extractText(bytes, "cv.txt", null)).isEqualTo("Jane Doe\nStaff Engineer");
        assertThat(parser.extractText(bytes, "upload", "text/markdown")).isEqualTo("Jane Doe\nStaff Engineer");
        assertThat(parser.extractText(bytes, "cv.rtf", null)).isEqualTo("Jane Doe\nStaff Engineer");
    }

    @Test
    void honoursUtf16ByteOrderMark() {
        byte[] bytes = "\uFEFFJosé García".getBytes(StandardCharsets.UTF_16LE);

        assertThat(parser.extractText(bytes, "cv.txt", null)).isEqualTo("José García");
    }

    @Test
    void extractsTextFromPdf() throws Exception {
        byte[] pdf;
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(doc, page)) {
                stream.beginText();
                stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                stream.newLineAtOffset(72, 700);
                stream.showText("Jane Doe Staff Engineer");
                stream.endText();
            }
            doc.save(out);
            pdf = out.toByteArray();
        }

        assertThat(parser.extractText(pdf, "cv.pdf", "application/pdf")).contains("Jane Doe Staff Engineer");
    }

    @Test
    void rejectsUnsupportedEmptyAndCorruptFiles() {
        assertThatThrownBy(() -> parser.extractText(new byte[] {1, 2}, "cv.docx", null))
            .isInstanceOf(ResumeParseException.class)
            .hasMessage("Unsupported resume format: cv.docx");
        assertThatThrownBy(() -> parser.extractText(new byte[0], "cv.txt", null))
            .hasMessage("Resume file is empty");
        assertThatThrownBy(() -> parser.extractText("   ".getBytes(StandardCharsets.UTF_8), "cv.txt", null))
            .hasMessage("Resume contained no extractable text");
        assertThatThrownBy(() -> parser.extractText("not a pdf".getBytes(StandardCharsets.UTF_8), "cv.pdf", null))
            .isInstanceOf(ResumeParseException.class)
            .hasMessage("Could not read PDF resume");
    }
}
