package com.adlanda.ragassistant.service.extraction;

import com.adlanda.ragassistant.model.DocumentFormat;
import com.adlanda.ragassistant.model.Page;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfTextExtractorTest {

    private PdfTextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PdfTextExtractor();
    }

    @Test
    void extract_textPages_returnsPagesWithInfo() throws IOException {
        byte[] pdf = buildPdf("Quarterly Report", List.of(
                List.of("Revenue grew in Q3", "Costs were flat"),
                List.of("Outlook is positive")
        ));

        ExtractionResult result = extractor.extract(pdf);

        assertThat(result).isInstanceOf(ExtractionResult.Extracted.class);
        ExtractionResult.Extracted extracted = (ExtractionResult.Extracted) result;
        assertThat(extracted.pages()).extracting(Page::pageNumber).containsExactly(1, 2);
        assertThat(extracted.pages().get(0).text()).isEqualTo("Revenue grew in Q3 Costs were flat");
        assertThat(extracted.pages().get(1).text()).isEqualTo("Outlook is positive");
        assertThat(extracted.info().title()).isEqualTo("Quarterly Report");
        assertThat(extracted.info().author()).isEqualTo("Finance Team");
        assertThat(extracted.info().subject()).isEmpty();
        assertThat(extracted.info().totalPages()).isEqualTo(2);
    }

    @Test
    void extract_blankPageInTheMiddle_isDroppedAndNumbersKept() throws IOException {
        byte[] pdf = buildPdf(null, List.of(
                List.of("First page"),
                List.of(),
                List.of("Third page")
        ));

        ExtractionResult.Extracted extracted = (ExtractionResult.Extracted) extractor.extract(pdf);

        assertThat(extracted.pages()).extracting(Page::pageNumber).containsExactly(1, 3);
        assertThat(extracted.info().totalPages()).isEqualTo(3);
    }

    @Test
    void extract_pdfWithoutText_returnsEmpty() throws IOException {
        byte[] pdf = buildPdf(null, List.of(List.of(), List.of()));

        ExtractionResult result = extractor.extract(pdf);

        assertThat(result).isInstanceOf(ExtractionResult.Empty.class);
        assertThat(((ExtractionResult.Empty) result).info().totalPages()).isEqualTo(2);
    }

    @Test
    void extract_notAPdf_returnsFailed() {
        ExtractionResult result = extractor.extract("definitely not a pdf".getBytes(StandardCharsets.UTF_8));

        assertThat(result).isInstanceOf(ExtractionResult.Failed.class);
        assertThat(((ExtractionResult.Failed) result).reason()).startsWith("Failed to parse PDF");
    }

    @Test
    void supports_onlyPdf() {
        assertThat(extractor.supports(DocumentFormat.PDF)).isTrue();
        assertThat(extractor.supports(DocumentFormat.DOCX)).isFalse();
        assertThat(extractor.supports(DocumentFormat.DOC)).isFalse();
    }

    /**
     * Builds a PDF with one page per entry; each string is written on its own line.
     */
    static byte[] buildPdf(String title, List<List<String>> pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<String> lines : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (lines.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(font, 12);
                    content.newLineAtOffset(72, 700);
                    for (String line : lines) {
                        content.showText(line);
                        content.newLineAtOffset(0, -20);
                    }
                    content.endText();
                }
            }
            if (title != null) {
                document.getDocumentInformation().setTitle(title);
                document.getDocumentInformation().setAuthor("Finance Team");
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
