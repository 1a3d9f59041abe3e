package com.adlanda.ragassistant.service.extraction;

import com.adlanda.ragassistant.model.DocumentFormat;
import com.adlanda.ragassistant.model.Page;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link TextExtractor} for PDF documents, using Apache PDFBox 3.x.
 *
 * <p>Each page's text fragments are ordered top to bottom by their vertical position, joined
 * with newlines and collapsed to single spaces. Pages without text are dropped, so a scanned
 * PDF yields {@link ExtractionResult.Empty}.
 */
@Service
public class PdfTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    @Override
    public ExtractionResult extract(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            DocumentInfo info = readInfo(document);
            log.info("Opened PDF: {} pages, title '{}'", info.totalPages(), info.title());

            List<Page> pages = new ArrayList<>();
            FragmentStripper stripper = new FragmentStripper();

            for (int pageNumber = 1; pageNumber <= document.getNumberOfPages(); pageNumber++) {
                String text = stripper.pageText(document, pageNumber);
                if (!text.isEmpty()) {
                    pages.add(new Page(pageNumber, text));
                    log.debug("Extracted {} characters from page {}", text.length(), pageNumber);
                }
            }

            if (pages.isEmpty()) {
                log.warn("No text found in PDF, it might be scanned or image-based");
            }
            return ExtractionResult.of(pages, info);

        } catch (IOException e) {
            log.error("PDFBox parsing failed: {}", e.getMessage());
            return new ExtractionResult.Failed("Failed to parse PDF: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.PDF;
    }

    private DocumentInfo readInfo(PDDocument document) {
        PDDocumentInformation information = document.getDocumentInformation();
        return new DocumentInfo(
                information.getTitle(),
                information.getAuthor(),
                information.getSubject(),
                document.getNumberOfPages()
        );
    }

    /**
     * Collects text fragments with the vertical position of their first glyph.
     */
    private static final class FragmentStripper extends PDFTextStripper {

        private final List<Fragment> fragments = new ArrayList<>();

        FragmentStripper() throws IOException {
            super();
        }

        String pageText(PDDocument document, int pageNumber) throws IOException {
            fragments.clear();
            setStartPage(pageNumber);
            setEndPage(pageNumber);
            getText(document);

            return fragments.stream()
                    .sorted(Comparator.comparingDouble(Fragment::y))
                    .map(Fragment::text)
                    .collect(Collectors.joining("\n"))
                    .replaceAll("\\s+", " ")
                    .trim();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            float y = textPositions.isEmpty() ? lastY() : textPositions.get(0).getYDirAdj();
            fragments.add(new Fragment(y, text));
        }

        private float lastY() {
            return fragments.isEmpty() ? 0f : fragments.get(fragments.size() - 1).y();
        }
    }

    private record Fragment(float y, String text) {}
}
